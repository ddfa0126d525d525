package com.kbchat.error;

public class NoMatchException extends KbChatException {
    public NoMatchException(String message) {
        super(ErrorCategory.NOT_FOUND, message);
    }
}
