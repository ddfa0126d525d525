package com.kbchat.error;

public class InvalidRequestException extends KbChatException {
    public InvalidRequestException(String message) {
        super(ErrorCategory.CLIENT_INPUT, message);
    }
}
