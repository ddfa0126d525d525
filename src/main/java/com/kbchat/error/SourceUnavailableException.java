package com.kbchat.error;

public class SourceUnavailableException extends KbChatException {
    public SourceUnavailableException(String message, Throwable cause) {
        super(ErrorCategory.UNAVAILABLE, message, cause);
    }
}
