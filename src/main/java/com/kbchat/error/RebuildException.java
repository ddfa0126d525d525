package com.kbchat.error;

public class RebuildException extends KbChatException {
    public RebuildException(String message) {
        super(ErrorCategory.INTERNAL, message);
    }

    public RebuildException(String message, Throwable cause) {
        super(ErrorCategory.INTERNAL, message, cause);
    }
}
