package com.kbchat.error;

public class GenerationException extends KbChatException {
    public GenerationException(String message) {
        super(ErrorCategory.INTERNAL, message);
    }

    public GenerationException(String message, Throwable cause) {
        super(ErrorCategory.INTERNAL, message, cause);
    }
}
