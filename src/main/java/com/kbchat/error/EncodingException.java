package com.kbchat.error;

public class EncodingException extends KbChatException {
    public EncodingException(String message) {
        super(ErrorCategory.CLIENT_INPUT, message);
    }

    public EncodingException(String message, Throwable cause) {
        super(ErrorCategory.CLIENT_INPUT, message, cause);
    }
}
