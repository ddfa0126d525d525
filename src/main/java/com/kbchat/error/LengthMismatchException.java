package com.kbchat.error;

public class LengthMismatchException extends KbChatException {
    public LengthMismatchException(int vectors, int ids) {
        super(ErrorCategory.INTERNAL, "Got " + vectors + " vectors but " + ids + " ids");
    }
}
