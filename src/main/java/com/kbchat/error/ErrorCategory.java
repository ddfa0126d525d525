package com.kbchat.error;

public enum ErrorCategory {
    CLIENT_INPUT(2),
    NOT_FOUND(3),
    UNAVAILABLE(4),
    INTERNAL(1);

    private final int exitCode;

    ErrorCategory(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
