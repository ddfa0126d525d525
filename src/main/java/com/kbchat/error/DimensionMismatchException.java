package com.kbchat.error;

public class DimensionMismatchException extends KbChatException {
    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super(ErrorCategory.CLIENT_INPUT, "Vector dimension " + actual + " does not match expected dimension " + expected);
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
