package com.kbchat.error;

/**
 * Base type of every failure the core reports to its callers. The category tells the
 * serving boundary whether the caller, the data or a downstream dependency is at fault.
 */
public abstract class KbChatException extends RuntimeException {
    private final ErrorCategory category;

    protected KbChatException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    protected KbChatException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }
}
