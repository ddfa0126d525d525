package com.kbchat.sync;

public enum PollOutcome {
    /** First modification timestamp seen; stored as the baseline, nothing rebuilt. */
    BASELINE_RECORDED,
    UNCHANGED,
    REBUILT,
    REBUILD_FAILED,
    /** A trigger fired inside the minimum rebuild interval and was dropped. */
    THROTTLED,
    SOURCE_UNAVAILABLE,
    POLL_FAILED
}
