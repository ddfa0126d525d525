package com.kbchat.sync;

/**
 * Why a rebuild was requested.
 */
public enum SyncTrigger {
    INDEX_ABSENT,
    SOURCE_RESTARTED,
    SOURCE_MODIFIED,
    MANUAL
}
