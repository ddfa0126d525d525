package com.kbchat.sync;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of the synchronizer, safe to hand to any thread.
 */
public record SyncStatus(
        boolean active,
        boolean rebuildInProgress,
        Instant lastObservedModification,
        Instant lastRebuildTime,
        int indexSize,
        boolean indexPresent,
        Duration pollInterval,
        Duration sourceUptimeThreshold,
        Duration minRebuildInterval,
        Long secondsSinceLastRebuild) {
}
