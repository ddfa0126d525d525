package com.kbchat.sync;

import java.time.Duration;

public record SyncSettings(
        Duration pollInterval,
        Duration initialDelay,
        Duration sourceUptimeThreshold,
        Duration minRebuildInterval) {

    public SyncSettings {
        if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must not be negative");
        }
        if (sourceUptimeThreshold == null || sourceUptimeThreshold.isNegative()) {
            throw new IllegalArgumentException("sourceUptimeThreshold must not be negative");
        }
        if (minRebuildInterval == null || minRebuildInterval.isNegative()) {
            throw new IllegalArgumentException("minRebuildInterval must not be negative");
        }
    }

    public static SyncSettings defaults() {
        return new SyncSettings(Duration.ofSeconds(60), Duration.ofSeconds(5),
                Duration.ofSeconds(300), Duration.ofSeconds(300));
    }
}
