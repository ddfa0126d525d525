package com.kbchat.sync;

import java.time.Duration;

public record RebuildStats(int count, Duration duration, long sizeBytes, int dimension) {
}
