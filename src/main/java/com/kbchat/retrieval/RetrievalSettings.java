package com.kbchat.retrieval;

import java.time.Duration;

public record RetrievalSettings(
        int defaultTopK,
        int maxTopK,
        double confidenceThreshold,
        String hedgePrefix,
        Duration generationTimeout) {

    public static final String DEFAULT_HEDGE_PREFIX =
            "I'm not entirely sure I understood your question, but here is what I can tell you: ";

    public RetrievalSettings {
        if (defaultTopK < 1) {
            throw new IllegalArgumentException("defaultTopK must be >= 1");
        }
        if (maxTopK < defaultTopK) {
            throw new IllegalArgumentException("maxTopK must be >= defaultTopK");
        }
        if (generationTimeout == null || generationTimeout.isZero() || generationTimeout.isNegative()) {
            throw new IllegalArgumentException("generationTimeout must be positive");
        }
        hedgePrefix = hedgePrefix == null ? DEFAULT_HEDGE_PREFIX : hedgePrefix;
    }

    public static RetrievalSettings defaults() {
        return new RetrievalSettings(5, 50, 0.65, DEFAULT_HEDGE_PREFIX, Duration.ofSeconds(30));
    }
}
