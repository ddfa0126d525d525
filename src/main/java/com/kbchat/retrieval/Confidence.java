package com.kbchat.retrieval;

/**
 * Maps a raw cosine similarity in [-1, 1] linearly onto [0, 1]. This is a presentation
 * heuristic, not a calibrated probability.
 */
public final class Confidence {
    private Confidence() {
    }

    public static double fromSimilarity(double rawScore) {
        if (Double.isNaN(rawScore)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, (rawScore + 1.0) / 2.0));
    }
}
