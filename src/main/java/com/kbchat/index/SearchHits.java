package com.kbchat.index;

/**
 * Parallel arrays of similarity scores and index positions, best first.
 */
public record SearchHits(float[] scores, int[] positions) {
    private static final SearchHits EMPTY = new SearchHits(new float[0], new int[0]);

    public SearchHits {
        if (scores.length != positions.length) {
            throw new IllegalArgumentException("scores and positions must have the same length");
        }
    }

    public static SearchHits empty() {
        return EMPTY;
    }

    public int size() {
        return scores.length;
    }

    public boolean isEmpty() {
        return scores.length == 0;
    }

    public float topScore() {
        if (isEmpty()) {
            throw new IllegalStateException("no hits");
        }
        return scores[0];
    }
}
