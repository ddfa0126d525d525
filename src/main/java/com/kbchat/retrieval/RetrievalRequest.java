package com.kbchat.retrieval;

/**
 * A question, optionally with a precomputed embedding and a requested number of neighbors.
 * {@code embedding} and {@code topK} may be null.
 */
public record RetrievalRequest(String question, float[] embedding, Integer topK) {

    public static RetrievalRequest of(String question) {
        return new RetrievalRequest(question, null, null);
    }

    public static RetrievalRequest of(String question, int topK) {
        return new RetrievalRequest(question, null, topK);
    }
}
