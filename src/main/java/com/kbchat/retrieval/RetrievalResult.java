package com.kbchat.retrieval;

import java.util.List;

public record RetrievalResult(
        String answer,
        double confidence,
        List<Long> sourceIds,
        long latencyMs,
        AnswerMode answerMode) {

    public RetrievalResult {
        sourceIds = List.copyOf(sourceIds);
    }
}
