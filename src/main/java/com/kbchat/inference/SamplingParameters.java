package com.kbchat.inference;

import java.util.List;

public record SamplingParameters(
        int maxTokens,
        double temperature,
        double topP,
        int topK,
        double repeatPenalty,
        List<String> stop) {
}
