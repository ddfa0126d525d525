package com.kbchat.inference;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import com.kbchat.error.GenerationException;

/**
 * Model-free generator: answers with the context sentences that share the most keywords with
 * the question, keeping their original order.
 */
public class ExtractiveGenerator implements Generator {
    private static final String ANSWER_MARKER = "\nA: ";

    private final int maxSentences;

    public ExtractiveGenerator(int maxSentences) {
        this.maxSentences = Math.max(1, maxSentences);
    }

    @Override
    public String generate(String question, String context) {
        if (context == null || context.isBlank()) {
            throw new GenerationException("No context to answer from");
        }
        List<String> sentences = answerSentences(context);
        if (sentences.isEmpty()) {
            throw new GenerationException("Context contains no answer text");
        }

        Set<String> keywords = keywords(question);
        List<String> selected = new ArrayList<>();
        int bestOverlap = 0;
        for (String sentence : sentences) {
            bestOverlap = Math.max(bestOverlap, overlap(sentence, keywords));
        }
        if (bestOverlap > 0) {
            for (String sentence : sentences) {
                if (overlap(sentence, keywords) == bestOverlap && selected.size() < maxSentences) {
                    selected.add(sentence);
                }
            }
        } else {
            selected.add(sentences.get(0));
        }
        return String.join(" ", selected);
    }

    @Override
    public String describe() {
        return "extractive(maxSentences=" + maxSentences + ")";
    }

    private static List<String> answerSentences(String context) {
        List<String> sentences = new ArrayList<>();
        for (String block : context.split("\n\n(?=Q: )")) {
            int marker = block.indexOf(ANSWER_MARKER);
            if (marker < 0) {
                continue;
            }
            String answer = block.substring(marker + ANSWER_MARKER.length()).trim();
            for (String sentence : answer.split("(?<=[.!?])\\s+|\n+")) {
                if (!sentence.isBlank()) {
                    sentences.add(sentence.trim());
                }
            }
        }
        return sentences;
    }

    private static Set<String> keywords(String input) {
        if (input == null) {
            return Set.of();
        }
        return Arrays.stream(input.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(token -> token.length() > 2)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static int overlap(String sentence, Set<String> keywords) {
        Set<String> words = keywords(sentence);
        int count = 0;
        for (String keyword : keywords) {
            if (words.contains(keyword)) {
                count++;
            }
        }
        return count;
    }
}
