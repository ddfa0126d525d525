package com.kbchat.embedding;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Question clean-up applied before encoding on the request path. Stop words are kept: the
 * encoder sees the same vocabulary the knowledge entries were indexed with.
 */
public final class TextNormalizer {
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}_\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        String spaced = PUNCTUATION.matcher(lower).replaceAll(" ");
        return WHITESPACE.matcher(spaced).replaceAll(" ").strip();
    }
}
