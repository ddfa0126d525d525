package com.kbchat.embedding;

import java.util.Locale;

import com.kbchat.error.EncodingException;

/**
 * Offline encoder built on feature hashing of word tokens and character trigrams. It needs no
 * model files, so it is always available; similar wording lands on overlapping buckets.
 */
public class HashingVectorEncoder implements VectorEncoder {
    private static final String VERSION = "hashing-v1";
    private static final float TOKEN_WEIGHT = 1.0f;
    private static final float TRIGRAM_WEIGHT = 0.35f;

    private final int dimension;

    public HashingVectorEncoder(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0");
        }
        this.dimension = dimension;
    }

    @Override
    public float[] encode(String text) {
        if (text == null || text.isBlank()) {
            throw new EncodingException("Cannot encode empty text");
        }
        float[] vector = new float[dimension];
        String[] tokens = text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}_]+");
        for (String token : tokens) {
            if (token.isBlank()) {
                continue;
            }
            addHashed(vector, "tok:" + token, TOKEN_WEIGHT);
            if (token.length() >= 3) {
                for (int i = 0; i <= token.length() - 3; i++) {
                    addHashed(vector, "tri:" + token.substring(i, i + 3), TRIGRAM_WEIGHT);
                }
            }
        }
        if (!Vectors.normalizeInPlace(vector)) {
            throw new EncodingException("Text has no encodable tokens");
        }
        return vector;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return VERSION;
    }

    private void addHashed(float[] vector, String key, float weight) {
        int index = Math.floorMod(key.hashCode(), vector.length);
        vector[index] += weight;
    }
}
