package com.kbchat.embedding;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns text into unit-length vectors of a fixed dimension.
 *
 * <p>Implementations fail with {@link com.kbchat.error.EncodingException} when the text is blank
 * or when the underlying model cannot be reached.
 */
public interface VectorEncoder {
    float[] encode(String text);

    default List<float[]> encodeBatch(List<String> texts) {
        List<float[]> out = new ArrayList<>(texts.size());
        for (String text : texts) {
            out.add(encode(text));
        }
        return out;
    }

    int dimension();

    default String version() {
        return "unversioned";
    }
}
