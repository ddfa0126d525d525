package com.kbchat.embedding;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.kbchat.error.EncodingException;

class HashingVectorEncoderTest {

    private final HashingVectorEncoder encoder = new HashingVectorEncoder(128);

    @Test
    void shouldProduceUnitVectorsOfConfiguredDimension() {
        for (String text : List.of("reset my password", "How do I export invoices?", "x")) {
            float[] vector = encoder.encode(text);
            assertEquals(128, vector.length);
            assertEquals(1.0f, Vectors.norm(vector), 1e-5f);
        }
    }

    @Test
    void shouldBeDeterministic() {
        assertArrayEquals(encoder.encode("opening hours"), encoder.encode("opening hours"));
    }

    @Test
    void shouldScoreRelatedTextAboveUnrelatedText() {
        float[] query = encoder.encode("how to reset a password");
        float[] related = encoder.encode("password reset instructions");
        float[] unrelated = encoder.encode("delivery times for parcels abroad");

        float relatedScore = Vectors.dot(related, 0, query, 128);
        float unrelatedScore = Vectors.dot(unrelated, 0, query, 128);
        assertTrue(relatedScore > unrelatedScore);
    }

    @Test
    void shouldRejectBlankOrTokenlessText() {
        assertThrows(EncodingException.class, () -> encoder.encode("   "));
        assertThrows(EncodingException.class, () -> encoder.encode(null));
        assertThrows(EncodingException.class, () -> encoder.encode("?!  ..."));
    }

    @Test
    void shouldEncodeBatchInOrder() {
        List<float[]> batch = encoder.encodeBatch(List.of("alpha", "beta"));
        assertArrayEquals(encoder.encode("alpha"), batch.get(0));
        assertArrayEquals(encoder.encode("beta"), batch.get(1));
    }
}
