package com.kbchat.index;

import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class IndexHolderTest {

    @Test
    void shouldPublishReplacementAndReturnPrevious() {
        VectorIndex first = FlatVectorIndex.createEmpty(2);
        VectorIndex second = FlatVectorIndex.createEmpty(2);
        IndexHolder holder = new IndexHolder(first);

        assertSame(first, holder.publish(second));
        assertSame(second, holder.current());
        assertThrows(IllegalArgumentException.class, () -> holder.publish(null));
    }
}
