package com.kbchat.index;

import java.util.concurrent.atomic.AtomicReference;

/**
 * The published index. Rebuilds swap in a complete new instance; readers take whatever
 * instance is current at the start of their search.
 */
public class IndexHolder {
    private final AtomicReference<VectorIndex> current;

    public IndexHolder(VectorIndex initial) {
        if (initial == null) {
            throw new IllegalArgumentException("initial index must not be null");
        }
        this.current = new AtomicReference<>(initial);
    }

    public VectorIndex current() {
        return current.get();
    }

    public VectorIndex publish(VectorIndex replacement) {
        if (replacement == null) {
            throw new IllegalArgumentException("published index must not be null");
        }
        return current.getAndSet(replacement);
    }
}
