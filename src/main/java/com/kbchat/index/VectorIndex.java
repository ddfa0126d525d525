package com.kbchat.index;

import java.util.List;

public interface VectorIndex {
    long INVALID_ID = -1L;

    int dimension();

    int size();

    SearchHits search(float[] queryVector, int k);

    void add(List<float[]> vectors, List<Long> ids);

    List<Long> idMapping();

    List<Long> mapToSourceIds(int[] positions);

    /**
     * Raw row-major copy of the stored (normalized) vectors, used for persistence.
     */
    float[] vectorData();
}
