package com.kbchat.index;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.PriorityQueue;

import com.kbchat.embedding.Vectors;
import com.kbchat.error.DimensionMismatchException;
import com.kbchat.error.LengthMismatchException;

/**
 * Exact inner-product index over L2-normalized vectors, so scores are cosine similarities.
 *
 * <p>Every append builds a new immutable snapshot and swaps it in, so a concurrent search sees
 * either the old or the new contents, never a partial append.
 */
public final class FlatVectorIndex implements VectorIndex {
    private final int dimension;
    private volatile Snapshot snapshot;

    private FlatVectorIndex(int dimension, Snapshot snapshot) {
        this.dimension = dimension;
        this.snapshot = snapshot;
    }

    public static FlatVectorIndex createEmpty(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0");
        }
        return new FlatVectorIndex(dimension, new Snapshot(new float[0], new long[0]));
    }

    static FlatVectorIndex restore(int dimension, float[] data, long[] ids) {
        if (data.length != (long) ids.length * dimension) {
            throw new IllegalArgumentException("vector data does not match " + ids.length + " x " + dimension);
        }
        return new FlatVectorIndex(dimension, new Snapshot(data, ids));
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public int size() {
        return snapshot.ids.length;
    }

    @Override
    public SearchHits search(float[] queryVector, int k) {
        if (queryVector.length != dimension) {
            throw new DimensionMismatchException(dimension, queryVector.length);
        }
        Snapshot current = snapshot;
        int count = current.ids.length;
        int effectiveK = Math.min(k, count);
        if (effectiveK <= 0) {
            return SearchHits.empty();
        }
        float[] query = Vectors.normalizedCopy(queryVector);

        PriorityQueue<Scored> heap = new PriorityQueue<>(effectiveK + 1, FlatVectorIndex::worseFirst);
        for (int position = 0; position < count; position++) {
            float score = Vectors.dot(current.data, position * dimension, query, dimension);
            Scored candidate = new Scored(position, score);
            if (heap.size() < effectiveK) {
                heap.add(candidate);
            } else if (worseFirst(candidate, heap.peek()) > 0) {
                heap.poll();
                heap.add(candidate);
            }
        }

        List<Scored> ranked = new ArrayList<>(heap);
        ranked.sort(Collections.reverseOrder(FlatVectorIndex::worseFirst));
        float[] scores = new float[ranked.size()];
        int[] positions = new int[ranked.size()];
        for (int i = 0; i < ranked.size(); i++) {
            scores[i] = ranked.get(i).score();
            positions[i] = ranked.get(i).position();
        }
        return new SearchHits(scores, positions);
    }

    @Override
    public synchronized void add(List<float[]> vectors, List<Long> ids) {
        if (vectors.size() != ids.size()) {
            throw new LengthMismatchException(vectors.size(), ids.size());
        }
        for (float[] vector : vectors) {
            if (vector.length != dimension) {
                throw new DimensionMismatchException(dimension, vector.length);
            }
        }
        Snapshot current = snapshot;
        int existing = current.ids.length;
        float[] data = Arrays.copyOf(current.data, (existing + vectors.size()) * dimension);
        long[] mapping = Arrays.copyOf(current.ids, existing + ids.size());
        for (int i = 0; i < vectors.size(); i++) {
            float[] normalized = Vectors.normalizedCopy(vectors.get(i));
            System.arraycopy(normalized, 0, data, (existing + i) * dimension, dimension);
            mapping[existing + i] = ids.get(i);
        }
        snapshot = new Snapshot(data, mapping);
    }

    @Override
    public List<Long> idMapping() {
        long[] ids = snapshot.ids;
        List<Long> out = new ArrayList<>(ids.length);
        for (long id : ids) {
            out.add(id);
        }
        return Collections.unmodifiableList(out);
    }

    @Override
    public List<Long> mapToSourceIds(int[] positions) {
        long[] ids = snapshot.ids;
        List<Long> out = new ArrayList<>(positions.length);
        for (int position : positions) {
            out.add(position >= 0 && position < ids.length ? ids[position] : INVALID_ID);
        }
        return out;
    }

    @Override
    public float[] vectorData() {
        return snapshot.data.clone();
    }

    @Override
    public String toString() {
        return "FlatVectorIndex[dimension=" + dimension + ", size=" + size() + "]";
    }

    /**
     * Orders the lower score first; on equal scores the higher position counts as worse.
     */
    private static int worseFirst(Scored a, Scored b) {
        int byScore = Float.compare(a.score(), b.score());
        if (byScore != 0) {
            return byScore;
        }
        return Integer.compare(b.position(), a.position());
    }

    private record Scored(int position, float score) {
    }

    private record Snapshot(float[] data, long[] ids) {
    }
}
