package com.kbchat.embedding;

public final class Vectors {
    private Vectors() {
    }

    public static float norm(float[] vector) {
        double sum = 0d;
        for (float value : vector) {
            sum += (double) value * value;
        }
        return (float) Math.sqrt(sum);
    }

    /**
     * Scales the vector in place to unit L2 norm. A zero vector is left untouched.
     *
     * @return false when the vector had zero norm
     */
    public static boolean normalizeInPlace(float[] vector) {
        float norm = norm(vector);
        if (norm == 0f || Float.isNaN(norm)) {
            return false;
        }
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= norm;
        }
        return true;
    }

    public static float[] normalizedCopy(float[] vector) {
        float[] copy = vector.clone();
        normalizeInPlace(copy);
        return copy;
    }

    public static float dot(float[] a, int aOffset, float[] b, int dimension) {
        float sum = 0f;
        for (int i = 0; i < dimension; i++) {
            sum += a[aOffset + i] * b[i];
        }
        return sum;
    }
}
