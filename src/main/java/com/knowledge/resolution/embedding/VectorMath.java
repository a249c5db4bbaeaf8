package com.knowledge.resolution.embedding;

/**
 * Vector helpers shared by embedding providers.
 */
public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Cosine similarity of two vectors. Returns 0.0 when either vector has zero norm,
     * so all-zero stub vectors never look similar.
     *
     * @throws IllegalArgumentException if the vectors differ in dimension
     */
    public static double cosine(float[] a, float[] b) {
        if (a == null || b == null) {
            return 0.0;
        }
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                    "Vector dimensions differ: " + a.length + " vs " + b.length);
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        double cos = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        // rounding can push identical vectors slightly past 1
        return Math.max(-1.0, Math.min(1.0, cos));
    }

    /**
     * True for empty vectors and vectors whose components are all zero.
     */
    public static boolean isZero(float[] vector) {
        for (float component : vector) {
            if (component != 0.0f) {
                return false;
            }
        }
        return true;
    }
}
