package com.openforge.conceptai.index;

/**
 * Cosine-similarity arithmetic shared by the vector index and the semantic cache.
 *
 * Vectors of different lengths are compared on their overlapping prefix; norms
 * always cover the whole vector.
 */
public final class VectorMath {

    private VectorMath() {
    }

    public static double norm(float[] v) {
        double sum = 0.0;
        for (float x : v) {
            sum += (double) x * x;
        }
        return Math.sqrt(sum);
    }

    public static double dot(float[] a, float[] b) {
        int n = Math.min(a.length, b.length);
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }

    /**
     * Cosine similarity with precomputed norms.
     *
     * @return NaN when either norm is zero; callers skip such pairs
     */
    public static double cosine(float[] a, double normA, float[] b, double normB) {
        double denominator = normA * normB;
        if (denominator == 0.0 || Double.isNaN(denominator)) {
            return Double.NaN;
        }
        return dot(a, b) / denominator;
    }

    public static double cosine(float[] a, float[] b) {
        return cosine(a, norm(a), b, norm(b));
    }
}
