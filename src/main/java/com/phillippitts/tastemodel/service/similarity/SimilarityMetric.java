package com.phillippitts.tastemodel.service.similarity;

import java.util.Locale;

/**
 * Vector similarity measures. Higher scores always mean closer tracks.
 */
public enum SimilarityMetric {

    /** Cosine of the angle between vectors; 0 when either vector is (near) zero. */
    COSINE {
        @Override
        public double score(double[] a, double[] b) {
            double dot = 0.0;
            double normA = 0.0;
            double normB = 0.0;
            for (int i = 0; i < a.length; i++) {
                dot += a[i] * b[i];
                normA += a[i] * a[i];
                normB += b[i] * b[i];
            }
            if (normA < ZERO_NORM || normB < ZERO_NORM) {
                return 0.0;
            }
            return dot / (Math.sqrt(normA) * Math.sqrt(normB));
        }
    },

    /** Euclidean distance mapped to {@code 1 / (1 + d)}, so identical vectors score 1. */
    EUCLIDEAN {
        @Override
        public double score(double[] a, double[] b) {
            double sum = 0.0;
            for (int i = 0; i < a.length; i++) {
                double d = a[i] - b[i];
                sum += d * d;
            }
            return 1.0 / (1.0 + Math.sqrt(sum));
        }
    };

    private static final double ZERO_NORM = 1e-18;

    public abstract double score(double[] a, double[] b);

    /**
     * Case-insensitive lookup.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static SimilarityMetric parse(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
