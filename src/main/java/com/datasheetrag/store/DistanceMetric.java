package com.datasheetrag.store;

/**
 * Dissimilarity between two embeddings. Lower values mean more similar.
 */
public enum DistanceMetric {

    /**
     * {@code 1 - cosine similarity}, in {@code [0, 2]}. A zero vector is at distance 1
     * from everything.
     */
    COSINE {
        @Override
        public double distance(float[] a, float[] b) {
            checkDimensions(a, b);
            double dot = 0d;
            double aNorm = 0d;
            double bNorm = 0d;
            for (int i = 0; i < a.length; i++) {
                dot += a[i] * b[i];
                aNorm += a[i] * a[i];
                bNorm += b[i] * b[i];
            }
            if (aNorm == 0d || bNorm == 0d) {
                return 1d;
            }
            double cosine = dot / Math.sqrt(aNorm * bNorm);
            return 1d - Math.max(-1d, Math.min(1d, cosine));
        }
    },

    /**
     * Euclidean (L2) distance.
     */
    EUCLIDEAN {
        @Override
        public double distance(float[] a, float[] b) {
            checkDimensions(a, b);
            double sum = 0d;
            for (int i = 0; i < a.length; i++) {
                double diff = a[i] - b[i];
                sum += diff * diff;
            }
            return Math.sqrt(sum);
        }
    };

    public abstract double distance(float[] a, float[] b);

    private static void checkDimensions(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Dimension mismatch: " + a.length + " vs " + b.length);
        }
    }
}
