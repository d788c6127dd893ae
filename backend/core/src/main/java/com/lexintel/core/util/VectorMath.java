package com.lexintel.core.util;

public final class VectorMath {
    private VectorMath() {
    }

    public static double cosine(double[] a, double[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    public static double[] foldIntoCentroid(double[] centroid, int count, double[] next) {
        if (centroid == null || count == 0) {
            return next.clone();
        }
        double[] updated = new double[centroid.length];
        for (int i = 0; i < centroid.length; i++) {
            updated[i] = (centroid[i] * count + next[i]) / (count + 1);
        }
        return updated;
    }
}
