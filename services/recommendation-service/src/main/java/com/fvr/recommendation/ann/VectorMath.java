package com.fvr.recommendation.ann;

import java.util.List;

public final class VectorMath {
    private VectorMath() {
    }

    public static double norm(float[] vector) {
        double sum = 0.0;
        for (float value : vector) {
            sum += (double) value * value;
        }
        return Math.sqrt(sum);
    }

    public static boolean isFinite(float[] vector) {
        if (vector == null) {
            return false;
        }
        for (float value : vector) {
            if (!Float.isFinite(value)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns a unit-length copy, or null when the vector is zero or not finite.
     */
    public static float[] normalize(float[] vector) {
        if (!isFinite(vector)) {
            return null;
        }
        double norm = norm(vector);
        if (norm == 0.0 || !Double.isFinite(norm)) {
            return null;
        }
        float[] out = new float[vector.length];
        for (int i = 0; i < vector.length; i++) {
            out[i] = (float) (vector[i] / norm);
        }
        return out;
    }

    public static double dot(float[] a, float[] b) {
        int length = Math.min(a.length, b.length);
        double sum = 0.0;
        for (int i = 0; i < length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }

    /**
     * Highest dot product against any of the unit vectors, floored at zero.
     */
    public static double maxSimilarity(float[] vector, List<float[]> unitVectors) {
        double best = -1.0;
        for (float[] other : unitVectors) {
            double score = dot(vector, other);
            if (score > best) {
                best = score;
            }
        }
        return best > 0 && Double.isFinite(best) ? best : 0.0;
    }
}
