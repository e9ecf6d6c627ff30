package ru.javaboys.huntymatch.scoring;

import ru.javaboys.huntymatch.exception.DimensionMismatchException;
import ru.javaboys.huntymatch.exception.InvalidInputException;

public final class CosineSimilarity {

    private CosineSimilarity() {
    }

    /**
     * Cosine of the angle between two vectors, in [-1, 1].
     * Returns 0 when either vector has zero magnitude.
     *
     * @throws DimensionMismatchException if the lengths differ
     */
    public static double cosineSimilarity(float[] a, float[] b) {
        if (a == null || b == null) {
            throw new InvalidInputException("Vectors cannot be null");
        }
        if (a.length != b.length) {
            throw new DimensionMismatchException(a.length, b.length);
        }

        double dotProd = 0.0;
        double magA = 0.0;
        double magB = 0.0;
        for (int i = 0; i < a.length; i++) {
            double v1 = a[i];
            double v2 = b[i];
            dotProd += v1 * v2;
            magA += v1 * v1;
            magB += v2 * v2;
        }

        double denominator = Math.sqrt(magA) * Math.sqrt(magB);
        return denominator > 0 ? dotProd / denominator : 0.0;
    }
}
