package com.querysentinel.core.baseline;

import java.util.Arrays;
import java.util.Objects;

/**
 * Descriptive statistics used to build user baselines.
 *
 * @since 1.0.0
 */
public final class Statistics {

    private Statistics() {
        // utility class, not instantiable
    }

    /**
     * Continuous percentile with linear interpolation between the two closest
     * ranks (the {@code PERCENTILE_CONT} definition).
     *
     * <p>
     * For sorted values {@code v[0..n-1]} the rank is {@code p * (n - 1)};
     * the result interpolates between {@code v[floor(rank)]} and
     * {@code v[ceil(rank)]}.
     * </p>
     *
     * @param values     observations; must not be {@code null} or empty. Not
     *                   modified.
     * @param percentile fraction in [0, 1]
     * @return the interpolated percentile
     * @throws IllegalArgumentException if {@code values} is empty or
     *                                  {@code percentile} is out of range
     */
    public static double percentileCont(double[] values, double percentile) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("Cannot compute a percentile of no values");
        }
        if (percentile < 0 || percentile > 1) {
            throw new IllegalArgumentException("percentile must be in [0, 1], got: " + percentile);
        }

        double[] sorted = values.clone();
        Arrays.sort(sorted);

        double rank = percentile * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (rank - lower) * (sorted[upper] - sorted[lower]);
    }

    /**
     * @param values observations; must not be empty
     * @return arithmetic mean
     */
    public static double mean(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("Cannot compute the mean of no values");
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Sample standard deviation (divisor {@code n - 1}).
     *
     * @param values observations; at least two
     * @param mean   the mean of {@code values}
     * @return sample standard deviation
     */
    public static double sampleStdDev(double[] values, double mean) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length < 2) {
            throw new IllegalArgumentException(
                    "Sample standard deviation needs at least 2 values, got: " + values.length);
        }
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / (values.length - 1));
    }
}
