package com.edgewatch.service.core.detect;

import java.util.Arrays;

/** Median-based dispersion helpers. */
public final class RobustStatistics {

    /** Makes the MAD a consistent estimator of the standard deviation for normally distributed data. */
    public static final double MAD_SCALE = 1.4826;

    private RobustStatistics() {}

    public static double median(double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("median of an empty sample");
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    public static double medianAbsoluteDeviation(double[] values, double median) {
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        return median(deviations);
    }

    /** Sample standard deviation (n - 1 denominator); zero for fewer than two values. */
    public static double standardDeviation(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        double mean = 0.0;
        for (double v : values) {
            mean += v;
        }
        mean /= values.length;
        double squares = 0.0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        return Math.sqrt(squares / (values.length - 1));
    }

    public static boolean allEqual(double[] values) {
        for (int i = 1; i < values.length; i++) {
            if (Double.compare(values[i], values[0]) != 0) {
                return false;
            }
        }
        return true;
    }
}
