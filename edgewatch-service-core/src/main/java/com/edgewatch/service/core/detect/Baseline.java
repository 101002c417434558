package com.edgewatch.service.core.detect;

/**
 * Robust summary of a series' recent observations.
 *
 * <p>The scaled deviation is {@code 1.4826 * mad}. When more than half of the observations sit exactly on the
 * median the MAD collapses to zero although the window has spread; the sample standard deviation is used
 * instead in that case.
 *
 * @param flat every observation has the same value
 */
public record Baseline(int observations, double median, double mad, double scaledDeviation, boolean flat) {

    public static Baseline of(double[] observations) {
        double median = RobustStatistics.median(observations);
        double mad = RobustStatistics.medianAbsoluteDeviation(observations, median);
        boolean flat = RobustStatistics.allEqual(observations);
        double scaled;
        if (mad > 0) {
            scaled = RobustStatistics.MAD_SCALE * mad;
        } else if (flat) {
            scaled = 0.0;
        } else {
            scaled = RobustStatistics.standardDeviation(observations);
        }
        return new Baseline(observations.length, median, mad, scaled, flat);
    }
}
