package com.safeops.anomaly.engine;

import java.util.Arrays;

public final class Percentiles {

    private Percentiles() {}

    /**
     * Percentile with linear interpolation between closest ranks.
     *
     * @param values     sample, not modified
     * @param percentile in [0, 100]
     */
    public static double of(double[] values, double percentile) {
        if (values.length == 0) {
            throw new IllegalArgumentException("Percentile of an empty sample is undefined");
        }
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        double p = Math.max(0.0, Math.min(100.0, percentile));
        double rank = p / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) return sorted[lower];
        double fraction = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }
}
