package com.healthiq.util;

import com.google.common.math.PairedStatsAccumulator;
import com.google.common.math.Stats;

/**
 * Small statistics helpers over daily series. Degenerate inputs resolve to 0 rather than NaN.
 */
public final class SeriesStatistics {

    private SeriesStatistics() {}

    /**
     * Coefficient of variation (population standard deviation / mean).
     * Returns 0 for fewer than two values or a zero mean.
     */
    public static double coefficientOfVariation(double... values) {
        if (values == null || values.length < 2) {
            return 0d;
        }
        Stats stats = Stats.of(values);
        double mean = stats.mean();
        if (mean == 0d) {
            return 0d;
        }
        return stats.populationStandardDeviation() / mean;
    }

    /**
     * Ordinary least-squares slope of {@code values[i]} against {@code i}.
     * Returns 0 for fewer than two values.
     */
    public static double linearRegressionSlope(double... values) {
        if (values == null || values.length < 2) {
            return 0d;
        }
        PairedStatsAccumulator acc = new PairedStatsAccumulator();
        for (int i = 0; i < values.length; i++) {
            acc.add(i, values[i]);
        }
        return acc.leastSquaresFit().slope();
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static double mean(double... values) {
        if (values == null || values.length == 0) {
            return 0d;
        }
        return Stats.meanOf(values);
    }
}
