package com.costtelemetry.ml;

/**
 * Descriptive statistics over daily cost arrays.
 *
 * Population (not sample) variance throughout: the series are the full
 * observed window, not a sample of it. Empty arrays yield 0.
 */
public final class CostStatistics {

    private CostStatistics() {
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    public static double variance(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double mean = mean(values);
        double variance = 0;
        for (double v : values) {
            variance += (v - mean) * (v - mean);
        }
        return variance / values.length;
    }

    public static double standardDeviation(double[] values) {
        return Math.sqrt(variance(values));
    }

    /**
     * Mean of the first {@code count} values (fewer if the array is shorter).
     */
    public static double headMean(double[] values, int count) {
        int n = Math.min(count, values.length);
        double sum = 0;
        for (int i = 0; i < n; i++) sum += values[i];
        return n > 0 ? sum / n : 0.0;
    }

    /**
     * Mean of the last {@code count} values (fewer if the array is shorter).
     */
    public static double tailMean(double[] values, int count) {
        int n = Math.min(count, values.length);
        double sum = 0;
        for (int i = values.length - n; i < values.length; i++) sum += values[i];
        return n > 0 ? sum / n : 0.0;
    }

    /**
     * Relative change from {@code base} to {@code current}; 0 when the base is 0.
     */
    public static double growthRate(double base, double current) {
        return base != 0 ? (current - base) / base : 0.0;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
