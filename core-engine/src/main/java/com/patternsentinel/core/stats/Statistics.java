package com.patternsentinel.core.stats;

import com.patternsentinel.core.model.DataPoint;

import java.util.List;

/**
 * Descriptive statistics over sample arrays.
 *
 * <p>
 * Standard deviations use the sample (n-1) estimator and are 0 for fewer
 * than two values. Callers decide what a zero deviation means.
 * </p>
 *
 * @since 1.0.0
 */
public final class Statistics {

    private Statistics() {
        // utility class — not instantiable
    }

    /**
     * @param values at least one value
     * @return arithmetic mean
     * @throws IllegalArgumentException if {@code values} is empty
     */
    public static double mean(double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("mean requires at least one value");
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * @param values sample values
     * @param mean   their mean
     * @return sample standard deviation, 0 for fewer than two values
     */
    public static double sampleStdDev(double[] values, double mean) {
        if (values.length < 2) {
            return 0.0;
        }
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / (values.length - 1));
    }

    public static double sampleStdDev(double[] values) {
        return values.length < 2 ? 0.0 : sampleStdDev(values, mean(values));
    }

    /**
     * @param points readings, oldest first
     * @return their values in the same order
     */
    public static double[] values(List<DataPoint> points) {
        double[] out = new double[points.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = points.get(i).getValue();
        }
        return out;
    }

    /**
     * @param value     observed value
     * @param reference reference value
     * @return {@code (value - reference) / reference * 100}, or 0 when the
     *         reference is 0
     */
    public static double deviationPct(double value, double reference) {
        return reference != 0 ? (value - reference) / reference * 100 : 0.0;
    }

    /**
     * @param value  number to round
     * @param places decimal places
     * @return {@code value} rounded half-up to {@code places} decimals
     */
    public static double round(double value, int places) {
        if (!Double.isFinite(value)) {
            return value;
        }
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }
}
