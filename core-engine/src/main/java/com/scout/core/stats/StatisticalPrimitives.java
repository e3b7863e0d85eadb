package com.scout.core.stats;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Outlier primitives shared by every detector.
 *
 * <p>
 * Insufficient data and zero spread are never errors: the affected methods
 * simply report every point as normal.
 * </p>
 *
 * @since 1.0.0
 */
public final class StatisticalPrimitives {

    public static final double DEFAULT_Z_THRESHOLD = 2.0;
    public static final double DEFAULT_IQR_MULTIPLIER = 1.5;

    public static final int MIN_Z_POINTS = 3;
    public static final int MIN_IQR_POINTS = 4;

    private StatisticalPrimitives() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Descriptive statistics
    // ---------------------------------------------------------------

    /**
     * @param values input values
     * @return arithmetic mean, or 0 for an empty array
     */
    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Sample standard deviation (n - 1 denominator).
     *
     * @param values input values
     * @return sample stdev, or 0 for fewer than two values
     */
    public static double sampleStdDev(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double sumSq = 0.0;
        for (double v : values) {
            double d = v - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / (values.length - 1));
    }

    // ---------------------------------------------------------------
    // Outlier methods
    // ---------------------------------------------------------------

    /**
     * Score every point by its z-score against the whole series.
     *
     * @param values    series values, oldest first
     * @param threshold a point is anomalous iff {@code |z| > threshold}
     * @return one score per index; all normal when there are fewer than three
     *         points or the series has no spread
     */
    public static List<OutlierScore> zScoreAnomalies(double[] values, double threshold) {
        Objects.requireNonNull(values, "values must not be null");
        double stdev = sampleStdDev(values);
        if (values.length < MIN_Z_POINTS || stdev == 0.0) {
            return allNormal(values.length);
        }
        double mean = mean(values);
        List<OutlierScore> scores = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            double z = (values[i] - mean) / stdev;
            scores.add(new OutlierScore(i, z, Math.abs(z) > threshold));
        }
        return scores;
    }

    public static List<OutlierScore> zScoreAnomalies(double[] values) {
        return zScoreAnomalies(values, DEFAULT_Z_THRESHOLD);
    }

    /**
     * Score every point by its distance outside the Tukey fences, in units of
     * IQR. Quartiles use positional indexing: {@code q1 = sorted[n/4]},
     * {@code q3 = sorted[3n/4]}.
     *
     * @param values     series values, oldest first
     * @param multiplier fence multiplier
     * @return one score per index; all normal when there are fewer than four
     *         points or the IQR is zero
     */
    public static List<OutlierScore> iqrAnomalies(double[] values, double multiplier) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length < MIN_IQR_POINTS) {
            return allNormal(values.length);
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int n = sorted.length;
        double q1 = sorted[n / 4];
        double q3 = sorted[3 * n / 4];
        double iqr = q3 - q1;
        if (iqr == 0.0) {
            return allNormal(values.length);
        }

        double lower = q1 - multiplier * iqr;
        double upper = q3 + multiplier * iqr;
        List<OutlierScore> scores = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            double v = values[i];
            if (v < lower) {
                scores.add(new OutlierScore(i, (lower - v) / iqr, true));
            } else if (v > upper) {
                scores.add(new OutlierScore(i, (v - upper) / iqr, true));
            } else {
                scores.add(OutlierScore.normal(i));
            }
        }
        return scores;
    }

    public static List<OutlierScore> iqrAnomalies(double[] values) {
        return iqrAnomalies(values, DEFAULT_IQR_MULTIPLIER);
    }

    /**
     * Run both methods and merge them per point.
     *
     * @param values        series values, oldest first
     * @param zThreshold    z-score threshold
     * @param iqrMultiplier IQR fence multiplier
     * @return one consensus score per index
     */
    public static List<ConsensusScore> consensus(double[] values, double zThreshold, double iqrMultiplier) {
        List<OutlierScore> z = zScoreAnomalies(values, zThreshold);
        List<OutlierScore> iqr = iqrAnomalies(values, iqrMultiplier);
        List<ConsensusScore> merged = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            merged.add(new ConsensusScore(i, values[i], z.get(i), iqr.get(i)));
        }
        return merged;
    }

    /**
     * z-score of a single value relative to a separate baseline sample.
     *
     * @param baseline comparison sample, must hold at least two points
     * @param value    value under test
     * @return z-score, or 0 when the baseline is too short or has no spread
     */
    public static double zScoreAgainstBaseline(double[] baseline, double value) {
        Objects.requireNonNull(baseline, "baseline must not be null");
        if (baseline.length < 2) {
            return 0.0;
        }
        double stdev = sampleStdDev(baseline);
        if (stdev == 0.0) {
            return 0.0;
        }
        return (value - mean(baseline)) / stdev;
    }

    private static List<OutlierScore> allNormal(int size) {
        List<OutlierScore> scores = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            scores.add(OutlierScore.normal(i));
        }
        return scores;
    }
}
