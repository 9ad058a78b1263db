package com.soundforge.prometheus.prediction;

import com.soundforge.prometheus.domain.model.ConfidenceInterval;
import com.soundforge.prometheus.domain.model.Trend;

import java.util.List;

/**
 * Pure forecasting functions used by {@link PredictionEngine}.
 */
public final class Forecasting {

    private Forecasting() {
    }

    /**
     * Simple exponential smoothing: {@code s = alpha * x + (1 - alpha) * s}, seeded with the first value.
     *
     * @return the smoothed value, or {@code null} for an empty series
     */
    public static Double exponentialSmoothing(List<Double> values, double alpha) {
        if (values.isEmpty()) {
            return null;
        }
        double result = values.get(0);
        for (int i = 1; i < values.size(); i++) {
            result = alpha * values.get(i) + (1 - alpha) * result;
        }
        return result;
    }

    /**
     * Least-squares slope over the index, relative to the series mean.
     * Fewer than two values, or a zero mean, is stable.
     */
    public static Trend linearRegressionTrend(List<Double> values) {
        int n = values.size();
        if (n < 2) {
            return Trend.STABLE;
        }

        double sumX = 0;
        double sumY = 0;
        double sumXY = 0;
        double sumXX = 0;
        for (int i = 0; i < n; i++) {
            double y = values.get(i);
            sumX += i;
            sumY += y;
            sumXY += i * y;
            sumXX += (double) i * i;
        }

        double slope = (n * sumXY - sumX * sumY) / (n * sumXX - sumX * sumX);
        double mean = sumY / n;
        if (mean == 0.0) {
            return Trend.STABLE;
        }
        return Trend.fromRelativeChange(slope / mean);
    }

    /**
     * Normal-approximation band {@code mean ± z * s / sqrt(n)} using the sample standard deviation.
     * Series shorter than two values get an unbounded interval.
     */
    public static ConfidenceInterval calculateConfidenceInterval(List<Double> values, double zScore) {
        int n = values.size();
        if (n == 0) {
            return ConfidenceInterval.unbounded(null);
        }

        double mean = values.stream().mapToDouble(Double::doubleValue).sum() / n;
        if (n < 2) {
            return ConfidenceInterval.unbounded(mean);
        }

        double squares = 0;
        for (double value : values) {
            squares += Math.pow(value - mean, 2);
        }
        double stdDev = Math.sqrt(squares / (n - 1));
        double margin = zScore * stdDev / Math.sqrt(n);

        return ConfidenceInterval.of(mean - margin, mean + margin, mean);
    }
}
