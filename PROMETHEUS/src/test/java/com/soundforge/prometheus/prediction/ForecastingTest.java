package com.soundforge.prometheus.prediction;

import com.soundforge.prometheus.domain.model.ConfidenceInterval;
import com.soundforge.prometheus.domain.model.Trend;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link Forecasting}.
 */
class ForecastingTest {

    @Test
    @DisplayName("should smooth towards recent values")
    void exponentialSmoothing() {
        // 10 -> 0.3*20 + 0.7*10 = 13 -> 0.3*30 + 0.7*13 = 18.1
        assertThat(Forecasting.exponentialSmoothing(List.of(10.0, 20.0, 30.0), 0.3))
                .isCloseTo(18.1, within(1e-9));
        assertThat(Forecasting.exponentialSmoothing(List.of(7.0), 0.3)).isEqualTo(7.0);
        assertThat(Forecasting.exponentialSmoothing(List.of(), 0.3)).isNull();
    }

    @Test
    @DisplayName("should classify the regression slope relative to the mean")
    void linearRegressionTrend() {
        assertThat(Forecasting.linearRegressionTrend(List.of(1.0, 2.0, 3.0, 4.0, 5.0))).isEqualTo(Trend.INCREASING);
        assertThat(Forecasting.linearRegressionTrend(List.of(5.0, 4.0, 3.0, 2.0, 1.0))).isEqualTo(Trend.DECREASING);
        assertThat(Forecasting.linearRegressionTrend(List.of(100.0, 101.0, 100.0, 101.0))).isEqualTo(Trend.STABLE);
    }

    @Test
    @DisplayName("should treat short and zero-mean series as stable")
    void degenerateTrend() {
        assertThat(Forecasting.linearRegressionTrend(List.of(3.0))).isEqualTo(Trend.STABLE);
        assertThat(Forecasting.linearRegressionTrend(List.of(0.0, 0.0, 0.0))).isEqualTo(Trend.STABLE);
    }

    @Test
    @DisplayName("should build a normal-approximation interval from the sample deviation")
    void confidenceInterval() {
        // mean 5, sample sd sqrt(32/7), margin 1.96 * sd / sqrt(8)
        List<Double> values = List.of(2.0, 4.0, 4.0, 4.0, 5.0, 5.0, 7.0, 9.0);
        double margin = 1.96 * Math.sqrt(32.0 / 7.0) / Math.sqrt(8);

        ConfidenceInterval interval = Forecasting.calculateConfidenceInterval(values, 1.96);

        assertThat(interval.getMean()).isEqualTo(5.0);
        assertThat(interval.getLower()).isCloseTo(5.0 - margin, within(1e-9));
        assertThat(interval.getUpper()).isCloseTo(5.0 + margin, within(1e-9));
        assertThat(interval.contains(5.5)).isTrue();
        assertThat(interval.contains(9.0)).isFalse();
    }

    @Test
    @DisplayName("should leave single-value intervals unbounded")
    void unboundedInterval() {
        ConfidenceInterval interval = Forecasting.calculateConfidenceInterval(List.of(4.0), 1.96);

        assertThat(interval.isBounded()).isFalse();
        assertThat(interval.getMean()).isEqualTo(4.0);
        assertThat(interval.contains(1000.0)).isTrue();
    }
}
