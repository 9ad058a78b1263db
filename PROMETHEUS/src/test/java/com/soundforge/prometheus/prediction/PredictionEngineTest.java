package com.soundforge.prometheus.prediction;

import com.soundforge.prometheus.domain.model.AnomalyRecord;
import com.soundforge.prometheus.domain.model.AnomalySeverity;
import com.soundforge.prometheus.domain.model.ConfidenceInterval;
import com.soundforge.prometheus.domain.model.MetricPoint;
import com.soundforge.prometheus.domain.model.Prediction;
import com.soundforge.prometheus.domain.model.PredictionModel;
import com.soundforge.prometheus.domain.model.Trend;
import com.soundforge.prometheus.support.TestComponents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link PredictionEngine}.
 */
class PredictionEngineTest {

    private TestComponents components;
    private PredictionEngine engine;

    @BeforeEach
    void setUp() {
        components = TestComponents.create();
        engine = new PredictionEngine(components.properties, components.clock,
                components.notificationHub, components.metrics, components.structuredLogger);
    }

    private void addCpuSeries(double... values) {
        for (double value : values) {
            engine.addDataPoint(MetricPoint.builder().cpu(value).memory(40.0).build());
        }
    }

    @Nested
    @DisplayName("Models")
    class ModelTests {

        @Test
        @DisplayName("should seed the three default models")
        void seedsModels() {
            List<PredictionModel> models = engine.getModels();

            assertThat(models).extracting(PredictionModel::getKey)
                    .containsExactly("performance", "errors", "usage");
            assertThat(models.get(0).getFeatures()).containsExactly("cpu", "memory", "latency", "requestRate");
            assertThat(models.get(1).getHorizon()).isEqualTo(Duration.ofMinutes(30));
            assertThat(models.get(2).getConfidence()).isEqualTo(0.85);
        }
    }

    @Nested
    @DisplayName("Forecasts")
    class ForecastTests {

        @Test
        @DisplayName("should predict nothing until ten points are recorded")
        void needsTenPoints() {
            addCpuSeries(50, 51, 52, 53, 54, 55, 56, 57, 58);
            assertThat(engine.getPredictions()).isEmpty();

            addCpuSeries(59);
            assertThat(engine.getPredictions()).containsOnlyKeys("performance", "errors", "usage");
        }

        @Test
        @DisplayName("should forecast each model feature from the last ten points")
        void forecastsFeatures() {
            addCpuSeries(10, 20, 30, 40, 50, 60, 70, 80, 90, 100);

            Prediction performance = engine.getPrediction("performance").orElseThrow();
            assertThat(performance.getModelName()).isEqualTo("Performance Predictor");
            assertThat(performance.getTrends().get("cpu")).isEqualTo(Trend.INCREASING);
            assertThat(performance.getTrends().get("memory")).isEqualTo(Trend.STABLE);
            assertThat(performance.getPredictions().get("memory")).isCloseTo(40.0, within(1e-9));
            assertThat(performance.getIntervals().get("cpu").isBounded()).isTrue();
            assertThat(performance.getConfidence()).isEqualTo(0.95);
        }

        @Test
        @DisplayName("should leave features without samples unbounded and unforecast")
        void featuresWithoutSamples() {
            addCpuSeries(50, 50, 50, 50, 50, 50, 50, 50, 50, 50);

            Prediction usage = engine.getPrediction("usage").orElseThrow();
            assertThat(usage.getPredictions().get("diskIO")).isNull();
            assertThat(usage.getIntervals().get("diskIO").isBounded()).isFalse();
            assertThat(usage.getTrends().get("diskIO")).isEqualTo(Trend.STABLE);
        }

        @Test
        @DisplayName("should estimate a sparse feature only from the points that carry it")
        void sparseFeature() {
            engine.addDataPoint(MetricPoint.builder().cpu(50.0).latency(120.0).build());
            addCpuSeries(50, 50, 50, 50, 50, 50, 50, 50, 50);

            Prediction performance = engine.getPrediction("performance").orElseThrow();
            assertThat(performance.getPredictions().get("latency")).isEqualTo(120.0);
            assertThat(performance.getIntervals().get("latency").isBounded()).isFalse();
            assertThat(performance.getIntervals().get("latency").getMean()).isEqualTo(120.0);
        }

        @Test
        @DisplayName("should drop history older than the window")
        void prunesHistory() {
            addCpuSeries(50, 50, 50, 50, 50, 50, 50, 50, 50, 50);
            components.clock.advance(Duration.ofHours(25));
            addCpuSeries(50);

            assertThat(engine.getHistorySize()).isEqualTo(1);
            assertThat(engine.getPredictions()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Deviation Anomalies")
    class AnomalyTests {

        @Test
        @DisplayName("should flag values outside the forecast band")
        void flagsDeviation() {
            addCpuSeries(50, 52, 50, 52, 50, 52, 50, 52, 50, 52);

            List<AnomalyRecord> anomalies = engine.detectAnomalies(MetricPoint.builder().cpu(90.0).build());

            assertThat(anomalies).extracting(AnomalyRecord::getModel).containsExactly("performance", "usage");
            assertThat(anomalies).allSatisfy(anomaly -> {
                assertThat(anomaly.getFeature()).isEqualTo("cpu");
                assertThat(anomaly.getSource()).isEqualTo(AnomalyRecord.Source.DEVIATION);
                assertThat(anomaly.getSeverity()).isEqualTo(AnomalySeverity.CRITICAL);
                assertThat(anomaly.getBounds().isBounded()).isTrue();
            });
            assertThat(components.notificationHub.getNotifications()).hasSize(2);
        }

        @Test
        @DisplayName("should skip values inside the band and absent features")
        void ignoresInBandValues() {
            addCpuSeries(50, 52, 50, 52, 50, 52, 50, 52, 50, 52);

            assertThat(engine.detectAnomalies(MetricPoint.builder().cpu(51.0).build())).isEmpty();
            assertThat(engine.detectAnomalies(MetricPoint.builder().latency(5000.0).build())).isEmpty();
        }

        @Test
        @DisplayName("should not flag the first value of a feature absent from the history")
        void firstValueOfNewFeature() {
            addCpuSeries(50, 50, 50, 50, 50, 50, 50, 50, 50, 50);

            assertThat(engine.detectAnomalies(MetricPoint.builder().latency(5000.0).errorRate(0.9).build()))
                    .isEmpty();
            assertThat(components.notificationHub.getNotifications()).isEmpty();
        }

        @Test
        @DisplayName("should treat any deviation from a zero-width band as critical")
        void zeroWidthBand() {
            addCpuSeries(50, 50, 50, 50, 50, 50, 50, 50, 50, 50);

            assertThat(engine.detectAnomalies(MetricPoint.builder().cpu(50.0).build())).isEmpty();
            assertThat(engine.detectAnomalies(MetricPoint.builder().cpu(51.0).build()))
                    .extracting(AnomalyRecord::getSeverity)
                    .containsOnly(AnomalySeverity.CRITICAL);
        }

        @Test
        @DisplayName("should grade severity by deviation relative to band width")
        void severityGrows() {
            ConfidenceInterval bounds = ConfidenceInterval.of(0.0, 1.0, 0.5);

            assertThat(PredictionEngine.calculateAnomalySeverity(1.5, 0.5, bounds)).isEqualTo(AnomalySeverity.INFO);
            assertThat(PredictionEngine.calculateAnomalySeverity(2.6, 0.5, bounds)).isEqualTo(AnomalySeverity.WARNING);
            assertThat(PredictionEngine.calculateAnomalySeverity(4.0, 0.5, bounds)).isEqualTo(AnomalySeverity.CRITICAL);
        }
    }

    @Test
    @DisplayName("should merge anomaly thresholds and clear everything on reset")
    void thresholdsAndReset() {
        engine.updateAnomalyThresholds(Map.of("cpu", 2.5));
        addCpuSeries(50, 50, 50, 50, 50, 50, 50, 50, 50, 50);
        assertThat(engine.getAnomalyThresholds()).containsEntry("cpu", 2.5);

        engine.reset();

        assertThat(engine.getPredictions()).isEmpty();
        assertThat(engine.getHistorySize()).isZero();
        assertThat(engine.getAnomalyThresholds()).isEmpty();
    }
}
