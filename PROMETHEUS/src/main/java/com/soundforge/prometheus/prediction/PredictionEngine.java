package com.soundforge.prometheus.prediction;

import com.soundforge.prometheus.config.PrometheusProperties;
import com.soundforge.prometheus.domain.model.AnomalyRecord;
import com.soundforge.prometheus.domain.model.AnomalySeverity;
import com.soundforge.prometheus.domain.model.ConfidenceInterval;
import com.soundforge.prometheus.domain.model.MetricPoint;
import com.soundforge.prometheus.domain.model.Prediction;
import com.soundforge.prometheus.domain.model.PredictionModel;
import com.soundforge.prometheus.domain.model.Trend;
import com.soundforge.prometheus.notification.NotificationHub;
import com.soundforge.prometheus.observability.PrometheusMetrics;
import com.soundforge.prometheus.observability.PrometheusStructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Short-horizon forecasting over the metric history.
 * <p>
 * Every new data point recomputes the forecast of each registered model from the
 * most recent {@code prometheus.prediction.min-data-points} points. Incoming points
 * that leave a model's confidence band are reported as deviation anomalies.
 */
@Slf4j
@Service
public class PredictionEngine {

    private final Clock clock;
    private final NotificationHub notificationHub;
    private final PrometheusMetrics metrics;
    private final PrometheusStructuredLogger structuredLogger;
    private final PrometheusProperties.Prediction config;

    private final Map<String, PredictionModel> models;
    private final List<MetricPoint> history = new ArrayList<>();
    private final Map<String, Prediction> predictions = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, Double> anomalyThresholds = new ConcurrentHashMap<>();

    public PredictionEngine(PrometheusProperties properties,
                            Clock clock,
                            NotificationHub notificationHub,
                            PrometheusMetrics metrics,
                            PrometheusStructuredLogger structuredLogger) {
        this.clock = clock;
        this.notificationHub = notificationHub;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.config = properties.getPrediction();
        this.models = defaultModels();
    }

    private static Map<String, PredictionModel> defaultModels() {
        Map<String, PredictionModel> defaults = new LinkedHashMap<>();
        defaults.put("performance", PredictionModel.builder()
                .key("performance")
                .name("Performance Predictor")
                .feature(MetricPoint.CPU)
                .feature(MetricPoint.MEMORY)
                .feature(MetricPoint.LATENCY)
                .feature(MetricPoint.REQUEST_RATE)
                .horizon(Duration.ofHours(1))
                .confidence(0.95)
                .build());
        defaults.put("errors", PredictionModel.builder()
                .key("errors")
                .name("Error Rate Predictor")
                .feature(MetricPoint.ERROR_RATE)
                .feature(MetricPoint.SUCCESS_RATE)
                .feature(MetricPoint.LATENCY)
                .horizon(Duration.ofMinutes(30))
                .confidence(0.90)
                .build());
        defaults.put("usage", PredictionModel.builder()
                .key("usage")
                .name("Resource Usage Predictor")
                .feature(MetricPoint.CPU)
                .feature(MetricPoint.MEMORY)
                .feature(MetricPoint.DISK_IO)
                .feature(MetricPoint.NETWORK_IO)
                .horizon(Duration.ofHours(2))
                .confidence(0.85)
                .build());
        return Collections.unmodifiableMap(defaults);
    }

    /**
     * Append a point to the history and recompute every model.
     */
    public void addDataPoint(MetricPoint point) {
        MetricPoint stamped = point.hasTimestamp() ? point : point.withTimestamp(clock.instant());
        Instant cutoff = clock.instant().minus(config.getWindow());

        synchronized (history) {
            history.add(stamped);
            history.removeIf(p -> !p.getTimestamp().isAfter(cutoff));
        }

        updatePredictions();
    }

    private void updatePredictions() {
        for (PredictionModel model : models.values()) {
            try {
                Optional<Prediction> prediction = generatePrediction(model);
                if (prediction.isPresent()) {
                    predictions.put(model.getKey(), prediction.get());
                } else {
                    predictions.remove(model.getKey());
                }
            } catch (RuntimeException e) {
                predictions.remove(model.getKey());
                log.error("Error updating predictions for {}: {}", model.getKey(), e.getMessage(), e);
            }
        }
    }

    /**
     * Forecast the model's features from the most recent points. A feature is estimated only
     * from the points that carry it; with fewer than two samples its band is unbounded.
     *
     * @return empty while the history holds fewer points than the configured minimum
     */
    public Optional<Prediction> generatePrediction(PredictionModel model) {
        List<MetricPoint> recent;
        int sampleSize = config.getMinDataPoints();
        synchronized (history) {
            if (history.size() < sampleSize) {
                return Optional.empty();
            }
            recent = List.copyOf(history.subList(history.size() - sampleSize, history.size()));
        }

        Map<String, Double> forecasts = new LinkedHashMap<>();
        Map<String, Trend> trends = new LinkedHashMap<>();
        Map<String, ConfidenceInterval> intervals = new LinkedHashMap<>();

        for (String feature : model.getFeatures()) {
            List<Double> values = recent.stream()
                    .map(p -> p.value(feature))
                    .filter(Objects::nonNull)
                    .toList();
            trends.put(feature, Forecasting.linearRegressionTrend(values));
            forecasts.put(feature, Forecasting.exponentialSmoothing(values, config.getSmoothingFactor()));
            intervals.put(feature, Forecasting.calculateConfidenceInterval(values, config.getIntervalZScore()));
        }

        return Optional.of(Prediction.builder()
                .timestamp(clock.instant())
                .model(model.getKey())
                .modelName(model.getName())
                .horizon(model.getHorizon())
                .predictions(forecasts)
                .trends(trends)
                .intervals(intervals)
                .confidence(model.getConfidence())
                .build());
    }

    /**
     * Check a point against the confidence band of every live prediction.
     * Features the point does not carry are skipped.
     */
    public List<AnomalyRecord> detectAnomalies(MetricPoint current) {
        List<AnomalyRecord> anomalies = new ArrayList<>();

        for (Prediction prediction : snapshotPredictions().values()) {
            PredictionModel model = models.get(prediction.getModel());
            for (String feature : model.getFeatures()) {
                Double actual = current.value(feature);
                ConfidenceInterval bounds = prediction.getIntervals().get(feature);
                if (actual == null || bounds == null || bounds.contains(actual)) {
                    continue;
                }

                Double expected = prediction.getPredictions().get(feature);
                anomalies.add(AnomalyRecord.builder()
                        .source(AnomalyRecord.Source.DEVIATION)
                        .type("forecast_deviation")
                        .model(model.getKey())
                        .feature(feature)
                        .value(actual)
                        .expected(expected)
                        .bounds(bounds)
                        .severity(calculateAnomalySeverity(actual, expected, bounds))
                        .detectedAt(clock.instant())
                        .build());
            }
        }

        anomalies.forEach(this::handleAnomaly);
        return anomalies;
    }

    /**
     * Grade a deviation by its size relative to the band width: above 3 widths critical,
     * above 2 widths warning, otherwise info. A zero-width band makes any deviation critical.
     */
    public static AnomalySeverity calculateAnomalySeverity(double actual, Double expected,
                                                           ConfidenceInterval bounds) {
        double deviation = Math.abs(actual - (expected != null ? expected : bounds.getMean()));
        double range = bounds.width();

        if (range <= 0.0) {
            return deviation > 0.0 ? AnomalySeverity.CRITICAL : AnomalySeverity.INFO;
        }

        double relativeDeviation = deviation / range;
        if (relativeDeviation > 3) {
            return AnomalySeverity.CRITICAL;
        }
        if (relativeDeviation > 2) {
            return AnomalySeverity.WARNING;
        }
        return AnomalySeverity.INFO;
    }

    public Map<String, Prediction> getPredictions() {
        return snapshotPredictions();
    }

    public Optional<Prediction> getPrediction(String modelKey) {
        return Optional.ofNullable(predictions.get(modelKey));
    }

    public List<PredictionModel> getModels() {
        return List.copyOf(models.values());
    }

    public Map<String, Double> getAnomalyThresholds() {
        return new LinkedHashMap<>(anomalyThresholds);
    }

    public void updateAnomalyThresholds(Map<String, Double> thresholds) {
        thresholds.forEach((key, value) -> {
            if (value != null) {
                anomalyThresholds.put(key, value);
            }
        });
        log.info("Updated prediction anomaly thresholds: {}", thresholds);
    }

    public int getHistorySize() {
        synchronized (history) {
            return history.size();
        }
    }

    public void reset() {
        synchronized (history) {
            history.clear();
        }
        predictions.clear();
        anomalyThresholds.clear();
        log.info("Prediction state reset");
    }

    // ========== Private Methods ==========

    private Map<String, Prediction> snapshotPredictions() {
        synchronized (predictions) {
            return new LinkedHashMap<>(predictions);
        }
    }

    private void handleAnomaly(AnomalyRecord anomaly) {
        structuredLogger.logAnomaly(anomaly);
        metrics.recordAnomaly(anomaly);

        notificationHub.notifyPerformanceIssue(NotificationHub.PerformanceIssue.builder()
                .metric(anomaly.getFeature())
                .value(anomaly.getValue())
                .message(String.format("%s of %.2f is outside the %s forecast band [%.2f, %.2f]",
                        anomaly.getFeature(), anomaly.getValue(), anomaly.getModel(),
                        anomaly.getBounds().getLower(), anomaly.getBounds().getUpper()))
                .severity(anomaly.getSeverity().toNotificationSeverity())
                .build());
    }
}
