package com.soundforge.prometheus.analytics;

import com.soundforge.prometheus.config.PrometheusProperties;
import com.soundforge.prometheus.domain.model.AnomalyRecord;
import com.soundforge.prometheus.domain.model.AnomalySeverity;
import com.soundforge.prometheus.domain.model.MetricPoint;
import com.soundforge.prometheus.domain.model.Trend;
import com.soundforge.prometheus.notification.NotificationHub;
import com.soundforge.prometheus.observability.PrometheusMetrics;
import com.soundforge.prometheus.observability.PrometheusStructuredLogger;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolling analytics over the metric window.
 * <p>
 * Keeps every point of the last {@code prometheus.analytics.window} and derives
 * summary averages, trend labels, a next-hour request forecast and threshold anomalies.
 * Threshold anomalies are logged, counted and forwarded to the {@link NotificationHub}.
 */
@Slf4j
@Service
public class AnalyticsEngine {

    public static final String THRESHOLD_LATENCY = "latency";
    public static final String THRESHOLD_ERROR_RATE = "errorRate";
    public static final String THRESHOLD_REQUEST_SPIKE = "requestSpike";

    static final List<String> TREND_FEATURES = List.of(
            MetricPoint.LATENCY, MetricPoint.REQUESTS_PER_MINUTE, MetricPoint.ERROR_RATE);

    private final Clock clock;
    private final NotificationHub notificationHub;
    private final PrometheusMetrics metrics;
    private final PrometheusStructuredLogger structuredLogger;
    private final PrometheusProperties.Analytics config;

    private final List<MetricPoint> window = new ArrayList<>();
    private final List<AnomalyRecord> recentAnomalies = new ArrayList<>();
    private final Map<String, Double> thresholds = new ConcurrentHashMap<>();

    public AnalyticsEngine(PrometheusProperties properties,
                           Clock clock,
                           NotificationHub notificationHub,
                           PrometheusMetrics metrics,
                           PrometheusStructuredLogger structuredLogger) {
        this.clock = clock;
        this.notificationHub = notificationHub;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.config = properties.getAnalytics();
        this.thresholds.putAll(config.getThresholds());
    }

    /**
     * Append a point to the window and check it against the thresholds.
     *
     * @return anomalies found in this point, possibly empty
     */
    public List<AnomalyRecord> recordMetric(MetricPoint point) {
        MetricPoint stamped = point.hasTimestamp() ? point : point.withTimestamp(clock.instant());
        Instant cutoff = clock.instant().minus(config.getWindow());

        synchronized (window) {
            window.add(stamped);
            window.removeIf(p -> !p.getTimestamp().isAfter(cutoff));
        }
        metrics.recordMetricPoint();

        return detectAnomalies(stamped);
    }

    /**
     * Compare a point against the current thresholds. Features the point does not
     * carry are never anomalous.
     */
    public List<AnomalyRecord> detectAnomalies(MetricPoint point) {
        List<AnomalyRecord> anomalies = new ArrayList<>();

        checkThreshold(point.getLatency(), THRESHOLD_LATENCY, "latency", AnomalySeverity.HIGH)
                .ifPresent(anomalies::add);
        checkThreshold(point.getErrorRate(), THRESHOLD_ERROR_RATE, "error_rate", AnomalySeverity.HIGH)
                .ifPresent(anomalies::add);
        checkThreshold(point.getRequestsPerMinute(), THRESHOLD_REQUEST_SPIKE, "request_spike", AnomalySeverity.MEDIUM)
                .ifPresent(anomalies::add);

        anomalies.forEach(this::handleAnomaly);
        return anomalies;
    }

    /**
     * Averages over the whole window. An empty window reports zero load and full success.
     */
    public AnalyticsSummary calculateSummaryMetrics() {
        List<MetricPoint> points = snapshot();
        if (points.isEmpty()) {
            return AnalyticsSummary.builder()
                    .averageLatency(0)
                    .averageRequestsPerMinute(0)
                    .averageSuccessRate(100)
                    .totalRequests(0)
                    .build();
        }

        double latency = 0;
        double requests = 0;
        double successRate = 0;
        for (MetricPoint point : points) {
            latency += point.valueOrZero(MetricPoint.LATENCY);
            requests += point.valueOrZero(MetricPoint.REQUESTS_PER_MINUTE);
            successRate += (1 - point.valueOrZero(MetricPoint.ERROR_RATE)) * 100;
        }

        int count = points.size();
        return AnalyticsSummary.builder()
                .averageLatency(latency / count)
                .averageRequestsPerMinute(requests / count)
                .averageSuccessRate(successRate / count)
                .totalRequests(requests)
                .build();
    }

    /**
     * Trend labels over the most recent points of the window.
     */
    public Map<String, Trend> calculateTrends() {
        List<MetricPoint> points = snapshot();
        Map<String, Trend> trends = new LinkedHashMap<>();

        if (points.size() < 2) {
            TREND_FEATURES.forEach(feature -> trends.put(feature, Trend.STABLE));
            return trends;
        }

        List<MetricPoint> recent = tail(points, config.getTrendSampleSize());
        for (String feature : TREND_FEATURES) {
            trends.put(feature, calculateTrend(values(recent, feature)));
        }
        return trends;
    }

    /**
     * Compare the last value of a series with the series mean.
     * An empty series or a zero mean is stable.
     */
    public static Trend calculateTrend(List<Double> values) {
        if (values == null || values.isEmpty()) {
            return Trend.STABLE;
        }
        double average = values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        if (average == 0.0) {
            return Trend.STABLE;
        }
        double recent = values.get(values.size() - 1);
        return Trend.fromRelativeChange((recent - average) / average);
    }

    /**
     * Next-hour request forecast. Needs a full forecast sample before it produces a value.
     */
    public NextHourForecast generatePredictions() {
        List<MetricPoint> points = snapshot();
        int sampleSize = config.getForecastSampleSize();

        if (points.size() < sampleSize) {
            return NextHourForecast.builder()
                    .nextHourRequests(null)
                    .potentialIssues(List.of())
                    .build();
        }

        List<MetricPoint> recent = tail(points, sampleSize);
        double averageRequests = values(recent, MetricPoint.REQUESTS_PER_MINUTE).stream()
                .mapToDouble(Double::doubleValue)
                .sum() / sampleSize;

        List<PotentialIssue> issues = new ArrayList<>();
        if (calculateTrend(values(recent, MetricPoint.LATENCY)) == Trend.INCREASING) {
            issues.add(PotentialIssue.builder()
                    .type("latency")
                    .severity("warning")
                    .message("Latency is showing an upward trend")
                    .build());
        }

        return NextHourForecast.builder()
                .nextHourRequests(Math.round(averageRequests * 60))
                .potentialIssues(issues)
                .build();
    }

    /**
     * Full analytics view: summary, trends, last-hour anomalies and forecast.
     */
    public AnalyticsReport getAnalytics() {
        return AnalyticsReport.builder()
                .summary(calculateSummaryMetrics())
                .trends(calculateTrends())
                .anomalies(getRecentAnomalies())
                .predictions(generatePredictions())
                .build();
    }

    public List<AnomalyRecord> getRecentAnomalies() {
        Instant cutoff = clock.instant().minus(config.getAnomalyRetention());
        synchronized (recentAnomalies) {
            recentAnomalies.removeIf(a -> !a.getDetectedAt().isAfter(cutoff));
            return List.copyOf(recentAnomalies);
        }
    }

    /**
     * Merge new limits into the current thresholds; keys not given keep their value.
     */
    public void updateThresholds(Map<String, Double> newThresholds) {
        newThresholds.forEach((key, value) -> {
            if (value != null) {
                thresholds.put(key, value);
            }
        });
        log.info("Updated anomaly thresholds: {}", newThresholds);
    }

    public Map<String, Double> getThresholds() {
        return new LinkedHashMap<>(thresholds);
    }

    public int getWindowSize() {
        synchronized (window) {
            return window.size();
        }
    }

    /**
     * Drop the window and the anomaly log and restore configured thresholds.
     */
    public void reset() {
        synchronized (window) {
            window.clear();
        }
        synchronized (recentAnomalies) {
            recentAnomalies.clear();
        }
        thresholds.clear();
        thresholds.putAll(config.getThresholds());
        log.info("Analytics state reset");
    }

    // ========== Private Methods ==========

    private Optional<AnomalyRecord> checkThreshold(Double value, String thresholdKey,
                                                             String type, AnomalySeverity severity) {
        Double threshold = thresholds.get(thresholdKey);
        if (value == null || threshold == null || value <= threshold) {
            return Optional.empty();
        }
        return Optional.of(AnomalyRecord.builder()
                .source(AnomalyRecord.Source.THRESHOLD)
                .type(type)
                .value(value)
                .threshold(threshold)
                .severity(severity)
                .detectedAt(clock.instant())
                .build());
    }

    private void handleAnomaly(AnomalyRecord anomaly) {
        structuredLogger.logAnomaly(anomaly);
        metrics.recordAnomaly(anomaly);
        synchronized (recentAnomalies) {
            recentAnomalies.add(anomaly);
        }

        notificationHub.notifyPerformanceIssue(NotificationHub.PerformanceIssue.builder()
                .metric(anomaly.getType())
                .value(anomaly.getValue())
                .threshold(anomaly.getThreshold())
                .message(String.format("%s of %.2f exceeds threshold %.2f",
                        anomaly.getType(), anomaly.getValue(), anomaly.getThreshold()))
                .severity(anomaly.getSeverity().toNotificationSeverity())
                .build());
    }

    private List<MetricPoint> snapshot() {
        synchronized (window) {
            return List.copyOf(window);
        }
    }

    private static List<MetricPoint> tail(List<MetricPoint> points, int size) {
        return points.subList(Math.max(0, points.size() - size), points.size());
    }

    private static List<Double> values(List<MetricPoint> points, String feature) {
        return points.stream().map(p -> p.valueOrZero(feature)).toList();
    }

    // ========== Data Classes ==========

    @Value
    @Builder
    public static class AnalyticsSummary {
        double averageLatency;
        double averageRequestsPerMinute;
        /** Percentage */
        double averageSuccessRate;
        /** Sum of requests per minute over the window */
        double totalRequests;
    }

    @Value
    @Builder
    public static class NextHourForecast {
        Long nextHourRequests;
        List<PotentialIssue> potentialIssues;
    }

    @Value
    @Builder
    public static class PotentialIssue {
        String type;
        String severity;
        String message;
    }

    @Value
    @Builder
    public static class AnalyticsReport {
        AnalyticsSummary summary;
        Map<String, Trend> trends;
        List<AnomalyRecord> anomalies;
        NextHourForecast predictions;
    }
}
