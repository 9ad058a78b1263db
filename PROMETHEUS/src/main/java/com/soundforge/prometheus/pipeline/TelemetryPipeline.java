package com.soundforge.prometheus.pipeline;

import com.soundforge.prometheus.analytics.AnalyticsEngine;
import com.soundforge.prometheus.analytics.AnalyticsEngine.AnalyticsReport;
import com.soundforge.prometheus.analytics.AnalyticsEngine.AnalyticsSummary;
import com.soundforge.prometheus.automation.AutomationEngine;
import com.soundforge.prometheus.domain.model.AnomalyRecord;
import com.soundforge.prometheus.domain.model.MetricPoint;
import com.soundforge.prometheus.notification.NotificationHub;
import com.soundforge.prometheus.observability.PrometheusStructuredLogger;
import com.soundforge.prometheus.prediction.PredictionEngine;
import com.soundforge.prometheus.provider.ProviderFallbackRegistry;
import com.soundforge.prometheus.provider.ProviderHealthRegistry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Entry point of the telemetry flow.
 * <p>
 * A metric point passes through threshold analytics, forecasting, deviation
 * detection and rule evaluation, in that order. The pipeline also serves the
 * aggregated read views and resets every component on request.
 */
@Slf4j
@Service
@Getter
public class TelemetryPipeline {

    private final Clock clock;
    private final AnalyticsEngine analyticsEngine;
    private final PredictionEngine predictionEngine;
    private final AutomationEngine automationEngine;
    private final ProviderFallbackRegistry providerRegistry;
    private final ProviderHealthRegistry providerHealthRegistry;
    private final NotificationHub notificationHub;
    private final PrometheusStructuredLogger structuredLogger;

    public TelemetryPipeline(Clock clock,
                             AnalyticsEngine analyticsEngine,
                             PredictionEngine predictionEngine,
                             AutomationEngine automationEngine,
                             ProviderFallbackRegistry providerRegistry,
                             ProviderHealthRegistry providerHealthRegistry,
                             NotificationHub notificationHub,
                             PrometheusStructuredLogger structuredLogger) {
        this.clock = clock;
        this.analyticsEngine = analyticsEngine;
        this.predictionEngine = predictionEngine;
        this.automationEngine = automationEngine;
        this.providerRegistry = providerRegistry;
        this.providerHealthRegistry = providerHealthRegistry;
        this.notificationHub = notificationHub;
        this.structuredLogger = structuredLogger;
    }

    /**
     * Push one metric point through the whole flow.
     */
    public Mono<IngestionResult> ingest(MetricPoint point) {
        return Mono.defer(() -> {
            MetricPoint stamped = point.hasTimestamp() ? point : point.withTimestamp(clock.instant());
            IngestionResult.IngestionResultBuilder result = IngestionResult.builder().point(stamped);

            try (var scope = structuredLogger.withCorrelationId(UUID.randomUUID().toString())) {
                List<AnomalyRecord> thresholdAnomalies = analyticsEngine.recordMetric(stamped);
                predictionEngine.addDataPoint(stamped);
                List<AnomalyRecord> deviationAnomalies = predictionEngine.detectAnomalies(stamped);

                log.debug("Metric point ingested: thresholdAnomalies={}, deviationAnomalies={}",
                        thresholdAnomalies.size(), deviationAnomalies.size());
                result.thresholdAnomalies(thresholdAnomalies)
                        .deviationAnomalies(deviationAnomalies);
            }

            return automationEngine.evaluateMetrics(stamped)
                    .map(triggered -> result.triggeredRules(triggered).build());
        });
    }

    /**
     * Current load view. Reading it does not record a metric point.
     */
    public CurrentMetrics currentMetrics() {
        AnalyticsSummary summary = analyticsEngine.calculateSummaryMetrics();
        return CurrentMetrics.builder()
                .timestamp(clock.instant())
                .requestsPerMinute(providerRegistry.totalRequests())
                .successRate(summary.getAverageSuccessRate())
                .latency(summary.getAverageLatency())
                .trends(analyticsEngine.calculateTrends())
                .build();
    }

    public SystemStats stats() {
        AnalyticsReport analytics = analyticsEngine.getAnalytics();
        return SystemStats.builder()
                .current(SystemStats.Current.builder()
                        .dailyUsage(providerRegistry.totalRequests())
                        .successRate(analytics.getSummary().getAverageSuccessRate())
                        .averageLatency(analytics.getSummary().getAverageLatency())
                        .build())
                .trends(analytics.getTrends())
                .predictions(analytics.getPredictions())
                .anomalies(analytics.getAnomalies())
                .build();
    }

    /**
     * Return every component to its initial state.
     */
    public void resetSystem() {
        analyticsEngine.reset();
        predictionEngine.reset();
        automationEngine.reset();
        providerRegistry.resetQuotas();
        providerHealthRegistry.reset();
        notificationHub.clearNotifications();
        log.info("System reset successful");
    }

    public Mono<Void> optimizeSystem() {
        return providerHealthRegistry.optimize();
    }
}
