package com.soundforge.prometheus.observability;

import com.soundforge.prometheus.domain.model.AnomalyRecord;
import com.soundforge.prometheus.domain.model.NotificationSeverity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for PROMETHEUS service.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Metric ingestion and anomaly detection</li>
 *     <li>Automated response outcomes</li>
 *     <li>AI provider attempts, failures, skips and exhaustion</li>
 *     <li>Notifications published</li>
 * </ul>
 */
@Component
public class PrometheusMetrics {

    private final MeterRegistry meterRegistry;

    // Ingestion metrics
    @Getter
    private final Counter metricPointsIngested;
    private final Map<AnomalyRecord.Source, Counter> anomaliesBySource = new ConcurrentHashMap<>();

    // Automation metrics
    @Getter
    private final Counter responsesSucceeded;
    @Getter
    private final Counter responsesFailed;
    @Getter
    private final Counter ruleEvaluationErrors;
    private final Timer responseDuration;

    // Provider metrics
    private final Map<String, Counter> providerAttempts = new ConcurrentHashMap<>();
    private final Map<String, Counter> providerFailures = new ConcurrentHashMap<>();
    private final Map<String, Counter> providerSkips = new ConcurrentHashMap<>();
    @Getter
    private final Counter providersExhausted;

    // Notification metrics
    private final Map<NotificationSeverity, Counter> notificationsBySeverity = new ConcurrentHashMap<>();
    private final AtomicInteger notificationSubscribers;

    public PrometheusMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.metricPointsIngested = Counter.builder("prometheus.metrics.ingested")
                .description("Metric points ingested")
                .register(meterRegistry);

        this.responsesSucceeded = Counter.builder("prometheus.automation.responses.succeeded")
                .description("Automated responses executed successfully")
                .register(meterRegistry);
        this.responsesFailed = Counter.builder("prometheus.automation.responses.failed")
                .description("Automated responses that failed")
                .register(meterRegistry);
        this.ruleEvaluationErrors = Counter.builder("prometheus.automation.rules.errors")
                .description("Rule predicates that threw during evaluation")
                .register(meterRegistry);
        this.responseDuration = Timer.builder("prometheus.automation.responses.duration")
                .description("Automated response execution duration")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);

        this.providersExhausted = Counter.builder("prometheus.providers.exhausted")
                .description("Tasks for which every provider was skipped or failed")
                .register(meterRegistry);

        this.notificationSubscribers = meterRegistry.gauge("prometheus.notifications.subscribers",
                new AtomicInteger(0));
    }

    // ========== Ingestion Methods ==========

    public void recordMetricPoint() {
        metricPointsIngested.increment();
    }

    public void recordAnomaly(AnomalyRecord anomaly) {
        anomaliesBySource.computeIfAbsent(anomaly.getSource(), source ->
                Counter.builder("prometheus.anomalies.detected")
                        .tag("source", source.name().toLowerCase())
                        .description("Anomalies detected by source")
                        .register(meterRegistry))
                .increment();
    }

    public double anomalyCount(AnomalyRecord.Source source) {
        Counter counter = anomaliesBySource.get(source);
        return counter != null ? counter.count() : 0.0;
    }

    // ========== Automation Methods ==========

    public Timer.Sample startResponseTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordResponseSucceeded(Timer.Sample sample) {
        sample.stop(responseDuration);
        responsesSucceeded.increment();
    }

    public void recordResponseFailed(Timer.Sample sample) {
        sample.stop(responseDuration);
        responsesFailed.increment();
    }

    public void recordRuleEvaluationError() {
        ruleEvaluationErrors.increment();
    }

    // ========== Provider Methods ==========

    public void recordProviderAttempt(String provider) {
        providerCounter(providerAttempts, "prometheus.providers.attempts", provider).increment();
    }

    public void recordProviderFailure(String provider) {
        providerCounter(providerFailures, "prometheus.providers.failures", provider).increment();
    }

    public void recordProviderSkipped(String provider) {
        providerCounter(providerSkips, "prometheus.providers.skipped", provider).increment();
    }

    public void recordProvidersExhausted() {
        providersExhausted.increment();
    }

    private Counter providerCounter(Map<String, Counter> counters, String name, String provider) {
        return counters.computeIfAbsent(provider, p ->
                Counter.builder(name)
                        .tag("provider", p)
                        .register(meterRegistry));
    }

    // ========== Notification Methods ==========

    public void recordNotification(NotificationSeverity severity) {
        notificationsBySeverity.computeIfAbsent(severity, s ->
                Counter.builder("prometheus.notifications.published")
                        .tag("severity", s.getLabel())
                        .description("Notifications published by severity")
                        .register(meterRegistry))
                .increment();
    }

    public void setNotificationSubscribers(int count) {
        if (notificationSubscribers != null) {
            notificationSubscribers.set(count);
        }
    }
}
