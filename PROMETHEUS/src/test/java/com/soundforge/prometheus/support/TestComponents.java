package com.soundforge.prometheus.support;

import com.soundforge.prometheus.config.PrometheusProperties;
import com.soundforge.prometheus.notification.NotificationHub;
import com.soundforge.prometheus.observability.PrometheusMetrics;
import com.soundforge.prometheus.observability.PrometheusStructuredLogger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Real collaborators wired by hand for unit tests.
 */
public final class TestComponents {

    public final PrometheusProperties properties;
    public final MutableClock clock;
    public final SimpleMeterRegistry meterRegistry;
    public final PrometheusMetrics metrics;
    public final PrometheusStructuredLogger structuredLogger;
    public final NotificationHub notificationHub;

    private TestComponents(PrometheusProperties properties, MutableClock clock) {
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = new SimpleMeterRegistry();
        this.metrics = new PrometheusMetrics(meterRegistry);
        this.structuredLogger = new PrometheusStructuredLogger();
        this.notificationHub = new NotificationHub(properties, clock, metrics, structuredLogger);
    }

    public static TestComponents create() {
        return create(new PrometheusProperties());
    }

    public static TestComponents create(PrometheusProperties properties) {
        return new TestComponents(properties, MutableClock.startingAt("2024-03-01T12:00:00Z"));
    }
}
