package com.soundforge.prometheus.pipeline;

import com.soundforge.prometheus.analytics.AnalyticsEngine;
import com.soundforge.prometheus.automation.AutomationEngine;
import com.soundforge.prometheus.domain.model.AnomalyRecord;
import com.soundforge.prometheus.domain.model.MetricPoint;
import com.soundforge.prometheus.domain.model.Trend;
import com.soundforge.prometheus.prediction.PredictionEngine;
import com.soundforge.prometheus.provider.ProviderFallbackRegistry;
import com.soundforge.prometheus.provider.ProviderHealthRegistry;
import com.soundforge.prometheus.support.TestComponents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link TelemetryPipeline} wired with real engines.
 */
class TelemetryPipelineTest {

    private TestComponents components;
    private TelemetryPipeline pipeline;

    @BeforeEach
    void setUp() {
        components = TestComponents.create();
        var properties = components.properties;
        var clock = components.clock;
        var hub = components.notificationHub;
        var metrics = components.metrics;
        var logger = components.structuredLogger;

        pipeline = new TelemetryPipeline(clock,
                new AnalyticsEngine(properties, clock, hub, metrics, logger),
                new PredictionEngine(properties, clock, hub, metrics, logger),
                new AutomationEngine(properties, clock, (response, point) -> Mono.empty(), hub, metrics, logger),
                new ProviderFallbackRegistry(properties, clock, hub, metrics, logger),
                new ProviderHealthRegistry(properties, clock, logger),
                hub,
                logger);
    }

    @Test
    @DisplayName("should run a point through analytics, forecasting and automation")
    void ingestRunsEveryStage() {
        MetricPoint point = MetricPoint.builder().latency(450.0).cpu(95.0).errorRate(0.0).build();

        StepVerifier.create(pipeline.ingest(point))
                .assertNext(result -> {
                    assertThat(result.getPoint().getTimestamp()).isEqualTo(components.clock.instant());
                    assertThat(result.getThresholdAnomalies()).extracting(AnomalyRecord::getType)
                            .containsExactly("latency");
                    assertThat(result.getDeviationAnomalies()).isEmpty();
                    assertThat(result.getTriggeredRules()).containsExactly("high-cpu");
                })
                .verifyComplete();

        assertThat(pipeline.getAnalyticsEngine().getWindowSize()).isEqualTo(1);
        assertThat(pipeline.getPredictionEngine().getHistorySize()).isEqualTo(1);
        assertThat(components.metrics.anomalyCount(AnomalyRecord.Source.THRESHOLD)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should keep a timestamp supplied by the caller")
    void keepsTimestamp() {
        Instant earlier = Instant.parse("2024-03-01T11:59:00Z");

        StepVerifier.create(pipeline.ingest(MetricPoint.builder().timestamp(earlier).latency(10.0).build()))
                .assertNext(result -> assertThat(result.getPoint().getTimestamp()).isEqualTo(earlier))
                .verifyComplete();
    }

    @Test
    @DisplayName("should detect forecast deviations once enough history exists")
    void deviationAfterHistory() {
        for (int i = 0; i < 10; i++) {
            pipeline.ingest(MetricPoint.builder().memory(i % 2 == 0 ? 40.0 : 42.0).build()).block();
        }

        StepVerifier.create(pipeline.ingest(MetricPoint.builder().memory(95.0).build()))
                .assertNext(result -> assertThat(result.getDeviationAnomalies())
                        .extracting(AnomalyRecord::getFeature)
                        .containsOnly("memory")
                        .isNotEmpty())
                .verifyComplete();
    }

    @Test
    @DisplayName("should keep analytics and automation error thresholds independent")
    void independentThresholds() {
        pipeline.getAnalyticsEngine().updateThresholds(Map.of(AnalyticsEngine.THRESHOLD_ERROR_RATE, 0.5));

        StepVerifier.create(pipeline.ingest(MetricPoint.builder().errorRate(0.2).build()))
                .assertNext(result -> {
                    assertThat(result.getThresholdAnomalies()).isEmpty();
                    assertThat(result.getTriggeredRules()).containsExactly("error-spike");
                })
                .verifyComplete();

        pipeline.getAnalyticsEngine().reset();
        components.properties.getAutomation().setErrorRateThreshold(0.5);

        StepVerifier.create(pipeline.ingest(MetricPoint.builder().errorRate(0.2).build()))
                .assertNext(result -> {
                    assertThat(result.getThresholdAnomalies()).extracting(AnomalyRecord::getType)
                            .containsExactly("error_rate");
                    assertThat(result.getTriggeredRules()).isEmpty();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should read current metrics without recording a point")
    void currentMetricsIsReadOnly() {
        pipeline.ingest(MetricPoint.builder().latency(100.0).errorRate(0.2).build()).block();

        CurrentMetrics current = pipeline.currentMetrics();

        assertThat(current.getLatency()).isEqualTo(100.0);
        assertThat(current.getSuccessRate()).isCloseTo(80.0, within(1e-9));
        assertThat(current.getTrends()).containsEntry("latency", Trend.STABLE);
        assertThat(pipeline.getAnalyticsEngine().getWindowSize()).isEqualTo(1);
    }

    @Test
    @DisplayName("should report daily usage from provider counters")
    void statsUseProviderCounters() {
        pipeline.getProviderRegistry().updateQuota("OpenAI", true);
        pipeline.getProviderRegistry().updateQuota("Replicate", false);

        SystemStats stats = pipeline.stats();

        assertThat(stats.getCurrent().getDailyUsage()).isEqualTo(2);
        assertThat(stats.getCurrent().getSuccessRate()).isEqualTo(100.0);
        assertThat(stats.getPredictions().getNextHourRequests()).isNull();
    }

    @Test
    @DisplayName("should return every component to its initial state")
    void resetSystem() {
        pipeline.ingest(MetricPoint.builder().latency(900.0).cpu(99.0).build()).block();
        pipeline.getProviderHealthRegistry().toggleProvider("OpenAI");
        assertThat(components.notificationHub.getNotifications()).isNotEmpty();

        pipeline.resetSystem();

        assertThat(pipeline.getAnalyticsEngine().getWindowSize()).isZero();
        assertThat(pipeline.getPredictionEngine().getHistorySize()).isZero();
        assertThat(pipeline.getAutomationEngine().getResponses())
                .allSatisfy(r -> assertThat(r.getSuccessCount()).isZero());
        assertThat(pipeline.getProviderRegistry().totalRequests()).isZero();
        assertThat(pipeline.getProviderHealthRegistry().getProvidersHealth())
                .allSatisfy(p -> assertThat(p.getStatus().getLabel()).isEqualTo("active"));
        assertThat(components.notificationHub.getNotifications()).isEmpty();
    }
}
