package com.soundforge.prometheus.api.v1;

import com.soundforge.prometheus.api.dto.MessageResponse;
import com.soundforge.prometheus.api.dto.PredictionsResponse;
import com.soundforge.prometheus.domain.model.MetricPoint;
import com.soundforge.prometheus.domain.model.ProviderHealth;
import com.soundforge.prometheus.domain.model.ProviderStats;
import com.soundforge.prometheus.pipeline.CurrentMetrics;
import com.soundforge.prometheus.pipeline.IngestionResult;
import com.soundforge.prometheus.pipeline.SystemStats;
import com.soundforge.prometheus.pipeline.TelemetryPipeline;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * REST API controller for telemetry, provider and system operations.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/prometheus")
@Tag(name = "Telemetry", description = "Metrics, statistics and predictions")
public class PrometheusController {

    private final TelemetryPipeline pipeline;

    public PrometheusController(TelemetryPipeline pipeline) {
        this.pipeline = pipeline;
    }

    // ========== Metrics ==========

    @GetMapping("/metrics")
    @Operation(summary = "Current metrics", description = "Request volume, success rate, latency and trends")
    public Mono<ResponseEntity<CurrentMetrics>> getMetrics() {
        return ApiResponses.ok(Mono.fromCallable(pipeline::currentMetrics), "Failed to fetch metrics");
    }

    @PostMapping("/metrics")
    @Operation(summary = "Ingest metric point",
            description = "Run a metric point through analytics, forecasting and automation")
    public Mono<ResponseEntity<IngestionResult>> ingestMetric(@RequestBody MetricPoint point) {
        log.debug("Metric point received: {}", point);
        return ApiResponses.ok(pipeline.ingest(point), "Failed to ingest metric point");
    }

    @GetMapping("/stats")
    @Operation(summary = "Statistics", description = "Current usage, trends, forecast and recent anomalies")
    public Mono<ResponseEntity<SystemStats>> getStats() {
        return ApiResponses.ok(Mono.fromCallable(pipeline::stats), "Failed to fetch statistics");
    }

    @GetMapping("/predictions")
    @Operation(summary = "Model forecasts", description = "Latest forecast of every prediction model")
    public Mono<ResponseEntity<PredictionsResponse>> getPredictions() {
        return ApiResponses.ok(Mono.fromCallable(() -> PredictionsResponse.builder()
                .predictions(pipeline.getPredictionEngine().getPredictions())
                .models(pipeline.getPredictionEngine().getModels())
                .build()), "Failed to fetch predictions");
    }

    @GetMapping("/predictions/thresholds")
    @Operation(summary = "Forecast anomaly thresholds")
    public Mono<ResponseEntity<Map<String, Double>>> getPredictionThresholds() {
        return ApiResponses.ok(Mono.fromCallable(() -> pipeline.getPredictionEngine().getAnomalyThresholds()),
                "Failed to fetch prediction thresholds");
    }

    @PutMapping("/predictions/thresholds")
    @Operation(summary = "Update forecast anomaly thresholds")
    public Mono<ResponseEntity<Map<String, Double>>> updatePredictionThresholds(@RequestBody Map<String, Double> thresholds) {
        return ApiResponses.ok(Mono.fromCallable(() -> {
            pipeline.getPredictionEngine().updateAnomalyThresholds(thresholds);
            return pipeline.getPredictionEngine().getAnomalyThresholds();
        }), "Failed to update prediction thresholds");
    }

    // ========== Thresholds ==========

    @GetMapping("/thresholds")
    @Operation(summary = "Anomaly thresholds", description = "Limits used by threshold anomaly detection")
    public Mono<ResponseEntity<Map<String, Double>>> getThresholds() {
        return ApiResponses.ok(Mono.fromCallable(() -> pipeline.getAnalyticsEngine().getThresholds()),
                "Failed to fetch thresholds");
    }

    @PutMapping("/thresholds")
    @Operation(summary = "Update anomaly thresholds", description = "Merge the given limits into the current ones")
    public Mono<ResponseEntity<Map<String, Double>>> updateThresholds(@RequestBody Map<String, Double> thresholds) {
        return ApiResponses.ok(Mono.fromCallable(() -> {
            pipeline.getAnalyticsEngine().updateThresholds(thresholds);
            return pipeline.getAnalyticsEngine().getThresholds();
        }), "Failed to update thresholds");
    }

    // ========== Providers ==========

    @GetMapping("/health")
    @Operation(summary = "Provider health", description = "Status, health score and limits of every AI provider")
    public Mono<ResponseEntity<List<ProviderHealth>>> getProvidersHealth() {
        return ApiResponses.ok(Mono.fromCallable(() -> pipeline.getProviderHealthRegistry().getProvidersHealth()),
                "Failed to fetch providers health");
    }

    @PostMapping("/providers/{provider}/toggle")
    @Operation(summary = "Toggle provider", description = "Switch a provider between active and down")
    public Mono<ResponseEntity<ProviderHealth>> toggleProvider(
            @Parameter(description = "Provider name") @PathVariable String provider) {
        return ApiResponses.ok(Mono.fromCallable(() -> pipeline.getProviderHealthRegistry().toggleProvider(provider)),
                "Failed to toggle provider");
    }

    @PostMapping("/providers/{provider}/reset-quota")
    @Operation(summary = "Reset provider quota",
            description = "Restore the remaining daily budget and zero the request counters")
    public Mono<ResponseEntity<ProviderHealth>> resetProviderQuota(
            @Parameter(description = "Provider name") @PathVariable String provider) {
        return ApiResponses.ok(Mono.fromCallable(() -> {
            ProviderHealth health = pipeline.getProviderHealthRegistry().resetProviderQuota(provider);
            if (pipeline.getProviderRegistry().getQuota(provider).isPresent()) {
                pipeline.getProviderRegistry().resetQuota(provider);
            }
            return health;
        }), "Failed to reset provider quota");
    }

    @GetMapping("/providers/stats")
    @Operation(summary = "Provider statistics", description = "Requests, errors and success rate per provider")
    public Mono<ResponseEntity<Map<String, ProviderStats>>> getProviderStats() {
        return ApiResponses.ok(Mono.fromCallable(() -> pipeline.getProviderRegistry().getProviderStats()),
                "Failed to fetch provider statistics");
    }

    // ========== System ==========

    @PostMapping("/system/reset")
    @Operation(summary = "Reset system", description = "Return every component to its initial state")
    public Mono<ResponseEntity<MessageResponse>> resetSystem() {
        return ApiResponses.ok(Mono.fromCallable(() -> {
            pipeline.resetSystem();
            return new MessageResponse("System reset successful");
        }), "Failed to reset system");
    }

    @PostMapping("/system/optimize")
    @Operation(summary = "Optimize system", description = "Raise every provider health score")
    public Mono<ResponseEntity<MessageResponse>> optimizeSystem() {
        return ApiResponses.ok(pipeline.optimizeSystem()
                .then(Mono.fromCallable(() -> new MessageResponse("System optimization completed"))),
                "Failed to optimize system");
    }
}
