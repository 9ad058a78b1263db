package com.soundforge.prometheus.provider;

import com.soundforge.prometheus.config.PrometheusProperties;
import com.soundforge.prometheus.domain.ResourceNotFoundException;
import com.soundforge.prometheus.domain.model.ProviderHealth;
import com.soundforge.prometheus.observability.PrometheusStructuredLogger;
import com.soundforge.prometheus.observability.PrometheusStructuredLogger.ProviderEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator-facing health records of the AI providers: status, synthetic health
 * score and remaining daily budget.
 */
@Slf4j
@Service
public class ProviderHealthRegistry {

    private final PrometheusProperties.Providers config;
    private final Clock clock;
    private final PrometheusStructuredLogger structuredLogger;

    private final Map<String, ProviderHealth> providers = new LinkedHashMap<>();

    public ProviderHealthRegistry(PrometheusProperties properties,
                                  Clock clock,
                                  PrometheusStructuredLogger structuredLogger) {
        this.config = properties.getProviders();
        this.clock = clock;
        this.structuredLogger = structuredLogger;
        initializeProviders();
    }

    private void initializeProviders() {
        synchronized (providers) {
            providers.clear();
            register("HuggingFace", 1.0, 60,
                    List.of("text-generation", "classification", "summarization"));
            register("OpenAI", 0.95, 3,
                    List.of("chat", "embeddings", "image-generation"));
            register("Replicate", 0.98, 10,
                    List.of("model-deployment", "inference"));
        }
    }

    private void register(String name, double healthScore, int requestsPerMinute, List<String> capabilities) {
        int daily = config.getDailyLimits().getOrDefault(name, config.getFallbackLimit());
        providers.put(name, ProviderHealth.builder()
                .name(name)
                .status(ProviderHealth.Status.ACTIVE)
                .healthScore(healthScore)
                .lastCheck(clock.instant())
                .limits(ProviderHealth.Limits.builder()
                        .requestsPerMinute(requestsPerMinute)
                        .requestsPerDay(daily)
                        .remaining(daily)
                        .build())
                .capabilities(capabilities)
                .build());
    }

    /**
     * All providers with {@code lastCheck} refreshed to now.
     */
    public List<ProviderHealth> getProvidersHealth() {
        synchronized (providers) {
            providers.values().forEach(p -> p.setLastCheck(clock.instant()));
            return providers.values().stream().map(ProviderHealth::copy).toList();
        }
    }

    /**
     * Flip a provider between active and down.
     */
    public ProviderHealth toggleProvider(String name) {
        ProviderHealth toggled;
        synchronized (providers) {
            ProviderHealth provider = require(name);
            provider.setStatus(provider.getStatus() == ProviderHealth.Status.ACTIVE
                    ? ProviderHealth.Status.DOWN
                    : ProviderHealth.Status.ACTIVE);
            toggled = provider.copy();
        }
        structuredLogger.logProviderEvent(name, ProviderEventType.TOGGLED,
                "Provider toggled", Map.of("status", toggled.getStatus().getLabel()));
        return toggled;
    }

    /**
     * Restore the remaining daily budget of a provider.
     */
    public ProviderHealth resetProviderQuota(String name) {
        ProviderHealth updated;
        synchronized (providers) {
            ProviderHealth provider = require(name);
            provider.getLimits().setRemaining(provider.getLimits().getRequestsPerDay());
            updated = provider.copy();
        }
        structuredLogger.logProviderEvent(name, ProviderEventType.QUOTA_RESET,
                "Provider budget restored", Map.of("remaining", updated.getLimits().getRemaining()));
        return updated;
    }

    /**
     * Simulated optimization pass: after the configured delay every health score
     * rises by 0.1, capped at 1.0.
     */
    public Mono<Void> optimize() {
        Duration delay = config.getOptimizeDelay();
        return Mono.delay(delay)
                .doOnNext(tick -> {
                    synchronized (providers) {
                        providers.values().forEach(p ->
                                p.setHealthScore(Math.min(1.0, p.getHealthScore() + 0.1)));
                    }
                    log.info("System optimization completed");
                })
                .then();
    }

    public void reset() {
        initializeProviders();
        log.info("Provider health reset");
    }

    private ProviderHealth require(String name) {
        ProviderHealth provider = providers.get(name);
        if (provider == null) {
            throw new ResourceNotFoundException("Provider", name);
        }
        return provider;
    }
}
