package com.soundforge.prometheus.provider;

import com.soundforge.prometheus.config.PrometheusProperties;
import com.soundforge.prometheus.domain.ResourceNotFoundException;
import com.soundforge.prometheus.domain.model.ProviderQuota;
import com.soundforge.prometheus.domain.model.ProviderStats;
import com.soundforge.prometheus.notification.NotificationHub;
import com.soundforge.prometheus.observability.PrometheusMetrics;
import com.soundforge.prometheus.observability.PrometheusStructuredLogger;
import com.soundforge.prometheus.observability.PrometheusStructuredLogger.ProviderEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs AI tasks against an ordered chain of rate-limited providers.
 * <p>
 * Providers are tried strictly one at a time. A provider whose request count has
 * reached its daily limit is skipped without touching its counters; a failing provider
 * is charged a request and an error and the next provider is tried. When the chain
 * runs out the task fails with {@link ProviderExhaustionException}.
 */
@Slf4j
@Service
public class ProviderFallbackRegistry {

    public static final String EXHAUSTED_MESSAGE = "All providers failed to execute task";

    private final PrometheusProperties.Providers config;
    private final Clock clock;
    private final NotificationHub notificationHub;
    private final PrometheusMetrics metrics;
    private final PrometheusStructuredLogger structuredLogger;

    private final Map<String, ProviderQuota> quotas = new LinkedHashMap<>();

    public ProviderFallbackRegistry(PrometheusProperties properties,
                                    Clock clock,
                                    NotificationHub notificationHub,
                                    PrometheusMetrics metrics,
                                    PrometheusStructuredLogger structuredLogger) {
        this.config = properties.getProviders();
        this.clock = clock;
        this.notificationHub = notificationHub;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        initializeQuotas();
    }

    private void initializeQuotas() {
        synchronized (quotas) {
            quotas.clear();
            config.getDefaultOrder().forEach(provider ->
                    quotas.put(provider, ProviderQuota.fresh(provider, clock.instant())));
        }
    }

    /**
     * Run a task against the default provider order.
     */
    public <T> Mono<T> executeWithFallback(ProviderTask<T> task) {
        return executeWithFallback(task, config.getDefaultOrder());
    }

    /**
     * Run a task against the given providers, in order, until one succeeds.
     */
    public <T> Mono<T> executeWithFallback(ProviderTask<T> task, List<String> providers) {
        return Mono.defer(() -> attempt(task, List.copyOf(providers), 0));
    }

    private <T> Mono<T> attempt(ProviderTask<T> task, List<String> providers, int index) {
        if (index >= providers.size()) {
            metrics.recordProvidersExhausted();
            log.error("{} | providers={}", EXHAUSTED_MESSAGE, providers);
            return Mono.error(new ProviderExhaustionException(providers));
        }

        String provider = providers.get(index);
        long requests = quotaFor(provider).getRequests();
        int limit = getProviderLimit(provider);
        if (requests >= limit) {
            metrics.recordProviderSkipped(provider);
            structuredLogger.logProviderEvent(provider, ProviderEventType.QUOTA_EXCEEDED,
                    provider + " quota exceeded", Map.of("requests", requests, "limit", limit));
            return attempt(task, providers, index + 1);
        }

        metrics.recordProviderAttempt(provider);
        return Mono.defer(() -> task.execute(provider))
                .doOnSuccess(result -> {
                    updateQuota(provider, true);
                    structuredLogger.logProviderEvent(provider, ProviderEventType.SUCCEEDED,
                            "Task executed", null);
                })
                .onErrorResume(error -> {
                    metrics.recordProviderFailure(provider);
                    structuredLogger.logProviderEvent(provider, ProviderEventType.FAILED,
                            provider + " execution failed", Map.of("error", String.valueOf(error.getMessage())));
                    updateQuota(provider, false);
                    notificationHub.notifyAIProviderIssue(provider, NotificationHub.ProviderIssue.builder()
                            .type("execution_failed")
                            .message(provider + " execution failed, trying next provider")
                            .details(error.getMessage())
                            .build());
                    return attempt(task, providers, index + 1);
                });
    }

    /**
     * Charge one request to a provider, and one error when the request failed.
     */
    public void updateQuota(String provider, boolean success) {
        ProviderQuota snapshot;
        synchronized (quotas) {
            ProviderQuota quota = quotaFor(provider);
            quota.setRequests(quota.getRequests() + 1);
            if (!success) {
                quota.setErrors(quota.getErrors() + 1);
            }
            snapshot = quota.toBuilder().build();
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("requests", snapshot.getRequests());
        details.put("errors", snapshot.getErrors());
        structuredLogger.logProviderEvent(provider, ProviderEventType.QUOTA_UPDATED,
                "Updated quota for " + provider, details);
    }

    /**
     * Daily request limit; providers without a configured limit get the fallback limit.
     */
    public int getProviderLimit(String provider) {
        return config.getDailyLimits().getOrDefault(provider, config.getFallbackLimit());
    }

    /**
     * Zero every counter and forget providers created on demand.
     */
    public void resetQuotas() {
        initializeQuotas();
        log.info("All provider quotas reset");
    }

    /**
     * Zero the counters of one provider.
     *
     * @throws ResourceNotFoundException when the provider has no quota record
     */
    public ProviderQuota resetQuota(String provider) {
        ProviderQuota fresh = ProviderQuota.fresh(provider, clock.instant());
        synchronized (quotas) {
            if (!quotas.containsKey(provider)) {
                throw new ResourceNotFoundException("Provider", provider);
            }
            quotas.put(provider, fresh);
        }
        structuredLogger.logProviderEvent(provider, ProviderEventType.QUOTA_RESET,
                "Quota reset for " + provider, null);
        return fresh.toBuilder().build();
    }

    public Map<String, ProviderStats> getProviderStats() {
        Map<String, ProviderStats> stats = new LinkedHashMap<>();
        synchronized (quotas) {
            quotas.forEach((provider, quota) -> stats.put(provider, ProviderStats.from(quota)));
        }
        return stats;
    }

    public Optional<ProviderQuota> getQuota(String provider) {
        synchronized (quotas) {
            return Optional.ofNullable(quotas.get(provider)).map(q -> q.toBuilder().build());
        }
    }

    /**
     * Requests charged to every provider since the last reset.
     */
    public long totalRequests() {
        synchronized (quotas) {
            return quotas.values().stream().mapToLong(ProviderQuota::getRequests).sum();
        }
    }

    private ProviderQuota quotaFor(String provider) {
        synchronized (quotas) {
            return quotas.computeIfAbsent(provider, p -> ProviderQuota.fresh(p, clock.instant()));
        }
    }

    /**
     * Raised when every provider of a chain was skipped or failed.
     */
    public static class ProviderExhaustionException extends RuntimeException {
        private final List<String> providers;

        public ProviderExhaustionException(List<String> providers) {
            super(EXHAUSTED_MESSAGE);
            this.providers = providers;
        }

        public List<String> getProviders() {
            return providers;
        }
    }
}
