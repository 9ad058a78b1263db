package com.soundforge.prometheus.health;

import com.soundforge.prometheus.config.PrometheusProperties;
import com.soundforge.prometheus.domain.model.ProviderHealth;
import com.soundforge.prometheus.notification.NotificationHub;
import com.soundforge.prometheus.pipeline.MetricsStreamPublisher;
import com.soundforge.prometheus.provider.ProviderHealthRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Health indicator for PROMETHEUS service.
 * <p>
 * Reports on:
 * <ul>
 *     <li>AI provider availability</li>
 *     <li>Metrics stream state</li>
 *     <li>Unread notifications</li>
 * </ul>
 * The service is down only when no AI provider is active.
 */
@Slf4j
@Component
public class PrometheusHealthIndicator implements ReactiveHealthIndicator {

    private final ProviderHealthRegistry providerHealthRegistry;
    private final MetricsStreamPublisher streamPublisher;
    private final NotificationHub notificationHub;
    private final PrometheusProperties properties;

    public PrometheusHealthIndicator(ProviderHealthRegistry providerHealthRegistry,
                                     MetricsStreamPublisher streamPublisher,
                                     NotificationHub notificationHub,
                                     PrometheusProperties properties) {
        this.providerHealthRegistry = providerHealthRegistry;
        this.streamPublisher = streamPublisher;
        this.notificationHub = notificationHub;
        this.properties = properties;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth);
    }

    private Health checkHealth() {
        Map<String, Object> details = new HashMap<>();

        List<ProviderHealth> providers = providerHealthRegistry.getProvidersHealth();
        long activeProviders = providers.stream()
                .filter(p -> p.getStatus() == ProviderHealth.Status.ACTIVE)
                .count();
        providers.forEach(p -> details.put("providers." + p.getName(), p.getStatus().getLabel()));
        details.put("activeProviders", activeProviders);

        details.put("metricsStream.running", streamPublisher.isRunning());
        details.put("metricsStream.interval", properties.getStream().getInterval().toString());
        details.put("activeConnections", streamPublisher.getActiveConnections());
        details.put("unreadNotifications", notificationHub.getUnreadCount());

        if (activeProviders == 0) {
            log.warn("Health check: no active AI provider");
            return Health.down()
                    .withDetail("error", "No active AI provider")
                    .withDetails(details)
                    .build();
        }
        return Health.up().withDetails(details).build();
    }
}
