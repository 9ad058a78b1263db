package com.soundforge.prometheus.api.v1;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Map;

/**
 * Integration tests for the PROMETHEUS REST API.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class PrometheusControllerIntegrationTest {

    private static final String BASE = "/api/v1/prometheus";

    @Autowired
    private WebTestClient webTestClient;

    @BeforeEach
    void resetSystem() {
        webTestClient.post()
                .uri(BASE + "/system/reset")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.message").isEqualTo("System reset successful");
    }

    @Nested
    @DisplayName("Metrics")
    class MetricsTests {

        @Test
        @DisplayName("should ingest a point and report anomalies and triggered rules")
        void ingestMetric() {
            webTestClient.post()
                    .uri(BASE + "/metrics")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("latency", 450.0, "cpu", 95.0))
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.point.timestamp").exists()
                    .jsonPath("$.thresholdAnomalies[0].type").isEqualTo("latency")
                    .jsonPath("$.thresholdAnomalies[0].severity").isEqualTo("high")
                    .jsonPath("$.triggeredRules[0]").isEqualTo("high-cpu");

            webTestClient.get()
                    .uri(BASE + "/automation/responses")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$[0].id").isEqualTo("auto-scale")
                    .jsonPath("$[0].successCount").isEqualTo(1)
                    .jsonPath("$[0].status").isEqualTo("active");
        }

        @Test
        @DisplayName("should serve current metrics and statistics")
        void readViews() {
            webTestClient.get()
                    .uri(BASE + "/metrics")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.successRate").isEqualTo(100.0)
                    .jsonPath("$.trends.latency").isEqualTo("stable");

            webTestClient.get()
                    .uri(BASE + "/stats")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.current.dailyUsage").isEqualTo(0)
                    .jsonPath("$.anomalies").isEmpty();
        }

        @Test
        @DisplayName("should merge threshold updates")
        void updateThresholds() {
            webTestClient.put()
                    .uri(BASE + "/thresholds")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("latency", 500.0))
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.latency").isEqualTo(500.0)
                    .jsonPath("$.errorRate").isEqualTo(0.1);
        }

        @Test
        @DisplayName("should list prediction models")
        void predictions() {
            webTestClient.get()
                    .uri(BASE + "/predictions")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.models.length()").isEqualTo(3)
                    .jsonPath("$.predictions").isEmpty();
        }
    }

    @Nested
    @DisplayName("Providers")
    class ProviderTests {

        @Test
        @DisplayName("should toggle a provider")
        void toggleProvider() {
            webTestClient.post()
                    .uri(BASE + "/providers/OpenAI/toggle")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.name").isEqualTo("OpenAI")
                    .jsonPath("$.status").isEqualTo("down");
        }

        @Test
        @DisplayName("should return 404 for an unknown provider")
        void unknownProvider() {
            webTestClient.post()
                    .uri(BASE + "/providers/Nowhere/toggle")
                    .exchange()
                    .expectStatus().isNotFound()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("Provider Nowhere not found");
        }

        @Test
        @DisplayName("should reset a provider quota")
        void resetQuota() {
            webTestClient.post()
                    .uri(BASE + "/providers/Replicate/reset-quota")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.limits.remaining").isEqualTo(1000);
        }

        @Test
        @DisplayName("should complete the optimization pass")
        void optimize() {
            webTestClient.post()
                    .uri(BASE + "/system/optimize")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.message").isEqualTo("System optimization completed");
        }
    }

    @Nested
    @DisplayName("Automation")
    class AutomationTests {

        @Test
        @DisplayName("should patch a rule")
        void patchRule() {
            webTestClient.patch()
                    .uri(BASE + "/automation/rules/high-cpu")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("enabled", false))
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.id").isEqualTo("high-cpu")
                    .jsonPath("$.enabled").isEqualTo(false)
                    .jsonPath("$.predicate").doesNotExist();
        }

        @Test
        @DisplayName("should return 404 for unknown rules and responses")
        void unknownIds() {
            webTestClient.patch()
                    .uri(BASE + "/automation/rules/nope")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("name", "x"))
                    .exchange()
                    .expectStatus().isNotFound()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("Rule nope not found");

            webTestClient.post()
                    .uri(BASE + "/automation/responses/nope/toggle")
                    .exchange()
                    .expectStatus().isNotFound();
        }
    }

    @Nested
    @DisplayName("Notifications")
    class NotificationTests {

        @Test
        @DisplayName("should list notifications raised by ingestion")
        void listAfterAnomaly() {
            webTestClient.post()
                    .uri(BASE + "/metrics")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("latency", 450.0))
                    .exchange()
                    .expectStatus().isOk();

            webTestClient.get()
                    .uri(uri -> uri.path(BASE + "/notifications").queryParam("severity", "warning").build())
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.total").isEqualTo(1)
                    .jsonPath("$.unreadCount").isEqualTo(1)
                    .jsonPath("$.notifications[0].category").isEqualTo("performance");
        }

        @Test
        @DisplayName("should reject an unknown severity")
        void invalidSeverity() {
            webTestClient.get()
                    .uri(uri -> uri.path(BASE + "/notifications").queryParam("severity", "loud").build())
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("Unknown notification severity: loud");
        }

        @Test
        @DisplayName("should return 404 when marking an unknown notification")
        void unknownNotification() {
            webTestClient.post()
                    .uri(BASE + "/notifications/notification-0-missing/read")
                    .exchange()
                    .expectStatus().isNotFound()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("Notification notification-0-missing not found");
        }
    }

    @Test
    @DisplayName("should report service health through the actuator")
    void actuatorHealth() {
        webTestClient.get()
                .uri("/actuator/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("UP")
                .jsonPath("$.components.prometheus.details.activeProviders").isEqualTo(3);
    }
}
