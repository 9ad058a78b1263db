package com.soundforge.prometheus.automation;

import com.soundforge.prometheus.config.PrometheusProperties;
import com.soundforge.prometheus.domain.ResourceNotFoundException;
import com.soundforge.prometheus.domain.model.AutomationResponse;
import com.soundforge.prometheus.domain.model.AutomationRule;
import com.soundforge.prometheus.domain.model.MetricPoint;
import com.soundforge.prometheus.domain.model.ResponseStatus;
import com.soundforge.prometheus.notification.NotificationHub;
import com.soundforge.prometheus.observability.PrometheusMetrics;
import com.soundforge.prometheus.observability.PrometheusStructuredLogger;
import com.soundforge.prometheus.observability.PrometheusStructuredLogger.AutomationEventType;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rule-driven automated remediation.
 * <p>
 * Each incoming metric point is matched against the enabled rules in registration
 * order. Responses of the matched rules run one after another through the
 * {@link ResponseAction}; every outcome is counted on the response and announced
 * through the {@link NotificationHub}. Execution failures never reach the caller.
 */
@Slf4j
@Service
public class AutomationEngine {

    private final PrometheusProperties.Automation config;
    private final Clock clock;
    private final ResponseAction responseAction;
    private final NotificationHub notificationHub;
    private final PrometheusMetrics metrics;
    private final PrometheusStructuredLogger structuredLogger;

    private final Map<String, AutomationResponse> responses = new LinkedHashMap<>();
    private final Map<String, AutomationRule> rules = new LinkedHashMap<>();

    public AutomationEngine(PrometheusProperties properties,
                            Clock clock,
                            ResponseAction responseAction,
                            NotificationHub notificationHub,
                            PrometheusMetrics metrics,
                            PrometheusStructuredLogger structuredLogger) {
        this.config = properties.getAutomation();
        this.clock = clock;
        this.responseAction = responseAction;
        this.notificationHub = notificationHub;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        initializeDefaults();
    }

    private void initializeDefaults() {
        synchronized (responses) {
            responses.clear();
            putResponse("auto-scale", "High CPU Usage", "Scale up system resources");
            putResponse("fallback-provider", "Provider Failure", "Switch to fallback provider");
            putResponse("quota-reset", "Quota Exceeded", "Reset provider quota");
        }

        synchronized (rules) {
            rules.clear();
            putRule(AutomationRule.builder()
                    .id("high-cpu")
                    .name("High CPU Usage Detection")
                    .condition("CPU Usage > " + format(config.getCpuThreshold()) + "% for 5 minutes")
                    .action("Trigger auto-scale response")
                    .responseId("auto-scale")
                    .predicate(m -> exceeds(m.getCpu(), config.getCpuThreshold()))
                    .build());
            putRule(AutomationRule.builder()
                    .id("error-spike")
                    .name("Error Rate Spike")
                    .condition("Error rate > " + format(config.getErrorRateThreshold() * 100) + "% in last minute")
                    .action("Switch to fallback provider")
                    .responseId("fallback-provider")
                    .predicate(m -> exceeds(m.getErrorRate(), config.getErrorRateThreshold()))
                    .build());
            putRule(AutomationRule.builder()
                    .id("quota-limit")
                    .name("Quota Limit Approaching")
                    .condition("Provider quota usage > " + format(config.getQuotaUsageThreshold()) + "%")
                    .action("Trigger quota reset")
                    .responseId("quota-reset")
                    .predicate(m -> exceeds(m.getQuotaUsage(), config.getQuotaUsageThreshold()))
                    .build());
        }
    }

    // ========== Evaluation ==========

    /**
     * Match the enabled rules against a metric point and run the matched responses sequentially.
     *
     * @return ids of the rules that matched, in registration order
     */
    public Mono<List<String>> evaluateMetrics(MetricPoint point) {
        return Mono.fromSupplier(() -> matchRules(point))
                .flatMap(triggered -> Flux.fromIterable(triggered)
                        .concatMap(ruleId -> executeResponse(responseIdFor(ruleId), point))
                        .then(Mono.just(triggered)));
    }

    private List<String> matchRules(MetricPoint point) {
        List<AutomationRule> candidates;
        synchronized (rules) {
            candidates = new ArrayList<>(rules.values());
        }

        List<String> triggered = new ArrayList<>();
        for (AutomationRule rule : candidates) {
            if (!rule.isEnabled()) {
                continue;
            }
            try {
                if (evaluateRule(rule, point)) {
                    triggered.add(rule.getId());
                }
            } catch (RuleEvaluationException e) {
                metrics.recordRuleEvaluationError();
                structuredLogger.logAutomationEvent(rule.getId(), AutomationEventType.RULE_FAILED,
                        "Error evaluating rule", Map.of("error", String.valueOf(e.getCause())));
            }
        }
        return triggered;
    }

    private boolean evaluateRule(AutomationRule rule, MetricPoint point) {
        if (rule.getPredicate() == null) {
            return false;
        }
        try {
            return rule.getPredicate().matches(point);
        } catch (RuntimeException e) {
            throw new RuleEvaluationException(rule.getId(), e);
        }
    }

    private String responseIdFor(String ruleId) {
        synchronized (rules) {
            AutomationRule rule = rules.get(ruleId);
            return rule != null && rule.getResponseId() != null ? rule.getResponseId() : ruleId;
        }
    }

    /**
     * Run one response.
     *
     * @return {@code true} on success; {@code false} when the response is unknown,
     *         inactive or its action failed
     */
    public Mono<Boolean> executeResponse(String responseId, MetricPoint point) {
        return Mono.defer(() -> {
            AutomationResponse response;
            synchronized (responses) {
                AutomationResponse stored = responses.get(responseId);
                response = stored != null ? stored.toBuilder().build() : null;
            }

            if (response == null || !response.isActive()) {
                structuredLogger.logAutomationEvent(responseId, AutomationEventType.RESPONSE_SKIPPED,
                        "Response skipped", Map.of("reason", response == null ? "unknown" : "inactive"));
                return Mono.just(false);
            }

            Timer.Sample sample = metrics.startResponseTimer();
            return Mono.defer(() -> responseAction.perform(response, point))
                    .then(Mono.fromCallable(() -> handleSuccess(response, sample)))
                    .onErrorResume(error -> Mono.fromCallable(() -> handleFailure(response, sample,
                            new ResponseExecutionException(responseId, error))));
        });
    }

    private boolean handleSuccess(AutomationResponse response, Timer.Sample sample) {
        synchronized (responses) {
            AutomationResponse stored = responses.get(response.getId());
            if (stored != null) {
                stored.recordSuccess(clock.instant());
            }
        }
        metrics.recordResponseSucceeded(sample);
        structuredLogger.logAutomationEvent(response.getId(), AutomationEventType.RESPONSE_SUCCEEDED,
                "Successfully executed response", Map.of("action", response.getAction()));

        notificationHub.notifyAutomatedResponse(NotificationHub.ResponseOutcome.builder()
                .responseId(response.getId())
                .trigger(response.getTrigger())
                .action(response.getAction())
                .success(true)
                .build());
        return true;
    }

    private boolean handleFailure(AutomationResponse response, Timer.Sample sample,
                                  ResponseExecutionException error) {
        synchronized (responses) {
            AutomationResponse stored = responses.get(response.getId());
            if (stored != null) {
                stored.recordFailure();
            }
        }
        metrics.recordResponseFailed(sample);
        log.error("Failed to execute response {}: {}", response.getId(), error.getMessage(), error);
        structuredLogger.logAutomationEvent(response.getId(), AutomationEventType.RESPONSE_FAILED,
                "Failed to execute response", Map.of("error", String.valueOf(error.getCause().getMessage())));

        notificationHub.notifyAutomatedResponse(NotificationHub.ResponseOutcome.builder()
                .responseId(response.getId())
                .trigger(response.getTrigger())
                .action(response.getAction())
                .success(false)
                .details(error.getCause().getMessage())
                .build());
        return false;
    }

    // ========== Administration ==========

    /**
     * Merge the non-null fields of an update into a rule.
     *
     * @throws ResourceNotFoundException for an unknown rule
     */
    public AutomationRule updateRule(String ruleId, RuleUpdate update) {
        AutomationRule updated;
        synchronized (rules) {
            AutomationRule rule = rules.get(ruleId);
            if (rule == null) {
                throw new ResourceNotFoundException("Rule", ruleId);
            }
            if (update.getName() != null) {
                rule.setName(update.getName());
            }
            if (update.getCondition() != null) {
                rule.setCondition(update.getCondition());
            }
            if (update.getAction() != null) {
                rule.setAction(update.getAction());
            }
            if (update.getResponseId() != null) {
                rule.setResponseId(update.getResponseId());
            }
            if (update.getEnabled() != null) {
                rule.setEnabled(update.getEnabled());
            }
            updated = rule.toBuilder().build();
        }

        structuredLogger.logAutomationEvent(ruleId, AutomationEventType.RULE_UPDATED,
                "Updated rule", Map.of("enabled", updated.isEnabled()));
        return updated;
    }

    /**
     * Add a rule, or replace the rule with the same id. New rules are evaluated last.
     */
    public AutomationRule registerRule(AutomationRule rule) {
        synchronized (rules) {
            putRule(rule.toBuilder().build());
        }
        log.info("Registered rule {} -> response {}", rule.getId(), rule.getResponseId());
        return rule.toBuilder().build();
    }

    /**
     * Flip a response between active and inactive.
     *
     * @throws ResourceNotFoundException for an unknown response
     */
    public AutomationResponse toggleResponse(String responseId) {
        AutomationResponse toggled;
        synchronized (responses) {
            AutomationResponse response = responses.get(responseId);
            if (response == null) {
                throw new ResourceNotFoundException("Response", responseId);
            }
            response.setStatus(response.getStatus().toggled());
            toggled = response.toBuilder().build();
        }

        structuredLogger.logAutomationEvent(responseId, AutomationEventType.RESPONSE_TOGGLED,
                "Toggled response", Map.of("status", toggled.getStatus().getLabel()));
        return toggled;
    }

    public List<AutomationRule> getRules() {
        synchronized (rules) {
            return rules.values().stream().map(r -> r.toBuilder().build()).toList();
        }
    }

    public List<AutomationResponse> getResponses() {
        synchronized (responses) {
            return responses.values().stream().map(r -> r.toBuilder().build()).toList();
        }
    }

    /**
     * Restore the seeded rules and responses with zeroed counters.
     */
    public void reset() {
        initializeDefaults();
        log.info("Automation state reset");
    }

    // ========== Private Methods ==========

    private void putResponse(String id, String trigger, String action) {
        responses.put(id, AutomationResponse.builder()
                .id(id)
                .trigger(trigger)
                .action(action)
                .status(ResponseStatus.ACTIVE)
                .build());
    }

    private void putRule(AutomationRule rule) {
        rules.put(rule.getId(), rule);
    }

    private static boolean exceeds(Double value, double threshold) {
        return value != null && value > threshold;
    }

    private static String format(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }

    // ========== Exceptions ==========

    public static class RuleEvaluationException extends RuntimeException {
        public RuleEvaluationException(String ruleId, Throwable cause) {
            super("Rule " + ruleId + " could not be evaluated", cause);
        }
    }

    public static class ResponseExecutionException extends RuntimeException {
        public ResponseExecutionException(String responseId, Throwable cause) {
            super("Response " + responseId + " failed", cause);
        }
    }
}
