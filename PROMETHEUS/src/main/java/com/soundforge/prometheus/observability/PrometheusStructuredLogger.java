package com.soundforge.prometheus.observability;

import com.soundforge.prometheus.domain.model.AnomalyRecord;
import com.soundforge.prometheus.domain.model.Notification;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured logging utility for PROMETHEUS service.
 * <p>
 * Provides consistent, machine-readable log output with:
 * <ul>
 *     <li>MDC context management for correlation IDs</li>
 *     <li>Domain-specific logging methods for anomalies, automation, providers and notifications</li>
 *     <li>Log level derived from event type or notification severity</li>
 * </ul>
 */
@Slf4j
@Component
public class PrometheusStructuredLogger {

    // MDC keys
    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_RESPONSE_ID = "responseId";
    public static final String MDC_RULE_ID = "ruleId";
    public static final String MDC_PROVIDER = "provider";
    public static final String MDC_NOTIFICATION_ID = "notificationId";

    /**
     * Log a detected anomaly.
     */
    public void logAnomaly(AnomalyRecord anomaly) {
        Map<String, Object> logData = new LinkedHashMap<>();
        logData.put("event", "ANOMALY_DETECTED");
        logData.put("source", anomaly.getSource().name());
        logData.put("type", anomaly.getType());
        logData.put("value", anomaly.getValue());
        logData.put("severity", anomaly.getSeverity().getLabel());
        if (anomaly.getThreshold() != null) {
            logData.put("threshold", anomaly.getThreshold());
        }
        if (anomaly.getModel() != null) {
            logData.put("model", anomaly.getModel());
            logData.put("expected", anomaly.getExpected());
        }
        log.warn("Anomaly detected | data={}", formatLogData(logData));
    }

    /**
     * Log an automation event.
     */
    public void logAutomationEvent(String id, AutomationEventType eventType,
                                   String message, Map<String, Object> details) {
        String mdcKey = eventType == AutomationEventType.RULE_FAILED ? MDC_RULE_ID : MDC_RESPONSE_ID;
        try (var scope = withContext(Map.of(mdcKey, id))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put(mdcKey, id);
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case RESPONSE_SUCCEEDED, RULE_UPDATED, RESPONSE_TOGGLED ->
                        log.info("{} | data={}", message, formatLogData(logData));
                case RESPONSE_FAILED, RULE_FAILED ->
                        log.error("{} | data={}", message, formatLogData(logData));
                case RESPONSE_SKIPPED ->
                        log.debug("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log an AI provider event.
     */
    public void logProviderEvent(String provider, ProviderEventType eventType,
                                 String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_PROVIDER, provider))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("provider", provider);
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case QUOTA_UPDATED, QUOTA_RESET, SUCCEEDED ->
                        log.info("{} | data={}", message, formatLogData(logData));
                case QUOTA_EXCEEDED, TOGGLED ->
                        log.warn("{} | data={}", message, formatLogData(logData));
                case FAILED -> log.error("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a notification at the level of its severity.
     */
    public void logNotification(Notification notification) {
        try (var scope = withContext(Map.of(MDC_NOTIFICATION_ID, notification.getId()))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", "NOTIFICATION");
            logData.put("category", notification.getCategory());
            logData.put("title", notification.getTitle());
            logData.put("message", notification.getMessage());

            switch (notification.getSeverity()) {
                case CRITICAL -> log.error("Critical notification | data={}", formatLogData(logData));
                case WARNING -> log.warn("Warning notification | data={}", formatLogData(logData));
                default -> log.info("Info notification | data={}", formatLogData(logData));
            }
        }
    }

    /**
     * Set MDC context.
     */
    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    /**
     * Set correlation ID in MDC.
     */
    public MDCScope withCorrelationId(String correlationId) {
        MDC.put(MDC_CORRELATION_ID, correlationId);
        return new MDCScope(MDC_CORRELATION_ID);
    }

    String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    // ========== Event Type Enums ==========

    public enum AutomationEventType {
        RULE_FAILED, RULE_UPDATED, RESPONSE_SUCCEEDED, RESPONSE_FAILED,
        RESPONSE_SKIPPED, RESPONSE_TOGGLED
    }

    public enum ProviderEventType {
        SUCCEEDED, FAILED, QUOTA_EXCEEDED, QUOTA_UPDATED, QUOTA_RESET, TOGGLED
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
