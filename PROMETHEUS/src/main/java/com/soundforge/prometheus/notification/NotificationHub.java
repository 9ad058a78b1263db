package com.soundforge.prometheus.notification;

import com.soundforge.prometheus.config.PrometheusProperties;
import com.soundforge.prometheus.domain.model.Notification;
import com.soundforge.prometheus.domain.model.NotificationSeverity;
import com.soundforge.prometheus.observability.PrometheusMetrics;
import com.soundforge.prometheus.observability.PrometheusStructuredLogger;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Stream;

/**
 * In-memory operator notification log with live broadcast.
 * <p>
 * The log holds at most {@code prometheus.notifications.capacity} entries, newest first.
 * Subscribers are called synchronously on every publish; a failing subscriber is logged
 * and never prevents delivery to the others.
 */
@Slf4j
@Service
public class NotificationHub {

    public static final String CATEGORY_SYSTEM = "system";
    public static final String CATEGORY_PERFORMANCE = "performance";
    public static final String CATEGORY_AI_PROVIDER = "ai-provider";
    public static final String CATEGORY_SECURITY = "security";
    public static final String CATEGORY_AUTOMATION = "automation";

    private final Clock clock;
    private final PrometheusMetrics metrics;
    private final PrometheusStructuredLogger logger;
    private final int capacity;

    private final Deque<Notification> notifications = new ArrayDeque<>();
    private final List<Subscription> subscribers = new CopyOnWriteArrayList<>();

    public NotificationHub(PrometheusProperties properties,
                           Clock clock,
                           PrometheusMetrics metrics,
                           PrometheusStructuredLogger logger) {
        this.clock = clock;
        this.metrics = metrics;
        this.logger = logger;
        this.capacity = properties.getNotifications().getCapacity();
    }

    /**
     * Publish a notification: assign id and timestamp, prepend it to the log,
     * trim the log to capacity and broadcast it.
     *
     * @param draft caller-supplied content
     * @return the stored notification
     */
    public Notification addNotification(NotificationDraft draft) {
        NotificationSeverity severity = draft.getSeverity() != null
                ? draft.getSeverity()
                : NotificationSeverity.INFO;

        Notification notification = Notification.builder()
                .id(generateId())
                .timestamp(clock.instant())
                .severity(severity)
                .category(draft.getCategory())
                .title(draft.getTitle())
                .message(draft.getMessage())
                .metadata(draft.getMetadata() != null ? new HashMap<>(draft.getMetadata()) : new HashMap<>())
                .read(false)
                .build();

        synchronized (notifications) {
            notifications.addFirst(notification);
            while (notifications.size() > capacity) {
                notifications.removeLast();
            }
        }

        broadcast(copyOf(notification));
        logger.logNotification(notification);
        metrics.recordNotification(severity);

        return copyOf(notification);
    }

    /**
     * Register a live subscriber.
     *
     * @return token that removes the subscriber again
     */
    public NotificationSubscription subscribe(NotificationSubscriber subscriber) {
        Subscription subscription = new Subscription(subscriber);
        subscribers.add(subscription);
        metrics.setNotificationSubscribers(subscribers.size());
        log.debug("Notification subscriber added. Total subscribers: {}", subscribers.size());
        return subscription;
    }

    /**
     * Reactive view of published notifications. Subscribing registers a subscriber,
     * cancelling removes it.
     */
    public Flux<Notification> stream() {
        return Flux.create(sink -> {
            NotificationSubscription subscription = subscribe(sink::next);
            sink.onDispose(subscription::unsubscribe);
        });
    }

    /**
     * Deliver a notification to every subscriber, isolating subscriber failures.
     */
    public void broadcast(Notification notification) {
        for (Subscription subscription : subscribers) {
            try {
                subscription.subscriber.onNotification(notification);
            } catch (Exception e) {
                log.error("Error in notification subscriber: {}", e.getMessage(), e);
            }
        }
    }

    public int getSubscriberCount() {
        return subscribers.size();
    }

    /**
     * Read the log, newest first.
     */
    public List<Notification> getNotifications(NotificationQuery query) {
        Stream<Notification> filtered;
        synchronized (notifications) {
            filtered = notifications.stream().map(this::copyOf).toList().stream();
        }

        if (query.getSeverity() != null) {
            NotificationSeverity minimum = query.getSeverity();
            filtered = filtered.filter(n -> n.getSeverity().isAtLeast(minimum));
        }
        if (query.isUnreadOnly()) {
            filtered = filtered.filter(n -> !n.isRead());
        }
        if (query.getLimit() != null && query.getLimit() > 0) {
            filtered = filtered.limit(query.getLimit());
        }
        return filtered.toList();
    }

    public List<Notification> getNotifications() {
        return getNotifications(NotificationQuery.ALL);
    }

    public long getUnreadCount() {
        synchronized (notifications) {
            return notifications.stream().filter(n -> !n.isRead()).count();
        }
    }

    /**
     * @return {@code true} if the notification exists
     */
    public boolean markAsRead(String notificationId) {
        synchronized (notifications) {
            for (Notification notification : notifications) {
                if (notification.getId().equals(notificationId)) {
                    notification.markRead(clock.instant());
                    return true;
                }
            }
        }
        return false;
    }

    public void markAllAsRead() {
        synchronized (notifications) {
            notifications.forEach(n -> n.markRead(clock.instant()));
        }
    }

    public void clearNotifications() {
        synchronized (notifications) {
            notifications.clear();
        }
        log.info("Notification log cleared");
    }

    // ========== Templates ==========

    public Notification notifySystemEvent(String message, NotificationSeverity severity,
                                          Map<String, Object> metadata) {
        return addNotification(NotificationDraft.builder()
                .title("System Event")
                .message(message)
                .severity(severity != null ? severity : NotificationSeverity.INFO)
                .category(CATEGORY_SYSTEM)
                .metadata(metadata != null ? metadata : Map.of())
                .build());
    }

    public Notification notifyPerformanceIssue(PerformanceIssue issue) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("metric", issue.getMetric());
        metadata.put("threshold", issue.getThreshold());
        metadata.put("currentValue", issue.getValue());

        return addNotification(NotificationDraft.builder()
                .title("Performance Alert")
                .message(issue.getMessage())
                .severity(issue.getSeverity() != null ? issue.getSeverity() : NotificationSeverity.WARNING)
                .category(CATEGORY_PERFORMANCE)
                .metadata(metadata)
                .build());
    }

    public Notification notifyAIProviderIssue(String provider, ProviderIssue issue) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("provider", provider);
        metadata.put("errorType", issue.getType());
        metadata.put("errorDetails", issue.getDetails());

        return addNotification(NotificationDraft.builder()
                .title("AI Provider Alert: " + provider)
                .message(issue.getMessage())
                .severity(issue.getSeverity() != null ? issue.getSeverity() : NotificationSeverity.WARNING)
                .category(CATEGORY_AI_PROVIDER)
                .metadata(metadata)
                .build());
    }

    /**
     * Security events are always critical.
     */
    public Notification notifySecurityEvent(SecurityEvent event) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("type", event.getType());
        metadata.put("source", event.getSource());
        metadata.put("details", event.getDetails());

        return addNotification(NotificationDraft.builder()
                .title("Security Alert")
                .message(event.getMessage())
                .severity(NotificationSeverity.CRITICAL)
                .category(CATEGORY_SECURITY)
                .metadata(metadata)
                .build());
    }

    public Notification notifyAutomatedResponse(ResponseOutcome outcome) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("responseId", outcome.getResponseId());
        metadata.put("trigger", outcome.getTrigger());
        metadata.put("action", outcome.getAction());
        metadata.put("success", outcome.isSuccess());
        metadata.put("details", outcome.getDetails());

        return addNotification(NotificationDraft.builder()
                .title("Automated Response Triggered")
                .message("Response \"" + outcome.getTrigger() + "\" was executed")
                .severity(outcome.isSuccess() ? NotificationSeverity.INFO : NotificationSeverity.WARNING)
                .category(CATEGORY_AUTOMATION)
                .metadata(metadata)
                .build());
    }

    // ========== Private Methods ==========

    private String generateId() {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 9);
        return "notification-" + clock.millis() + "-" + suffix;
    }

    private Notification copyOf(Notification notification) {
        return notification.toBuilder()
                .metadata(new HashMap<>(notification.getMetadata()))
                .build();
    }

    private void remove(Subscription subscription) {
        if (subscribers.remove(subscription)) {
            metrics.setNotificationSubscribers(subscribers.size());
            log.debug("Notification subscriber removed. Total subscribers: {}", subscribers.size());
        }
    }

    private final class Subscription implements NotificationSubscription {
        private final NotificationSubscriber subscriber;

        private Subscription(NotificationSubscriber subscriber) {
            this.subscriber = subscriber;
        }

        @Override
        public void unsubscribe() {
            remove(this);
        }

        @Override
        public boolean isActive() {
            return subscribers.contains(this);
        }
    }

    // ========== Data Classes ==========

    @Value
    @Builder
    public static class PerformanceIssue {
        String metric;
        double value;
        Double threshold;
        String message;
        NotificationSeverity severity;
    }

    @Value
    @Builder
    public static class ProviderIssue {
        String type;
        String message;
        String details;
        NotificationSeverity severity;
    }

    @Value
    @Builder
    public static class SecurityEvent {
        String type;
        String source;
        String message;
        String details;
    }

    @Value
    @Builder
    public static class ResponseOutcome {
        String responseId;
        String trigger;
        String action;
        boolean success;
        String details;
    }
}
