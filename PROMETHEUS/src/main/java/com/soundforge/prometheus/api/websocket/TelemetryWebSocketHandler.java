package com.soundforge.prometheus.api.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.soundforge.prometheus.notification.NotificationHub;
import com.soundforge.prometheus.notification.NotificationSubscription;
import com.soundforge.prometheus.pipeline.MetricsStreamPublisher;
import jakarta.annotation.PreDestroy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket handler for live telemetry.
 * <p>
 * Every session gets a {@code system_state} frame on connect and then {@code {topic, data}}
 * frames for the {@value #TOPIC_METRICS} and {@value #TOPIC_NOTIFICATIONS} topics.
 * A session that never subscribed receives every topic.
 */
@Component
@Slf4j
public class TelemetryWebSocketHandler implements WebSocketHandler {

    public static final String PATH = "/ws/prometheus";
    public static final String TOPIC_METRICS = "metrics";
    public static final String TOPIC_NOTIFICATIONS = "notifications";

    private final MetricsStreamPublisher streamPublisher;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, SessionState> sessions = new ConcurrentHashMap<>();
    private final Disposable metricsSubscription;
    private final NotificationSubscription notificationSubscription;

    public TelemetryWebSocketHandler(MetricsStreamPublisher streamPublisher,
                                     NotificationHub notificationHub,
                                     ObjectMapper objectMapper,
                                     Clock clock) {
        this.streamPublisher = streamPublisher;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.metricsSubscription = streamPublisher.updates()
                .subscribe(snapshot -> broadcast(TOPIC_METRICS, snapshot));
        this.notificationSubscription = notificationHub.subscribe(
                notification -> broadcast(TOPIC_NOTIFICATIONS, notification));
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String sessionId = session.getId();
        SessionState state = new SessionState(sessionId);
        sessions.put(sessionId, state);
        streamPublisher.connectionOpened();

        log.info("WebSocket session opened: {}", sessionId);
        sendSystemState(state);

        Mono<Void> input = session.receive()
                .doOnNext(msg -> handleMessage(state, msg.getPayloadAsText()))
                .then();

        Flux<WebSocketMessage> output = state.getOutboundSink().asFlux()
                .map(session::textMessage);

        return session.send(output)
                .and(input)
                .doFinally(signalType -> {
                    sessions.remove(sessionId);
                    streamPublisher.connectionClosed();
                    log.info("WebSocket session closed: {} - {}", sessionId, signalType);
                });
    }

    void handleMessage(SessionState state, String payload) {
        ClientMessage message;
        try {
            message = objectMapper.readValue(payload, ClientMessage.class);
        } catch (JsonProcessingException e) {
            log.error("Error handling WebSocket message: {}", e.getMessage());
            return;
        }

        List<String> topics = message.getTopics() != null ? message.getTopics() : List.of();
        switch (String.valueOf(message.getType())) {
            case "subscribe" -> {
                state.subscribe(topics);
                log.info("Client {} subscribed to topics: {}", state.getSessionId(), String.join(", ", topics));
            }
            case "unsubscribe" -> {
                state.unsubscribe(topics);
                log.info("Client {} unsubscribed from topics: {}", state.getSessionId(), String.join(", ", topics));
            }
            default -> log.warn("Unknown message type: {}", message.getType());
        }
    }

    /**
     * Send a frame to every session that receives the topic.
     */
    public void broadcast(String topic, Object data) {
        if (sessions.isEmpty()) {
            return;
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(TopicFrame.builder().topic(topic).data(data).build());
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize {} frame: {}", topic, e.getMessage());
            return;
        }
        sessions.values().stream()
                .filter(state -> state.receives(topic))
                .forEach(state -> state.emit(json));
    }

    public int getSessionCount() {
        return sessions.size();
    }

    @PreDestroy
    public void shutdown() {
        metricsSubscription.dispose();
        notificationSubscription.unsubscribe();
    }

    private void sendSystemState(SessionState state) {
        try {
            SystemStateFrame frame = SystemStateFrame.builder()
                    .type("system_state")
                    .data(Map.of(
                            "timestamp", clock.instant().toString(),
                            "status", "active",
                            "connectedClients", sessions.size()))
                    .build();
            state.emit(objectMapper.writeValueAsString(frame));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize system state: {}", e.getMessage());
        }
    }

    /**
     * Inbound client message.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class ClientMessage {
        private String type;
        private List<String> topics;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    static class TopicFrame {
        private String topic;
        private Object data;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    static class SystemStateFrame {
        private String type;
        private Map<String, Object> data;
    }

    /**
     * Session state tracking. {@code topics} stays {@code null} until the first subscribe.
     */
    static class SessionState {
        private final String sessionId;
        private final Sinks.Many<String> outboundSink = Sinks.many().multicast().onBackpressureBuffer();
        private volatile Set<String> topics;

        SessionState(String sessionId) {
            this.sessionId = sessionId;
        }

        String getSessionId() {
            return sessionId;
        }

        Sinks.Many<String> getOutboundSink() {
            return outboundSink;
        }

        /**
         * Push a frame to the session. Emits are serialized because the stream and the
         * notification hub broadcast from different threads.
         */
        synchronized boolean emit(String json) {
            Sinks.EmitResult result = outboundSink.tryEmitNext(json);
            if (result.isFailure()) {
                log.warn("Failed to emit frame to session {}: {}", sessionId, result);
                return false;
            }
            return true;
        }

        void subscribe(List<String> newTopics) {
            Set<String> replacement = ConcurrentHashMap.newKeySet();
            replacement.addAll(newTopics);
            topics = replacement;
        }

        void unsubscribe(List<String> removed) {
            Set<String> current = topics;
            if (current != null) {
                removed.forEach(current::remove);
            }
        }

        boolean receives(String topic) {
            Set<String> current = topics;
            return current == null || current.contains(topic);
        }
    }
}
