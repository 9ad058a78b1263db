package com.soundforge.prometheus.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Entry of the operator notification log.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Notification {

    private String id;

    private Instant timestamp;

    private NotificationSeverity severity;

    /** Event family, e.g. {@code system}, {@code performance}, {@code ai-provider} */
    private String category;

    private String title;

    private String message;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    private boolean read;

    private Instant readAt;

    public void markRead(Instant at) {
        if (!read) {
            read = true;
            readAt = at;
        }
    }
}
