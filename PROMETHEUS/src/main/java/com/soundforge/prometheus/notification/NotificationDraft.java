package com.soundforge.prometheus.notification;

import com.soundforge.prometheus.domain.model.NotificationSeverity;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Caller-supplied part of a notification; id, timestamp and read state are
 * assigned by {@link NotificationHub}.
 */
@Value
@Builder
public class NotificationDraft {

    /** Defaults to {@code info} */
    NotificationSeverity severity;

    String category;

    String title;

    String message;

    @Singular("metadataEntry")
    Map<String, Object> metadata;
}
