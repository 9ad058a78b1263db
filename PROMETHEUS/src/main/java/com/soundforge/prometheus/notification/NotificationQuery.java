package com.soundforge.prometheus.notification;

import com.soundforge.prometheus.domain.model.NotificationSeverity;
import lombok.Builder;
import lombok.Value;

/**
 * Filter for {@link NotificationHub#getNotifications(NotificationQuery)}.
 * Every field is optional.
 */
@Value
@Builder
public class NotificationQuery {

    public static final NotificationQuery ALL = NotificationQuery.builder().build();

    /** Minimum severity; {@code warning} also returns {@code critical} entries */
    NotificationSeverity severity;

    boolean unreadOnly;

    Integer limit;
}
