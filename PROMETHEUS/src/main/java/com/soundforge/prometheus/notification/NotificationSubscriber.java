package com.soundforge.prometheus.notification;

import com.soundforge.prometheus.domain.model.Notification;

/**
 * Live receiver of published notifications. Invoked synchronously on the publishing thread.
 */
@FunctionalInterface
public interface NotificationSubscriber {

    void onNotification(Notification notification);
}
