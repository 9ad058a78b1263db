package com.soundforge.prometheus.notification;

/**
 * Unsubscribe token returned by {@link NotificationHub#subscribe(NotificationSubscriber)}.
 */
public interface NotificationSubscription extends AutoCloseable {

    void unsubscribe();

    boolean isActive();

    @Override
    default void close() {
        unsubscribe();
    }
}
