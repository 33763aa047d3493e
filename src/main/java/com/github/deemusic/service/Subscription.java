package com.github.deemusic.service;

/**
 * Handle returned by {@link NotificationBridge#subscribe}.
 */
public interface Subscription extends AutoCloseable {

    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}
