package com.github.deemusic.service;

import com.github.deemusic.model.QueueItem;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Forwards item snapshots from worker threads to registered listeners.
 *
 * <p>Events are handed to a single dispatcher thread through an unbounded FIFO, so publishing
 * never blocks a worker and every listener sees one item's events in publish order. A listener
 * that throws is logged and stays subscribed.
 */
@Slf4j
@Service
public class NotificationBridge {

    private final CopyOnWriteArrayList<QueueItemListener> listeners = new CopyOnWriteArrayList<>();
    private final Executor dispatcher;

    public NotificationBridge(@Qualifier("notificationExecutor") Executor dispatcher) {
        this.dispatcher = dispatcher;
    }

    public Subscription subscribe(@NonNull QueueItemListener listener) {
        listeners.add(listener);
        log.info("Queue listener registered. Total: {}", listeners.size());
        return () -> unsubscribe(listener);
    }

    public void unsubscribe(@NonNull QueueItemListener listener) {
        if (listeners.remove(listener)) {
            log.info("Queue listener unregistered. Remaining: {}", listeners.size());
        }
    }

    /**
     * Queue a copy of {@code item} for delivery to every listener.
     */
    public void publish(@NonNull QueueItem item) {
        QueueItem snapshot = item.copy();
        try {
            dispatcher.execute(() -> deliver(snapshot));
        } catch (RejectedExecutionException e) {
            // dispatcher is shutting down; deliver inline rather than lose the event
            log.debug("Notification dispatcher rejected event for {}, delivering inline", snapshot.getId());
            deliver(snapshot);
        }
    }

    void deliver(QueueItem snapshot) {
        log.debug("Delivering {} [{} {}%]", snapshot.getId(), snapshot.getStatus(), snapshot.getProgress());
        for (QueueItemListener listener : listeners) {
            try {
                listener.onItemChanged(snapshot);
            } catch (RuntimeException e) {
                log.error("Error in queue listener for item {}: {}", snapshot.getId(), e.getMessage(), e);
            }
        }
    }

    public int getListenerCount() {
        return listeners.size();
    }
}
