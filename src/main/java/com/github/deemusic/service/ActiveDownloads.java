package com.github.deemusic.service;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stop requests for items that are being worked on.
 *
 * <p>Workers poll their {@link Control} at child boundaries and between transfer blocks; nothing
 * here interrupts a thread. Every claim registers a fresh control. A request that arrives between
 * the claim and the registration is held and handed to that registration; queueing the item
 * again drops it.
 */
@Slf4j
@Component
public class ActiveDownloads {

    public enum StopRequest {
        NONE,
        /** return the item to pending, used on shutdown */
        REQUEUE,
        PAUSE,
        CANCEL
    }

    public static final class Control {

        private final String itemId;
        private volatile StopRequest request = StopRequest.NONE;

        Control(String itemId) {
            this.itemId = itemId;
        }

        public String getItemId() {
            return itemId;
        }

        public StopRequest getRequest() {
            return request;
        }

        public boolean isStopRequested() {
            return request != StopRequest.NONE;
        }

        /**
         * A stronger request replaces a weaker one, never the other way round.
         */
        synchronized void request(StopRequest next) {
            if (next.ordinal() > request.ordinal()) {
                request = next;
            }
        }
    }

    private final ConcurrentHashMap<String, Control> controls = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, StopRequest> unclaimed = new ConcurrentHashMap<>();

    /**
     * Start tracking a claim. A control left by an earlier claim of the same id is replaced;
     * its worker keeps the reference it already holds.
     */
    public Control register(@NonNull String itemId) {
        Control control = new Control(itemId);
        StopRequest early = unclaimed.remove(itemId);
        if (early != null) {
            control.request(early);
        }
        controls.put(itemId, control);
        return control;
    }

    public void unregister(@NonNull String itemId, @NonNull Control control) {
        controls.remove(itemId, control);
    }

    public void requestStop(@NonNull String itemId, @NonNull StopRequest request) {
        Control live = controls.get(itemId);
        if (live != null) {
            live.request(request);
        } else {
            unclaimed.merge(itemId, request, (held, next) -> next.ordinal() > held.ordinal() ? next : held);
        }
        log.debug("Stop requested for {}: {}", itemId, request);
    }

    public void requestStopAll(@NonNull StopRequest request) {
        controls.values().forEach(control -> control.request(request));
    }

    /**
     * Forget a request held for an item that is about to be queued again. Running workers keep
     * their controls.
     */
    public void discard(@NonNull String itemId) {
        unclaimed.remove(itemId);
    }

    /**
     * @return the request seen by the current worker of {@code itemId}, or {@code NONE}
     */
    public StopRequest requestFor(@NonNull String itemId) {
        Control live = controls.get(itemId);
        return live != null ? live.getRequest() : StopRequest.NONE;
    }

    public boolean isActive(@NonNull String itemId) {
        return controls.containsKey(itemId);
    }

    public Set<String> activeIds() {
        return new HashSet<>(controls.keySet());
    }
}
