package com.github.deemusic.service;

import com.github.deemusic.model.ProgressUpdate;
import com.github.deemusic.model.QueueItem;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Pushes queue changes to SSE clients. It is one ordinary subscriber of the {@link NotificationBridge}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProgressBroadcastService implements QueueItemListener {

    private final NotificationBridge notificationBridge;

    private final CopyOnWriteArrayList<SseEmitter> emitters = new CopyOnWriteArrayList<>();

    private Subscription subscription;

    @PostConstruct
    void start() {
        subscription = notificationBridge.subscribe(this);
    }

    @PreDestroy
    void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
        }
        emitters.forEach(SseEmitter::complete);
        emitters.clear();
    }

    /**
     * Register a new SSE emitter
     */
    public SseEmitter createEmitter() {
        SseEmitter emitter = new SseEmitter(Long.MAX_VALUE);
        emitters.add(emitter);

        emitter.onCompletion(() -> removeEmitter(emitter));
        emitter.onTimeout(() -> removeEmitter(emitter));
        emitter.onError(e -> removeEmitter(emitter));

        log.info("New SSE emitter registered. Total: {}", emitters.size());
        return emitter;
    }

    @Override
    public void onItemChanged(QueueItem snapshot) {
        if (emitters.isEmpty()) {
            return;
        }

        ProgressUpdate update = ProgressUpdate.forItem(snapshot);
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event()
                        .name("progress")
                        .data(update));
            } catch (IOException | IllegalStateException e) {
                log.warn("Failed to send SSE event: {}", e.getMessage());
                removeEmitter(emitter);
            }
        }
    }

    private void removeEmitter(SseEmitter emitter) {
        if (emitters.remove(emitter)) {
            log.info("SSE emitter removed. Remaining: {}", emitters.size());
        }
    }

    public int getActiveConnections() {
        return emitters.size();
    }
}
