package com.github.deemusic.service;

import com.github.deemusic.model.DownloadStatus;
import com.github.deemusic.model.QueueItem;
import com.github.deemusic.store.QueueStore;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Conditional writes followed by a notification of the stored snapshot.
 */
@Component
@RequiredArgsConstructor
public class QueueItemWriter {

    private final QueueStore queueStore;
    private final NotificationBridge notificationBridge;

    /**
     * Store a worker's copy while the row is still {@code expected}, then publish it. The row must
     * be the one the worker claimed, not a later item queued under the same id.
     *
     * @throws ItemAbandonedException if the row is gone, replaced or has another status
     */
    QueueItem save(@NonNull QueueItem working, @NonNull DownloadStatus expected) {
        QueueItem stored = queueStore.updateIf(working.getId(), expected, working.getCreatedAt(),
                row -> copyMutable(working, row))
                .orElseThrow(() -> new ItemAbandonedException(working.getId()));
        working.setUpdatedAt(stored.getUpdatedAt());
        notificationBridge.publish(stored);
        return stored;
    }

    public Optional<QueueItem> transition(@NonNull String id, @NonNull DownloadStatus expected,
                                          @NonNull Consumer<QueueItem> change) {
        Optional<QueueItem> stored = queueStore.updateIf(id, expected, change);
        stored.ifPresent(notificationBridge::publish);
        return stored;
    }

    private static void copyMutable(QueueItem from, QueueItem to) {
        to.setTitle(from.getTitle());
        to.setArtist(from.getArtist());
        to.setAlbum(from.getAlbum());
        to.setStatus(from.getStatus());
        to.setProgress(from.getProgress());
        to.setOutputPath(from.getOutputPath());
        to.setDownloadUrl(from.getDownloadUrl());
        to.setErrorMessage(from.getErrorMessage());
        to.setRetryCount(from.getRetryCount());
        to.setTotalTracks(from.getTotalTracks());
        to.setCompletedTracks(from.getCompletedTracks());
        to.setQuality(from.getQuality());
        to.setCompletedAt(from.getCompletedAt());
        to.setAvailableAt(from.getAvailableAt());
    }
}
