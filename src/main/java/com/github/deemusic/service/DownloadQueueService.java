package com.github.deemusic.service;

import com.github.deemusic.config.DeeMusicProperties;
import com.github.deemusic.exception.InvalidTransitionException;
import com.github.deemusic.model.ChildTrack;
import com.github.deemusic.model.DownloadStatus;
import com.github.deemusic.model.HistoryRecord;
import com.github.deemusic.model.ItemHints;
import com.github.deemusic.model.ItemType;
import com.github.deemusic.model.QueueItem;
import com.github.deemusic.model.QueueStats;
import com.github.deemusic.service.ActiveDownloads.StopRequest;
import com.github.deemusic.service.state.DownloadStateMachine;
import com.github.deemusic.service.state.QueueOperation;
import com.github.deemusic.store.QueueStore;
import com.github.deemusic.util.DownloadConstants;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Entry point for callers: enqueue work, steer queued items and read the queue.
 *
 * <p>Status changes made here are conditional on the status that was checked, so an operation
 * racing with a worker either applies cleanly or fails with {@link InvalidTransitionException}.
 * Pause and cancel of a downloading item only raise a flag; the worker settles the item.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DownloadQueueService {

    private final QueueStore queueStore;
    private final QueueItemWriter itemWriter;
    private final NotificationBridge notificationBridge;
    private final DownloadStateMachine stateMachine;
    private final DownloadScheduler scheduler;
    private final ActiveDownloads activeDownloads;
    private final DeeMusicProperties properties;
    private final Clock clock;

    /**
     * Add a new item as pending.
     *
     * @throws com.github.deemusic.exception.DuplicateItemException if the id is already queued
     */
    public QueueItem enqueue(@NonNull String id, @NonNull ItemType type, ItemHints hints) {
        ItemHints known = hints != null ? hints : ItemHints.empty();

        QueueItem item = QueueItem.builder()
                .id(id)
                .type(type)
                .title(known.getTitle() != null && !known.getTitle().isBlank() ? known.getTitle() : id)
                .artist(known.getArtist())
                .album(known.getAlbum())
                .status(DownloadStatus.PENDING)
                .totalTracks(type.isComposite() && known.getTotalTracks() != null
                        ? Math.max(0, known.getTotalTracks())
                        : 0)
                .quality(known.getQuality() != null ? known.getQuality() : properties.getDownload().getQuality())
                .build();

        QueueItem stored = queueStore.add(item);
        activeDownloads.discard(id);
        notificationBridge.publish(stored);
        scheduler.signalWork();

        log.info("Queued {} {} [{}]", type.code(), stored.getDisplayName(), id);
        return stored;
    }

    /**
     * Ask the worker to stop at the next track boundary and leave the item paused.
     */
    public QueueItem pause(@NonNull String id) {
        QueueItem item = queueStore.getById(id);
        stateMachine.requireAllowed(id, item.getStatus(), QueueOperation.PAUSE);
        activeDownloads.requestStop(id, StopRequest.PAUSE);
        log.info("Pause requested for {}", item.getDisplayName());
        return item;
    }

    public QueueItem resume(@NonNull String id) {
        QueueItem item = queueStore.getById(id);
        stateMachine.requireAllowed(id, item.getStatus(), QueueOperation.RESUME);

        QueueItem stored = transition(id, item.getStatus(), QueueOperation.RESUME, row -> {
            row.setStatus(stateMachine.transition(id, row.getStatus(), DownloadStatus.PENDING));
            row.setAvailableAt(null);
        });
        activeDownloads.discard(id);
        scheduler.signalWork();

        log.info("Resumed {}", stored.getDisplayName());
        return stored;
    }

    /**
     * Queue a completed or failed item again with a fresh retry budget. Completed tracks of a
     * composite item are kept; failed ones are attempted again.
     */
    public QueueItem retry(@NonNull String id) {
        QueueItem item = queueStore.getById(id);
        stateMachine.requireAllowed(id, item.getStatus(), QueueOperation.RETRY);

        QueueItem stored = transition(id, item.getStatus(), QueueOperation.RETRY, row -> {
            row.setStatus(stateMachine.transition(id, row.getStatus(), DownloadStatus.PENDING));
            row.setRetryCount(0);
            row.setErrorMessage("");
            row.setAvailableAt(null);
            if (!row.isComposite()) {
                row.setProgress(0);
            }
        });
        if (stored.isComposite()) {
            int cleared = queueStore.clearFailedChildren(id);
            log.debug("Cleared {} failed track(s) of {}", cleared, id);
        }
        activeDownloads.discard(id);
        scheduler.signalWork();

        log.info("Retrying {}", stored.getDisplayName());
        return stored;
    }

    /**
     * Fail the item with "cancelled by user". A downloading item is flagged and settled by its
     * worker at the next track boundary.
     */
    public QueueItem cancel(@NonNull String id) {
        QueueItem item = queueStore.getById(id);
        stateMachine.requireAllowed(id, item.getStatus(), QueueOperation.CANCEL);

        if (item.getStatus() != DownloadStatus.DOWNLOADING) {
            Optional<QueueItem> cancelled = itemWriter.transition(id, item.getStatus(), row -> {
                row.setStatus(stateMachine.transition(id, row.getStatus(), DownloadStatus.FAILED));
                row.setErrorMessage(DownloadConstants.CANCELLED_MESSAGE);
                if (row.getCompletedAt() == null) {
                    row.setCompletedAt(clock.instant());
                }
            });
            if (cancelled.isPresent()) {
                log.info("Cancelled {}", item.getDisplayName());
                return cancelled.get();
            }
            item = queueStore.getById(id);
            stateMachine.requireAllowed(id, item.getStatus(), QueueOperation.CANCEL);
            if (item.getStatus() != DownloadStatus.DOWNLOADING) {
                throw new InvalidTransitionException(id, item.getStatus(), QueueOperation.CANCEL.getVerb());
            }
        }

        activeDownloads.requestStop(id, StopRequest.CANCEL);
        log.info("Cancel requested for {}", item.getDisplayName());
        return item;
    }

    /**
     * Delete the item from the queue. A downloading item is told to stop; its worker notices
     * the row is gone at its next write. The same id may be queued again straight away.
     */
    public void remove(@NonNull String id) {
        QueueItem item = queueStore.getById(id);
        stateMachine.requireAllowed(id, item.getStatus(), QueueOperation.REMOVE);

        if (item.getStatus() == DownloadStatus.DOWNLOADING) {
            activeDownloads.requestStop(id, StopRequest.CANCEL);
        } else {
            activeDownloads.discard(id);
        }
        queueStore.delete(id);
        log.info("Removed {} [{}]", item.getDisplayName(), id);
    }

    public QueueItem getItem(@NonNull String id) {
        return queueStore.getById(id);
    }

    public List<QueueItem> list(int offset, int limit, DownloadStatus status) {
        int from = Math.max(0, offset);
        int size = limit <= 0 ? DownloadConstants.DEFAULT_PAGE_SIZE : Math.min(limit, DownloadConstants.MAX_PAGE_SIZE);
        return status != null
                ? queueStore.getByStatus(status, from, size)
                : queueStore.getAll(from, size);
    }

    public QueueStats stats() {
        return queueStore.getStats();
    }

    public Subscription subscribe(@NonNull QueueItemListener listener) {
        return notificationBridge.subscribe(listener);
    }

    public List<HistoryRecord> history(int offset, int limit) {
        int size = limit <= 0 ? DownloadConstants.DEFAULT_PAGE_SIZE : Math.min(limit, DownloadConstants.MAX_PAGE_SIZE);
        return queueStore.getHistory(Math.max(0, offset), size);
    }

    public long historyCount() {
        return queueStore.countHistory();
    }

    /**
     * @throws com.github.deemusic.exception.ItemNotFoundException if the id is not queued
     */
    public List<ChildTrack> failedTracks(@NonNull String id) {
        queueStore.getById(id);
        return queueStore.getFailedChildTracks(id);
    }

    /**
     * Remove completed items. Partial successes stay so their failed tracks remain visible.
     */
    public int clearCompleted() {
        int removed = queueStore.clearCompleted();
        log.info("Cleared {} completed item(s)", removed);
        return removed;
    }

    /**
     * Cancel everything in flight and empty the queue. History is kept.
     */
    public int clearAll() {
        activeDownloads.requestStopAll(StopRequest.CANCEL);
        int removed = queueStore.clearAll();
        log.info("Cleared queue ({} item(s))", removed);
        return removed;
    }

    private QueueItem transition(String id, DownloadStatus expected, QueueOperation operation,
                                 Consumer<QueueItem> change) {
        return itemWriter.transition(id, expected, change).orElseThrow(() -> {
            DownloadStatus now = queueStore.getById(id).getStatus();
            return new InvalidTransitionException(id, now, operation.getVerb());
        });
    }
}
