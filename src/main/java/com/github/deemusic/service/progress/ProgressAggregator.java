package com.github.deemusic.service.progress;

import com.github.deemusic.model.ChildTrack;
import com.github.deemusic.model.DownloadStatus;
import com.github.deemusic.model.QueueItem;
import com.github.deemusic.store.QueueStore;
import com.github.deemusic.util.ProgressCalculator;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rolls child outcomes up into a composite item's {@code completedTracks} and {@code progress}.
 *
 * <p>{@code completedTracks} is always recounted from the child rows in the store, so recording
 * the same child success twice cannot count it twice. Methods mutate the working copy passed
 * in; persisting it is left to the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProgressAggregator {

    public enum CompositeOutcome {
        COMPLETE,
        PARTIAL,
        ALL_FAILED
    }

    private final QueueStore queueStore;

    /**
     * Leaf progress from a byte count. Never moves backwards within a run.
     */
    public void applyTransfer(@NonNull QueueItem item, long downloadedBytes, long totalBytes) {
        int percent = ProgressCalculator.transferPercent(downloadedBytes, totalBytes);
        item.setProgress(Math.max(item.getProgress(), percent));
    }

    /**
     * Fix the number of children once they are resolved and recompute from what is already done.
     */
    public void applyTotal(@NonNull QueueItem parent, int totalTracks) {
        parent.setTotalTracks(Math.max(0, totalTracks));
        recount(parent);
    }

    /**
     * @return true if the child had not been counted before
     */
    public boolean recordChildSuccess(@NonNull QueueItem parent, @NonNull ChildTrack child) {
        boolean first = queueStore.recordChildSuccess(parent.getId(), parent.getCreatedAt(), child);
        if (!first) {
            log.debug("Child {} of {} already counted", child.getTrackId(), parent.getId());
        }
        recount(parent);
        return first;
    }

    public void recordChildFailure(@NonNull QueueItem parent, @NonNull ChildTrack child) {
        queueStore.recordChildFailure(parent.getId(), parent.getCreatedAt(), child);
    }

    public Set<String> completedChildIds(@NonNull QueueItem parent) {
        return queueStore.getCompletedChildIds(parent.getId());
    }

    public List<ChildTrack> completedChildren(@NonNull QueueItem parent) {
        return queueStore.getChildTracks(parent.getId()).stream()
                .filter(child -> child.getStatus() == DownloadStatus.COMPLETED)
                .collect(Collectors.toList());
    }

    /**
     * Final status of a composite whose children have all been attempted.
     */
    public CompositeOutcome outcome(@NonNull QueueItem parent) {
        if (parent.getTotalTracks() > 0 && parent.getCompletedTracks() == 0) {
            return CompositeOutcome.ALL_FAILED;
        }
        if (parent.getCompletedTracks() < parent.getTotalTracks()) {
            return CompositeOutcome.PARTIAL;
        }
        return CompositeOutcome.COMPLETE;
    }

    private void recount(QueueItem parent) {
        int completed = Math.min(queueStore.countCompletedChildren(parent.getId()), parent.getTotalTracks());
        parent.setCompletedTracks(completed);
        parent.setProgress(ProgressCalculator.compositePercent(completed, parent.getTotalTracks()));
    }
}
