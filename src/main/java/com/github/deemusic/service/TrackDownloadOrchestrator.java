package com.github.deemusic.service;

import com.github.deemusic.config.DeeMusicProperties;
import com.github.deemusic.exception.FailureKind;
import com.github.deemusic.exception.TransientDownloadException;
import com.github.deemusic.model.CatalogEntry;
import com.github.deemusic.model.ChildTrack;
import com.github.deemusic.model.DownloadResult;
import com.github.deemusic.model.DownloadStatus;
import com.github.deemusic.model.HistoryRecord;
import com.github.deemusic.model.ItemType;
import com.github.deemusic.model.QueueItem;
import com.github.deemusic.service.ActiveDownloads.Control;
import com.github.deemusic.service.ActiveDownloads.StopRequest;
import com.github.deemusic.service.pipeline.CatalogClient;
import com.github.deemusic.service.pipeline.OutputPathResolver;
import com.github.deemusic.service.pipeline.TrackDownloader;
import com.github.deemusic.service.pipeline.TransferListener;
import com.github.deemusic.service.progress.ProgressAggregator;
import com.github.deemusic.service.retry.RetryPolicy;
import com.github.deemusic.util.FormatUtils;
import com.github.deemusic.util.ProgressCalculator;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Runs one claimed item through resolve, fetch, decrypt and tag.
 *
 * <p>A track is a single transfer whose byte progress is written at most once per
 * {@code progress-interval-ms}. A composite item resolves its children and downloads them one
 * after another, skipping children already recorded as completed, and checks for pause or
 * cancel before each child. A track checks between transfer blocks and drops its partial file
 * when stopped. Settling the final status is left to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrackDownloadOrchestrator {

    public enum Outcome {
        COMPLETED,
        ALL_FAILED,
        PAUSED,
        CANCELLED,
        REQUEUED
    }

    @Getter
    @RequiredArgsConstructor
    public static final class RunResult {
        private final Outcome outcome;
        private final QueueItem item;
        private final List<HistoryRecord> history;

        static RunResult stopped(StopRequest request, QueueItem item) {
            switch (request) {
                case PAUSE:
                    return new RunResult(Outcome.PAUSED, item, Collections.emptyList());
                case CANCEL:
                    return new RunResult(Outcome.CANCELLED, item, Collections.emptyList());
                case REQUEUE:
                default:
                    return new RunResult(Outcome.REQUEUED, item, Collections.emptyList());
            }
        }
    }

    private final CatalogClient catalogClient;
    private final TrackDownloader trackDownloader;
    private final OutputPathResolver pathResolver;
    private final ProgressAggregator progressAggregator;
    private final RetryPolicy retryPolicy;
    private final QueueItemWriter itemWriter;
    private final DeeMusicProperties properties;
    private final Clock clock;

    /**
     * @param item    the claimed item, used as this run's working copy
     * @param control stop requests for the item
     * @throws RuntimeException any pipeline failure that ends the run
     */
    public RunResult execute(QueueItem item, Control control) {
        log.info("Processing {} {} [{}]", item.getType().code(), item.getDisplayName(), item.getId());
        return item.isComposite() ? executeComposite(item, control) : executeTrack(item, control);
    }

    private RunResult executeTrack(QueueItem working, Control control) {
        CatalogEntry track = catalogClient.resolve(ItemType.TRACK, working.getId());
        applyMetadata(working, track);
        Path target = pathResolver.resolve(track, working, 0, working.getQuality());
        working.setDownloadUrl(track.getStreamLocator());
        working.setOutputPath(target.toString());
        itemWriter.save(working, DownloadStatus.DOWNLOADING);

        if (control.isStopRequested()) {
            return RunResult.stopped(control.getRequest(), working);
        }

        DownloadResult result;
        try {
            result = trackDownloader.download(track, target, working.getQuality(),
                    new ProgressTicker(working, control));
        } catch (TransferStoppedException e) {
            log.info("Stopped transfer of {}: {}", working.getId(), e.getRequest());
            return RunResult.stopped(e.getRequest(), working);
        }
        StopRequest late = control.getRequest();
        if (late == StopRequest.PAUSE || late == StopRequest.CANCEL) {
            log.info("{} requested for {} as its transfer finished", late, working.getId());
            return RunResult.stopped(late, working);
        }
        working.setOutputPath(result.getFilePath().toString());

        HistoryRecord record = historyRecord(working, result.getTrackId(), working.getTitle(), working.getArtist(),
                result.getFilePath().toString(), result.getFileSizeBytes());
        return new RunResult(Outcome.COMPLETED, working, List.of(record));
    }

    private RunResult executeComposite(QueueItem working, Control control) {
        CatalogEntry owner = catalogClient.resolve(working.getType(), working.getId());
        applyMetadata(working, owner);
        working.setOutputPath(pathResolver.containerDirectory(working).toString());

        List<String> childIds = owner.getChildIds() != null ? owner.getChildIds() : Collections.emptyList();
        progressAggregator.applyTotal(working, childIds.size());
        itemWriter.save(working, DownloadStatus.DOWNLOADING);
        log.debug("{} has {} tracks, {} already completed", working.getId(), working.getTotalTracks(),
                working.getCompletedTracks());

        Set<String> alreadyCompleted = progressAggregator.completedChildIds(working);
        int position = 0;
        for (String childId : childIds) {
            position++;
            if (alreadyCompleted.contains(childId)) {
                continue;
            }
            if (control.isStopRequested()) {
                log.info("Stopping {} before track {}/{}: {}", working.getId(), position, childIds.size(),
                        control.getRequest());
                return RunResult.stopped(control.getRequest(), working);
            }

            downloadChild(working, childId, position);
            itemWriter.save(working, DownloadStatus.DOWNLOADING);
        }

        Outcome outcome = progressAggregator.outcome(working) == ProgressAggregator.CompositeOutcome.ALL_FAILED
                ? Outcome.ALL_FAILED
                : Outcome.COMPLETED;
        return new RunResult(outcome, working, outcome == Outcome.COMPLETED
                ? compositeHistory(working)
                : Collections.emptyList());
    }

    /**
     * One child, retried in place. Failures that concern only this child are recorded and
     * swallowed; authentication and disk failures end the whole item.
     */
    private void downloadChild(QueueItem parent, String childId, int position) {
        int attempts = 0;
        while (true) {
            attempts++;
            CatalogEntry track = null;
            DownloadResult result;
            try {
                track = catalogClient.resolve(ItemType.TRACK, childId);
                inheritFromParent(track, parent);
                Path target = pathResolver.resolve(track, parent, position, parent.getQuality());
                result = trackDownloader.download(track, target, parent.getQuality(), TransferListener.NONE);
            } catch (RuntimeException e) {
                FailureKind kind = retryPolicy.classify(e);
                if (retryPolicy.abortsComposite(kind)) {
                    throw e;
                }
                if (retryPolicy.shouldRetryChild(attempts, kind)) {
                    log.warn("Track {} of {} failed (attempt {}), retrying: {}", childId, parent.getId(), attempts,
                            e.getMessage());
                    pause(retryPolicy.backoff(attempts));
                    continue;
                }
                log.warn("Track {} of {} failed after {} attempt(s): {}", childId, parent.getId(), attempts,
                        e.getMessage());
                progressAggregator.recordChildFailure(parent, ChildTrack.builder()
                        .parentId(parent.getId())
                        .trackId(childId)
                        .title(track != null ? track.getTitle() : null)
                        .artist(track != null ? track.getArtist() : null)
                        .status(DownloadStatus.FAILED)
                        .errorMessage(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .attempts(attempts)
                        .build());
                return;
            }

            progressAggregator.recordChildSuccess(parent, ChildTrack.builder()
                    .parentId(parent.getId())
                    .trackId(childId)
                    .title(track.getTitle())
                    .artist(track.getArtist())
                    .status(DownloadStatus.COMPLETED)
                    .attempts(attempts)
                    .filePath(result.getFilePath().toString())
                    .fileSizeBytes(result.getFileSizeBytes())
                    .build());
            log.debug("Track {}/{} of {} done", parent.getCompletedTracks(), parent.getTotalTracks(), parent.getId());
            return;
        }
    }

    private List<HistoryRecord> compositeHistory(QueueItem parent) {
        List<HistoryRecord> records = new ArrayList<>();
        for (ChildTrack child : progressAggregator.completedChildren(parent)) {
            records.add(historyRecord(parent, child.getTrackId(), child.getTitle(), child.getArtist(),
                    child.getFilePath(), child.getFileSizeBytes()));
        }
        return records;
    }

    private HistoryRecord historyRecord(QueueItem item, String trackId, String title, String artist,
                                        String filePath, long size) {
        return HistoryRecord.builder()
                .trackId(trackId)
                .title(title)
                .artist(artist != null ? artist : item.getArtist())
                .album(item.getType() == ItemType.ALBUM ? item.getTitle() : item.getAlbum())
                .filePath(filePath)
                .fileSizeBytes(size)
                .quality(item.getQuality())
                .downloadedAt(clock.instant())
                .build();
    }

    /**
     * Fill display fields the caller did not provide from the catalog.
     */
    private static void applyMetadata(QueueItem item, CatalogEntry entry) {
        if (isMissing(item.getTitle()) || item.getTitle().equals(item.getId())) {
            item.setTitle(entry.getTitle());
        }
        if (isMissing(item.getArtist())) {
            item.setArtist(entry.getArtist());
        }
        if (isMissing(item.getAlbum())) {
            item.setAlbum(item.getType() == ItemType.ALBUM ? entry.getTitle() : entry.getAlbum());
        }
    }

    private static void inheritFromParent(CatalogEntry track, QueueItem parent) {
        if (isMissing(track.getArtist())) {
            track.setArtist(parent.getArtist());
        }
        if (isMissing(track.getAlbum()) && parent.getType() == ItemType.ALBUM) {
            track.setAlbum(parent.getTitle());
        }
    }

    private static boolean isMissing(String value) {
        return value == null || value.isBlank();
    }

    private static void pause(Duration delay) {
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientDownloadException("Interrupted while waiting to retry", e);
        }
    }

    /**
     * Writes leaf progress when the whole percentage grows and the interval has passed. Ends the
     * transfer at the next block once a stop is requested.
     */
    private final class ProgressTicker implements TransferListener {

        private final QueueItem working;
        private final Control control;
        private final long intervalMs = properties.getDownload().getProgressIntervalMs();
        private final long startedAt = clock.millis();
        private long lastWrite;
        private int lastPercent;

        private ProgressTicker(QueueItem working, Control control) {
            this.working = working;
            this.control = control;
            this.lastPercent = working.getProgress();
        }

        @Override
        public void onProgress(long downloadedBytes, long totalBytes) {
            if (control.isStopRequested()) {
                throw new TransferStoppedException(working.getId(), control.getRequest());
            }
            progressAggregator.applyTransfer(working, downloadedBytes, totalBytes);
            int percent = working.getProgress();
            if (percent <= lastPercent) {
                return;
            }
            long now = clock.millis();
            if (percent == 100 || now - lastWrite >= intervalMs) {
                itemWriter.save(working, DownloadStatus.DOWNLOADING);
                lastWrite = now;
                lastPercent = percent;
                if (log.isDebugEnabled()) {
                    Double speed = ProgressCalculator.calculateSpeed(downloadedBytes, now - startedAt);
                    Long eta = ProgressCalculator.calculateEta(downloadedBytes, totalBytes, now - startedAt);
                    log.debug("{} at {}% ({}, eta {}s)", working.getId(), percent,
                            speed != null ? FormatUtils.formatSpeed(speed) : "-", eta != null ? eta : "-");
                }
            }
        }
    }
}
