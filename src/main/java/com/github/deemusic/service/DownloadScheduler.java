package com.github.deemusic.service;

import com.github.deemusic.config.DeeMusicProperties;
import com.github.deemusic.exception.PipelineException;
import com.github.deemusic.model.DownloadStatus;
import com.github.deemusic.model.HistoryRecord;
import com.github.deemusic.model.QueueItem;
import com.github.deemusic.service.ActiveDownloads.Control;
import com.github.deemusic.service.ActiveDownloads.StopRequest;
import com.github.deemusic.service.TrackDownloadOrchestrator.RunResult;
import com.github.deemusic.service.retry.RetryDecision;
import com.github.deemusic.service.retry.RetryPolicy;
import com.github.deemusic.store.QueueStore;
import com.github.deemusic.util.DownloadConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed pool of worker loops pulling pending items from the {@link QueueStore}.
 *
 * <p>Each loop claims one item at a time, so no more than {@code concurrent-downloads} items
 * are ever downloading. A loop with nothing to claim sleeps until {@link #signalWork()} is
 * called or the next backed-off item becomes claimable, bounded by {@code idle-poll-ms}.
 * Failures are caught per item and settled through the {@link RetryPolicy}; nothing escapes
 * a loop.
 */
@Slf4j
@Service
public class DownloadScheduler implements SmartLifecycle {

    private static final long STOP_TIMEOUT_SECONDS = 30;

    private final QueueStore queueStore;
    private final TrackDownloadOrchestrator orchestrator;
    private final RetryPolicy retryPolicy;
    private final QueueItemWriter itemWriter;
    private final NotificationBridge notificationBridge;
    private final ActiveDownloads activeDownloads;
    private final Executor workerExecutor;
    private final Clock clock;
    private final int workers;
    private final long idlePollMs;

    private final ReentrantLock idleLock = new ReentrantLock();
    private final Condition workAvailable = idleLock.newCondition();
    private boolean signalled;

    private volatile boolean running;
    private volatile int generation;
    private volatile CountDownLatch stopped = new CountDownLatch(0);

    public DownloadScheduler(QueueStore queueStore,
                             TrackDownloadOrchestrator orchestrator,
                             RetryPolicy retryPolicy,
                             QueueItemWriter itemWriter,
                             NotificationBridge notificationBridge,
                             ActiveDownloads activeDownloads,
                             @Qualifier("downloadWorkerExecutor") Executor workerExecutor,
                             Clock clock,
                             DeeMusicProperties properties) {
        this.queueStore = queueStore;
        this.orchestrator = orchestrator;
        this.retryPolicy = retryPolicy;
        this.itemWriter = itemWriter;
        this.notificationBridge = notificationBridge;
        this.activeDownloads = activeDownloads;
        this.workerExecutor = workerExecutor;
        this.clock = clock;
        this.workers = properties.getDownload().getConcurrentDownloads();
        this.idlePollMs = properties.getScheduler().getIdlePollMs();
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        Set<String> stillRunning = activeDownloads.activeIds();
        if (stopped.getCount() > 0) {
            log.warn("{} worker(s) from the previous run are still finishing: {}", stopped.getCount(), stillRunning);
        }
        int recovered = queueStore.resetInterrupted(stillRunning);
        if (recovered > 0) {
            log.info("Returned {} interrupted download(s) to pending", recovered);
        }

        running = true;
        int current = ++generation;
        CountDownLatch done = new CountDownLatch(workers);
        stopped = done;
        for (int i = 0; i < workers; i++) {
            workerExecutor.execute(() -> runWorker(current, done));
        }
        log.info("Download scheduler started with {} workers", workers);
    }

    /**
     * Ask in-flight items to go back to pending at their next track boundary or transfer block
     * and wait for the loops to exit. If they do not exit in time, a later {@link #start()} leaves
     * their items alone and the old loops exit after settling them.
     */
    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        activeDownloads.requestStopAll(StopRequest.REQUEUE);
        signalWork();
        try {
            if (!stopped.await(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Download workers did not stop within {}s", STOP_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Download scheduler stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Wake idle workers. Called after an enqueue, resume or retry, and when a worker releases
     * its slot.
     */
    public void signalWork() {
        idleLock.lock();
        try {
            signalled = true;
            workAvailable.signalAll();
        } finally {
            idleLock.unlock();
        }
    }

    /**
     * @param workerGeneration loops of an earlier start exit once they finish their current item
     */
    private void runWorker(int workerGeneration, CountDownLatch done) {
        log.debug("Worker {} started", Thread.currentThread().getName());
        try {
            while (running && workerGeneration == generation) {
                Optional<QueueItem> claimed;
                try {
                    claimed = queueStore.claimNextPending();
                } catch (RuntimeException e) {
                    log.error("Failed to claim next item: {}", e.getMessage(), e);
                    claimed = Optional.empty();
                }

                if (claimed.isPresent()) {
                    process(claimed.get());
                } else if (!awaitWork()) {
                    break;
                }
            }
        } finally {
            done.countDown();
            log.debug("Worker {} exiting", Thread.currentThread().getName());
        }
    }

    /**
     * @return false if the worker thread was interrupted
     */
    private boolean awaitWork() {
        long waitMs = idlePollMs;
        try {
            Optional<Instant> nextAt = queueStore.nextAvailableAt();
            if (nextAt.isPresent()) {
                long untilNext = Duration.between(clock.instant(), nextAt.get()).toMillis();
                waitMs = Math.max(1, Math.min(waitMs, untilNext));
            }
        } catch (RuntimeException e) {
            log.warn("Could not read next retry time: {}", e.getMessage());
        }

        idleLock.lock();
        try {
            if (!signalled && running) {
                workAvailable.await(waitMs, TimeUnit.MILLISECONDS);
            }
            signalled = false;
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            idleLock.unlock();
        }
    }

    void process(QueueItem claimed) {
        log.info("Claimed {} [{}]", claimed.getDisplayName(), claimed.getId());
        notificationBridge.publish(claimed);

        QueueItem working = claimed.copy();
        Control control = activeDownloads.register(claimed.getId());
        try {
            settle(orchestrator.execute(working, control));
        } catch (ItemAbandonedException e) {
            log.info("Stopped working on {}: item was removed or changed", claimed.getId());
        } catch (Exception e) {
            handleFailure(working, e);
        } finally {
            activeDownloads.unregister(claimed.getId(), control);
            signalWork();
        }
    }

    private void settle(RunResult result) {
        QueueItem item = result.getItem();
        switch (result.getOutcome()) {
            case COMPLETED:
                complete(item, result);
                break;
            case ALL_FAILED:
                fail(item, String.format("all %d tracks failed", item.getTotalTracks()));
                break;
            case PAUSED:
                item.setStatus(DownloadStatus.PAUSED);
                itemWriter.save(item, DownloadStatus.DOWNLOADING);
                log.info("Paused {} at {}/{} tracks", item.getId(), item.getCompletedTracks(), item.getTotalTracks());
                break;
            case CANCELLED:
                fail(item, DownloadConstants.CANCELLED_MESSAGE);
                break;
            case REQUEUED:
            default:
                item.setStatus(DownloadStatus.PENDING);
                itemWriter.save(item, DownloadStatus.DOWNLOADING);
                log.info("Returned {} to pending", item.getId());
                break;
        }
    }

    private void complete(QueueItem item, RunResult result) {
        if (!item.isComposite() || item.getCompletedTracks() >= item.getTotalTracks()) {
            item.setProgress(100);
        }
        item.setStatus(DownloadStatus.COMPLETED);
        item.setErrorMessage("");
        if (item.getCompletedAt() == null) {
            item.setCompletedAt(clock.instant());
        }
        QueueItem stored = itemWriter.save(item, DownloadStatus.DOWNLOADING);

        for (HistoryRecord record : result.getHistory()) {
            queueStore.addToHistory(record);
        }

        if (stored.isPartialSuccess()) {
            log.info("Completed {} with {}/{} tracks", stored.getDisplayName(), stored.getCompletedTracks(),
                    stored.getTotalTracks());
        } else {
            log.info("Completed {}", stored.getDisplayName());
        }
    }

    /**
     * The message is written while the item is still downloading, then the status moves.
     */
    private void fail(QueueItem item, String message) {
        item.setErrorMessage(message);
        itemWriter.save(item, DownloadStatus.DOWNLOADING);

        item.setStatus(DownloadStatus.FAILED);
        if (item.getCompletedAt() == null) {
            item.setCompletedAt(clock.instant());
        }
        itemWriter.save(item, DownloadStatus.DOWNLOADING);
        log.info("Failed {}: {}", item.getDisplayName(), message);
    }

    private void handleFailure(QueueItem item, Exception failure) {
        try {
            RetryDecision decision = retryPolicy.decide(item, failure);
            if (!decision.isRequeue()) {
                if (isUnexpected(failure)) {
                    log.error("Unexpected error downloading {}: {}", item.getId(), failure.getMessage(), failure);
                }
                fail(item, decision.getErrorMessage());
                return;
            }

            item.setErrorMessage(decision.getErrorMessage());
            itemWriter.save(item, DownloadStatus.DOWNLOADING);

            item.setRetryCount(item.getRetryCount() + 1);
            item.setErrorMessage("");
            item.setStatus(DownloadStatus.PENDING);
            item.setAvailableAt(decision.getDelay().isZero() ? null : clock.instant().plus(decision.getDelay()));
            itemWriter.save(item, DownloadStatus.DOWNLOADING);
            log.warn("Download of {} failed, retry {}/{} in {} ms: {}", item.getId(), item.getRetryCount(),
                    retryPolicy.getMaxRetries(), decision.getDelay().toMillis(), decision.getErrorMessage());
        } catch (ItemAbandonedException e) {
            log.info("Item {} was removed while settling its failure", item.getId());
        } catch (RuntimeException e) {
            log.error("Failed to record failure of {}: {}", item.getId(), e.getMessage(), e);
        }
    }

    private static boolean isUnexpected(Exception failure) {
        return !(failure instanceof PipelineException);
    }
}
