package com.github.deemusic.service;

import com.github.deemusic.config.DeeMusicProperties;
import com.github.deemusic.model.DownloadStatus;
import com.github.deemusic.model.QueueItem;
import com.github.deemusic.service.pipeline.OutputPathResolver;
import com.github.deemusic.service.progress.ProgressAggregator;
import com.github.deemusic.service.retry.RetryPolicy;
import com.github.deemusic.service.state.DownloadStateMachine;
import com.github.deemusic.store.QueueStore;
import com.github.deemusic.store.TestStores;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Predicate;

/**
 * The whole engine over an in-memory database, with a fake catalog and downloader.
 * Retries are immediate.
 */
class DownloadEngineFixture implements AutoCloseable {

    private static final long WAIT_MILLIS = 15_000;

    final EmbeddedDatabase database;
    final QueueStore store;
    final NotificationBridge notificationBridge;
    final ActiveDownloads activeDownloads;
    final FakeCatalogClient catalog = new FakeCatalogClient();
    final FakeTrackDownloader downloader = new FakeTrackDownloader();
    final DownloadScheduler scheduler;
    final DownloadQueueService service;

    private final ExecutorService workerPool = Executors.newCachedThreadPool();

    DownloadEngineFixture(Path outputDir, int workers, int maxRetries) {
        DeeMusicProperties properties = new DeeMusicProperties();
        properties.getDownload().setOutputDir(outputDir.toString());
        properties.getDownload().setConcurrentDownloads(workers);
        properties.getDownload().setProgressIntervalMs(0);
        properties.getScheduler().setIdlePollMs(20);

        Clock clock = Clock.systemUTC();
        database = TestStores.newDatabase();
        store = TestStores.newStore(database, clock);
        notificationBridge = new NotificationBridge(Runnable::run);
        activeDownloads = new ActiveDownloads();

        QueueItemWriter writer = new QueueItemWriter(store, notificationBridge);
        RetryPolicy retryPolicy = new RetryPolicy(maxRetries, 0, 1, 0);
        TrackDownloadOrchestrator orchestrator = new TrackDownloadOrchestrator(catalog, downloader,
                new OutputPathResolver(properties), new ProgressAggregator(store), retryPolicy, writer,
                properties, clock);

        scheduler = new DownloadScheduler(store, orchestrator, retryPolicy, writer, notificationBridge,
                activeDownloads, workerPool, clock, properties);
        service = new DownloadQueueService(store, writer, notificationBridge, new DownloadStateMachine(),
                scheduler, activeDownloads, properties, clock);
    }

    void start() {
        scheduler.start();
    }

    QueueItem awaitStatus(String id, DownloadStatus status) throws InterruptedException {
        return await(id, item -> item.getStatus() == status, "status " + status);
    }

    QueueItem await(String id, Predicate<QueueItem> condition, String description) throws InterruptedException {
        long deadline = System.currentTimeMillis() + WAIT_MILLIS;
        QueueItem last = null;
        while (System.currentTimeMillis() < deadline) {
            Optional<QueueItem> current = store.findById(id);
            if (current.isPresent()) {
                last = current.get();
                if (condition.test(last)) {
                    return last;
                }
            }
            Thread.sleep(10);
        }
        throw new AssertionError("Item " + id + " never reached " + description + ", last seen: " + last);
    }

    void awaitCount(DownloadStatus status, int expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + WAIT_MILLIS * 2;
        while (System.currentTimeMillis() < deadline) {
            if (store.countByStatus(status) == expected) {
                return;
            }
            Thread.sleep(20);
        }
        throw new AssertionError("Expected " + expected + " " + status + " items, found "
                + store.countByStatus(status));
    }

    @Override
    public void close() {
        downloader.releaseAll();
        scheduler.stop();
        workerPool.shutdownNow();
        database.shutdown();
    }
}
