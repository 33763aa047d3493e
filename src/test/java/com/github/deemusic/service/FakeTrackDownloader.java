package com.github.deemusic.service;

import com.github.deemusic.model.AudioQuality;
import com.github.deemusic.model.CatalogEntry;
import com.github.deemusic.model.DownloadResult;
import com.github.deemusic.service.pipeline.TrackDownloader;
import com.github.deemusic.service.pipeline.TransferListener;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Scriptable stand-in for the fetch pipeline. Nothing is written to disk.
 */
class FakeTrackDownloader extends TrackDownloader {

    static final long FILE_SIZE = 4096;

    /**
     * Holds a transfer open until released.
     */
    static final class Gate {
        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch released = new CountDownLatch(1);

        boolean awaitEntered() throws InterruptedException {
            return entered.await(10, TimeUnit.SECONDS);
        }

        void release() {
            released.countDown();
        }
    }

    private final Map<String, Deque<RuntimeException>> scriptedFailures = new ConcurrentHashMap<>();
    private final Map<String, Supplier<RuntimeException>> permanentFailures = new ConcurrentHashMap<>();
    private final Map<String, Gate> gates = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private volatile Runnable onTransfer = () -> { };
    private volatile long transferMillis;

    FakeTrackDownloader() {
        super(null, null);
    }

    void failNext(String trackId, RuntimeException... failures) {
        scriptedFailures.put(trackId, new ArrayDeque<>(Arrays.asList(failures)));
    }

    void failAlways(String trackId, Supplier<RuntimeException> failure) {
        permanentFailures.put(trackId, failure);
    }

    void clearFailures() {
        scriptedFailures.clear();
        permanentFailures.clear();
    }

    Gate block(String trackId) {
        Gate gate = new Gate();
        gates.put(trackId, gate);
        return gate;
    }

    void releaseAll() {
        gates.values().forEach(Gate::release);
    }

    void onTransfer(Runnable hook) {
        this.onTransfer = hook;
    }

    void transferMillis(long millis) {
        this.transferMillis = millis;
    }

    int calls(String trackId) {
        AtomicInteger count = calls.get(trackId);
        return count != null ? count.get() : 0;
    }

    int maxInFlight() {
        return maxInFlight.get();
    }

    @Override
    public DownloadResult download(CatalogEntry track, Path target, AudioQuality quality, TransferListener listener) {
        calls.computeIfAbsent(track.getId(), id -> new AtomicInteger()).incrementAndGet();
        int now = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(now, Math::max);
        try {
            onTransfer.run();
            Gate gate = gates.get(track.getId());
            if (gate != null) {
                gate.entered.countDown();
                boolean released = gate.released.await(10, TimeUnit.SECONDS);
                gates.remove(track.getId(), gate);
                if (!released) {
                    throw new IllegalStateException("Gate for " + track.getId() + " never released");
                }
            }
            if (transferMillis > 0) {
                Thread.sleep(transferMillis);
            }

            Deque<RuntimeException> scripted = scriptedFailures.get(track.getId());
            RuntimeException next = scripted != null ? scripted.poll() : null;
            if (next != null) {
                throw next;
            }
            Supplier<RuntimeException> permanent = permanentFailures.get(track.getId());
            if (permanent != null) {
                throw permanent.get();
            }

            listener.onProgress(FILE_SIZE / 2, FILE_SIZE);
            listener.onProgress(FILE_SIZE, FILE_SIZE);
            return DownloadResult.builder()
                    .trackId(track.getId())
                    .filePath(target)
                    .fileSizeBytes(FILE_SIZE)
                    .quality(quality)
                    .tagged(true)
                    .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted", e);
        } finally {
            inFlight.decrementAndGet();
        }
    }
}
