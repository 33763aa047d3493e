package com.github.deemusic.controller;

import com.github.deemusic.model.ChildTrack;
import com.github.deemusic.model.DownloadStatus;
import com.github.deemusic.model.EnqueueRequest;
import com.github.deemusic.model.HistoryRecord;
import com.github.deemusic.model.QueueItem;
import com.github.deemusic.model.QueueStats;
import com.github.deemusic.service.DownloadQueueService;
import com.github.deemusic.util.DownloadConstants;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DownloadController {

    private final DownloadQueueService downloadQueueService;

    /**
     * Add an item to the queue
     */
    @PostMapping("/queue")
    public ResponseEntity<QueueItem> enqueue(@Valid @RequestBody EnqueueRequest request) {
        log.info("Enqueue {} {}", request.getType().code(), request.getId());
        QueueItem item = downloadQueueService.enqueue(request.getId(), request.getType(), request.toHints());
        return ResponseEntity.status(HttpStatus.CREATED).body(item);
    }

    /**
     * List queue items, oldest first
     */
    @GetMapping("/queue")
    public ResponseEntity<List<QueueItem>> list(
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "" + DownloadConstants.DEFAULT_PAGE_SIZE) int limit,
            @RequestParam(required = false) DownloadStatus status) {
        return ResponseEntity.ok(downloadQueueService.list(offset, limit, status));
    }

    @GetMapping("/queue/stats")
    public ResponseEntity<QueueStats> stats() {
        return ResponseEntity.ok(downloadQueueService.stats());
    }

    @GetMapping("/queue/{id}")
    public ResponseEntity<QueueItem> getItem(@PathVariable String id) {
        return ResponseEntity.ok(downloadQueueService.getItem(id));
    }

    @GetMapping("/queue/{id}/failed-tracks")
    public ResponseEntity<List<ChildTrack>> failedTracks(@PathVariable String id) {
        return ResponseEntity.ok(downloadQueueService.failedTracks(id));
    }

    @PostMapping("/queue/{id}/pause")
    public ResponseEntity<QueueItem> pause(@PathVariable String id) {
        return ResponseEntity.ok(downloadQueueService.pause(id));
    }

    @PostMapping("/queue/{id}/resume")
    public ResponseEntity<QueueItem> resume(@PathVariable String id) {
        return ResponseEntity.ok(downloadQueueService.resume(id));
    }

    @PostMapping("/queue/{id}/retry")
    public ResponseEntity<QueueItem> retry(@PathVariable String id) {
        return ResponseEntity.ok(downloadQueueService.retry(id));
    }

    @PostMapping("/queue/{id}/cancel")
    public ResponseEntity<QueueItem> cancel(@PathVariable String id) {
        return ResponseEntity.ok(downloadQueueService.cancel(id));
    }

    @DeleteMapping("/queue/{id}")
    public ResponseEntity<Void> remove(@PathVariable String id) {
        downloadQueueService.remove(id);
        return ResponseEntity.noContent().build();
    }

    /**
     * Remove completed items, keeping partial successes
     */
    @DeleteMapping("/queue/completed")
    public ResponseEntity<Map<String, Integer>> clearCompleted() {
        return ResponseEntity.ok(Map.of("removed", downloadQueueService.clearCompleted()));
    }

    @DeleteMapping("/queue")
    public ResponseEntity<Map<String, Integer>> clearAll() {
        return ResponseEntity.ok(Map.of("removed", downloadQueueService.clearAll()));
    }

    /**
     * Finished downloads, newest first
     */
    @GetMapping("/history")
    public ResponseEntity<List<HistoryRecord>> history(
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "" + DownloadConstants.DEFAULT_PAGE_SIZE) int limit) {
        return ResponseEntity.ok()
                .header("X-Total-Count", String.valueOf(downloadQueueService.historyCount()))
                .body(downloadQueueService.history(offset, limit));
    }
}
