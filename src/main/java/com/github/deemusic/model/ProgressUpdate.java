package com.github.deemusic.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Wire shape of an item change pushed to SSE clients.
 */
@Data
@Builder
public class ProgressUpdate {

    private String itemId;
    private ItemType type;
    private String title;
    private DownloadStatus status;
    private int progress;
    private int completedTracks;
    private int totalTracks;
    private int retryCount;
    private boolean partialSuccess;
    private String errorMessage;

    @Builder.Default
    private Instant timestamp = Instant.now();

    public static ProgressUpdate forItem(QueueItem item) {
        return ProgressUpdate.builder()
                .itemId(item.getId())
                .type(item.getType())
                .title(item.getDisplayName())
                .status(item.getStatus())
                .progress(item.getProgress())
                .completedTracks(item.getCompletedTracks())
                .totalTracks(item.getTotalTracks())
                .retryCount(item.getRetryCount())
                .partialSuccess(item.isPartialSuccess())
                .errorMessage(item.getErrorMessage())
                .build();
    }
}
