package com.github.deemusic.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of one child track of a composite item. Only {@link DownloadStatus#COMPLETED}
 * and {@link DownloadStatus#FAILED} are recorded.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ChildTrack {

    private String parentId;
    private String trackId;
    private String title;
    private String artist;
    private DownloadStatus status;

    @Builder.Default
    private String errorMessage = "";

    private int attempts;
    private String filePath;
    private long fileSizeBytes;
    private Instant updatedAt;
}
