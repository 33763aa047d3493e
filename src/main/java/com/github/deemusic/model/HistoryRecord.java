package com.github.deemusic.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Append-only record of a finished download. Outlives the queue item it came from.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoryRecord {

    private Long id;
    private String trackId;
    private String title;
    private String artist;
    private String album;
    private String filePath;
    private long fileSizeBytes;
    private AudioQuality quality;
    private Instant downloadedAt;
}
