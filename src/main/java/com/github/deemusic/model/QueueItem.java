package com.github.deemusic.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A unit of schedulable work. Tracks are leaf items; albums, playlists and artists are
 * composite items whose children are downloaded one after another by the same worker.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QueueItem {

    private String id;
    private ItemType type;

    private String title;
    private String artist;
    private String album;

    @Builder.Default
    private DownloadStatus status = DownloadStatus.PENDING;

    @Builder.Default
    private int progress = 0;

    private String outputPath;
    private String downloadUrl;

    @Builder.Default
    private String errorMessage = "";

    @Builder.Default
    private int retryCount = 0;

    @Builder.Default
    private int totalTracks = 0;

    @Builder.Default
    private int completedTracks = 0;

    @Builder.Default
    private AudioQuality quality = AudioQuality.MP3_320;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;

    /**
     * Earliest instant at which a pending item may be claimed. Null means immediately.
     */
    @JsonIgnore
    private Instant availableAt;

    /**
     * True when a composite item completed with fewer successful children than it has.
     */
    public boolean isPartialSuccess() {
        return status == DownloadStatus.COMPLETED
                && totalTracks > 0
                && completedTracks < totalTracks;
    }

    public boolean isComposite() {
        return type != null && type.isComposite();
    }

    public String getDisplayName() {
        if (artist != null && !artist.isBlank() && type != ItemType.ARTIST) {
            return artist + " - " + title;
        }
        return title != null ? title : id;
    }

    /**
     * Independent copy, safe to hand to another thread.
     */
    public QueueItem copy() {
        return toBuilder().build();
    }
}
