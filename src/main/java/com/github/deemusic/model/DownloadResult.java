package com.github.deemusic.model;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * Result of one track passing through fetch, decrypt and tag.
 */
@Data
@Builder
public class DownloadResult {

    private final String trackId;
    private final Path filePath;
    private final long fileSizeBytes;
    private final AudioQuality quality;

    /**
     * Tagging is best effort; a failed embed still yields a usable file.
     */
    private final boolean tagged;
}
