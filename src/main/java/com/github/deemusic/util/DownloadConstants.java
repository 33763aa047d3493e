package com.github.deemusic.util;

/**
 * Constants used throughout the download system.
 */
public final class DownloadConstants {

    private DownloadConstants() {
        // Utility class, no instantiation
    }

    // ========== Streams ==========

    /**
     * Size of one stream block handed to the decryptor.
     */
    public static final int STREAM_CHUNK_SIZE = 2048;

    /**
     * Suffix of a file still being written. Renamed away once the stream is complete.
     */
    public static final String PART_FILE_SUFFIX = ".part";

    // ========== Messages ==========

    public static final String CANCELLED_MESSAGE = "cancelled by user";

    // ========== Paging ==========

    public static final int DEFAULT_PAGE_SIZE = 100;

    public static final int MAX_PAGE_SIZE = 1000;

    // ========== Layout ==========

    /**
     * Directory under the output root that holds playlist downloads.
     */
    public static final String PLAYLISTS_DIRECTORY = "Playlists";

    /**
     * Longest file or directory name produced by {@link PathUtils#sanitizeFilename}.
     */
    public static final int MAX_FILENAME_LENGTH = 200;
}
