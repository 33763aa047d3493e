package com.github.deemusic.service.pipeline;

/**
 * Byte-level progress of one stream. {@code totalBytes} is -1 when the size is unknown.
 */
@FunctionalInterface
public interface TransferListener {

    TransferListener NONE = (downloadedBytes, totalBytes) -> { };

    void onProgress(long downloadedBytes, long totalBytes);
}
