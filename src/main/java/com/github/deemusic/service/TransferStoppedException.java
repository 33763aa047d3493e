package com.github.deemusic.service;

import com.github.deemusic.exception.DownloadException;
import com.github.deemusic.service.ActiveDownloads.StopRequest;

/**
 * Thrown from a progress callback to end a running transfer after a stop request.
 * The partial file is discarded by the downloader.
 */
class TransferStoppedException extends DownloadException {

    private final StopRequest request;

    TransferStoppedException(String itemId, StopRequest request) {
        super("Transfer of " + itemId + " stopped: " + request);
        this.request = request;
    }

    StopRequest getRequest() {
        return request;
    }
}
