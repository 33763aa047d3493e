package com.github.deemusic.service.state;

import com.github.deemusic.model.DownloadStatus;

import java.util.EnumSet;
import java.util.Set;

/**
 * User-initiated operations and the statuses each one may be applied to.
 */
public enum QueueOperation {
    PAUSE("pause", EnumSet.of(DownloadStatus.DOWNLOADING)),
    RESUME("resume", EnumSet.of(DownloadStatus.PAUSED)),
    RETRY("retry", EnumSet.of(DownloadStatus.COMPLETED, DownloadStatus.FAILED)),
    CANCEL("cancel", EnumSet.of(DownloadStatus.PENDING, DownloadStatus.DOWNLOADING, DownloadStatus.PAUSED)),
    REMOVE("remove", EnumSet.allOf(DownloadStatus.class));

    private final String verb;
    private final Set<DownloadStatus> allowedFrom;

    QueueOperation(String verb, Set<DownloadStatus> allowedFrom) {
        this.verb = verb;
        this.allowedFrom = allowedFrom;
    }

    public String getVerb() {
        return verb;
    }

    public boolean isAllowedFrom(DownloadStatus status) {
        return allowedFrom.contains(status);
    }
}
