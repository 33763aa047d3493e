package com.github.deemusic.exception;

import com.github.deemusic.model.DownloadStatus;

/**
 * Thrown when an operation is not permitted from the item's current status,
 * e.g. pausing an item that already completed.
 */
public class InvalidTransitionException extends QueueOperationException {

    private final DownloadStatus currentStatus;
    private final String operation;

    public InvalidTransitionException(String itemId, DownloadStatus currentStatus, String operation) {
        super(String.format("Cannot %s item %s while it is %s",
                operation, itemId, currentStatus.code()), itemId);
        this.currentStatus = currentStatus;
        this.operation = operation;
    }

    public DownloadStatus getCurrentStatus() {
        return currentStatus;
    }

    public String getOperation() {
        return operation;
    }
}
