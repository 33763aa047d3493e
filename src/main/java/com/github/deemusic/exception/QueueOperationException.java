package com.github.deemusic.exception;

/**
 * Synchronous, caller-facing rejection of a queue operation. Never retried.
 */
public abstract class QueueOperationException extends DownloadException {

    private final String itemId;

    protected QueueOperationException(String message, String itemId) {
        super(message);
        this.itemId = itemId;
    }

    public String getItemId() {
        return itemId;
    }
}
