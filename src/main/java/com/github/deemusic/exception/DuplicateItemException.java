package com.github.deemusic.exception;

public class DuplicateItemException extends QueueOperationException {

    public DuplicateItemException(String itemId) {
        super("Item already queued: " + itemId, itemId);
    }
}
