package com.github.deemusic.exception;

public class ItemNotFoundException extends QueueOperationException {

    public ItemNotFoundException(String itemId) {
        super("Queue item not found: " + itemId, itemId);
    }
}
