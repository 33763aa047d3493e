package com.github.deemusic.service;

import com.github.deemusic.model.QueueItem;

/**
 * Receives a snapshot after every persisted change to a queue item. Called on the
 * notification thread; implementations do their own marshaling if they need another one.
 */
@FunctionalInterface
public interface QueueItemListener {

    void onItemChanged(QueueItem snapshot);
}
