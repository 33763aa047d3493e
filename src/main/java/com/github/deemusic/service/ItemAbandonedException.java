package com.github.deemusic.service;

import com.github.deemusic.exception.DownloadException;

/**
 * The row a worker was writing to was removed or taken out of downloading by someone else.
 * The worker stops without touching the row again.
 */
class ItemAbandonedException extends DownloadException {

    ItemAbandonedException(String itemId) {
        super("Item " + itemId + " is no longer downloading");
    }
}
