package com.github.deemusic.store;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed set of locks keyed by item id hash. Two writers on the same id always share a lock;
 * writers on different ids rarely do.
 */
class StripedLocks {

    private final ReentrantLock[] stripes;

    StripedLocks(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be positive: " + count);
        }
        stripes = new ReentrantLock[count];
        for (int i = 0; i < count; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    ReentrantLock forKey(String key) {
        int hash = key.hashCode();
        hash ^= (hash >>> 16);
        return stripes[Math.floorMod(hash, stripes.length)];
    }
}
