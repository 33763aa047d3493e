package com.github.deemusic.exception;

/**
 * Classification of a pipeline failure, used by the retry policy.
 */
public enum FailureKind {
    TRANSIENT(true),
    DECRYPTION(true),
    AUTH(false),
    CONTENT_UNAVAILABLE(false),
    DISK(false);

    private final boolean retryable;

    FailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
