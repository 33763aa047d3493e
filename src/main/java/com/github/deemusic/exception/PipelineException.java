package com.github.deemusic.exception;

/**
 * Failure raised while resolving, fetching, decrypting or writing a track.
 */
public abstract class PipelineException extends DownloadException {

    protected PipelineException(String message) {
        super(message);
    }

    protected PipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract FailureKind getKind();
}
