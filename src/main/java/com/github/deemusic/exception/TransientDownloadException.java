package com.github.deemusic.exception;

/**
 * Network timeout or transient server error.
 */
public class TransientDownloadException extends PipelineException {

    public TransientDownloadException(String message) {
        super(message);
    }

    public TransientDownloadException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.TRANSIENT;
    }
}
