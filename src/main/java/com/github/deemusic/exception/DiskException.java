package com.github.deemusic.exception;

/**
 * The output could not be written to local storage.
 */
public class DiskException extends PipelineException {

    public DiskException(String message) {
        super(message);
    }

    public DiskException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.DISK;
    }
}
