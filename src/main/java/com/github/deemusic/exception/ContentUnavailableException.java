package com.github.deemusic.exception;

/**
 * The catalog does not have the requested content, or it is not streamable.
 */
public class ContentUnavailableException extends PipelineException {

    public ContentUnavailableException(String message) {
        super(message);
    }

    public ContentUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.CONTENT_UNAVAILABLE;
    }
}
