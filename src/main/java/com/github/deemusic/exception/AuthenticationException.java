package com.github.deemusic.exception;

/**
 * Credentials were rejected or have expired.
 */
public class AuthenticationException extends PipelineException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.AUTH;
    }
}
