package com.github.deemusic.exception;

/**
 * The stream could not be decrypted.
 */
public class DecryptionException extends PipelineException {

    public DecryptionException(String message) {
        super(message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.DECRYPTION;
    }
}
