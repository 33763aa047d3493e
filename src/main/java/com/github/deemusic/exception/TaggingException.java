package com.github.deemusic.exception;

/**
 * Metadata could not be embedded. Never fails the download it belongs to.
 */
public class TaggingException extends DownloadException {

    public TaggingException(String message, Throwable cause) {
        super(message, cause);
    }
}
