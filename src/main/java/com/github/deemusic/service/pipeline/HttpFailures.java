package com.github.deemusic.service.pipeline;

import com.github.deemusic.exception.AuthenticationException;
import com.github.deemusic.exception.ContentUnavailableException;
import com.github.deemusic.exception.PipelineException;
import com.github.deemusic.exception.TransientDownloadException;

/**
 * Maps unsuccessful HTTP responses onto pipeline failures.
 */
final class HttpFailures {

    private HttpFailures() {
    }

    static PipelineException forStatus(int code, String what) {
        if (code == 401 || code == 403) {
            return new AuthenticationException(String.format("HTTP %d for %s", code, what));
        }
        if (code == 404 || code == 410 || code == 451) {
            return new ContentUnavailableException(String.format("HTTP %d for %s", code, what));
        }
        // 408, 429, 5xx and anything unexpected may succeed later
        return new TransientDownloadException(String.format("HTTP %d for %s", code, what));
    }
}
