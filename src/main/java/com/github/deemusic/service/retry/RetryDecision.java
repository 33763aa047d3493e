package com.github.deemusic.service.retry;

import com.github.deemusic.exception.FailureKind;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * What to do with an item after a failed run.
 */
@Data
@Builder
public class RetryDecision {

    public enum Action {
        /** Back to pending with an incremented retry count. */
        REQUEUE,
        /** Terminal failure. */
        FAIL
    }

    private final Action action;
    private final FailureKind kind;
    private final String errorMessage;

    @Builder.Default
    private final Duration delay = Duration.ZERO;

    public boolean isRequeue() {
        return action == Action.REQUEUE;
    }
}
