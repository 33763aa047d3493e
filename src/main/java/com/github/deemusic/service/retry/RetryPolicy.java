package com.github.deemusic.service.retry;

import com.github.deemusic.config.DeeMusicProperties;
import com.github.deemusic.exception.FailureKind;
import com.github.deemusic.exception.PipelineException;
import com.github.deemusic.model.QueueItem;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;

/**
 * Classifies pipeline failures and decides whether an item goes back to pending.
 *
 * <p>Transient and decryption failures are retried while {@code retryCount < maxRetries}.
 * Authentication, missing content and disk failures are terminal on the first occurrence.
 * Anything unrecognised is treated as transient so that it is bounded by the same limit.
 */
@Slf4j
@Component
public class RetryPolicy {

    private final int maxRetries;
    private final long initialDelayMs;
    private final int multiplier;
    private final long maxDelayMs;

    @Autowired
    public RetryPolicy(DeeMusicProperties properties) {
        this(properties.getRetry().getMaxRetries(),
                properties.getRetry().getInitialDelayMs(),
                properties.getRetry().getMultiplier(),
                properties.getRetry().getMaxDelayMs());
    }

    public RetryPolicy(int maxRetries, long initialDelayMs, int multiplier, long maxDelayMs) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
        }
        if (initialDelayMs < 0 || maxDelayMs < 0) {
            throw new IllegalArgumentException("delays must be >= 0");
        }
        if (multiplier < 1) {
            throw new IllegalArgumentException("multiplier must be >= 1, got: " + multiplier);
        }
        this.maxRetries = maxRetries;
        this.initialDelayMs = initialDelayMs;
        this.multiplier = multiplier;
        this.maxDelayMs = maxDelayMs;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public FailureKind classify(@NonNull Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof PipelineException) {
                return ((PipelineException) current).getKind();
            }
            if (current instanceof IOException || current instanceof UncheckedIOException) {
                return FailureKind.TRANSIENT;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return FailureKind.TRANSIENT;
    }

    /**
     * Decide the fate of an item whose run just failed. {@code item.retryCount} is the number of
     * requeues already spent.
     */
    public RetryDecision decide(@NonNull QueueItem item, @NonNull Throwable failure) {
        FailureKind kind = classify(failure);
        String message = describe(kind, failure);

        if (kind.isRetryable() && item.getRetryCount() < maxRetries) {
            int nextRetry = item.getRetryCount() + 1;
            Duration delay = backoff(nextRetry);
            log.debug("Item {} will be retried ({}/{}) after {} ms: {}",
                    item.getId(), nextRetry, maxRetries, delay.toMillis(), message);
            return RetryDecision.builder()
                    .action(RetryDecision.Action.REQUEUE)
                    .kind(kind)
                    .errorMessage(message)
                    .delay(delay)
                    .build();
        }

        if (kind.isRetryable()) {
            message = String.format("%s (gave up after %d retries)", message, maxRetries);
        }
        return RetryDecision.builder()
                .action(RetryDecision.Action.FAIL)
                .kind(kind)
                .errorMessage(message)
                .build();
    }

    /**
     * Whether a child track of a composite item gets another in-place attempt.
     *
     * @param attempts attempts already made for the child, including the failed one
     */
    public boolean shouldRetryChild(int attempts, @NonNull FailureKind kind) {
        return kind.isRetryable() && attempts <= maxRetries;
    }

    /**
     * Failures that make every remaining child of a composite item pointless.
     */
    public boolean abortsComposite(@NonNull FailureKind kind) {
        return kind == FailureKind.AUTH || kind == FailureKind.DISK;
    }

    /**
     * Delay before the {@code retryNumber}-th retry: {@code initialDelay * multiplier^(retryNumber-1)},
     * capped at {@code maxDelay}.
     */
    public Duration backoff(int retryNumber) {
        if (retryNumber <= 0 || initialDelayMs == 0) {
            return Duration.ZERO;
        }
        double delay = initialDelayMs * Math.pow(multiplier, retryNumber - 1);
        return Duration.ofMillis((long) Math.min(maxDelayMs, delay));
    }

    String describe(FailureKind kind, Throwable failure) {
        String detail = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        switch (kind) {
            case AUTH:
                return "Authentication failed: " + detail;
            case CONTENT_UNAVAILABLE:
                return "Content unavailable: " + detail;
            case DISK:
                return "Disk error: " + detail;
            case DECRYPTION:
                return "Decryption failed: " + detail;
            case TRANSIENT:
            default:
                return detail;
        }
    }
}
