package com.github.deemusic.service.state;

import com.github.deemusic.exception.InvalidTransitionException;
import com.github.deemusic.model.DownloadStatus;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for queue item status transitions.
 *
 * Valid state flow:
 * <pre>
 * PENDING → DOWNLOADING → COMPLETED
 *    ↑          ↓  ↓  ↓
 *    └──────────┘  │  FAILED
 *    ↑             ↓
 *    └──────── PAUSED
 *
 * COMPLETED / FAILED → PENDING   (explicit retry only)
 * PENDING / PAUSED → FAILED      (cancel)
 * </pre>
 */
@Component
@Slf4j
public class DownloadStateMachine {

    private static final Set<DownloadStatus> TERMINAL_STATES =
            EnumSet.of(DownloadStatus.COMPLETED, DownloadStatus.FAILED);

    private final Map<DownloadStatus, Set<DownloadStatus>> validTransitions;

    public DownloadStateMachine() {
        validTransitions = new EnumMap<>(DownloadStatus.class);
        initializeTransitions();
    }

    private void initializeTransitions() {
        // claim, or cancel before it starts
        validTransitions.put(DownloadStatus.PENDING,
            EnumSet.of(DownloadStatus.DOWNLOADING, DownloadStatus.FAILED));

        // success, terminal failure, requeue after retryable failure, pause
        validTransitions.put(DownloadStatus.DOWNLOADING,
            EnumSet.of(DownloadStatus.COMPLETED, DownloadStatus.FAILED,
                    DownloadStatus.PENDING, DownloadStatus.PAUSED));

        // resume, cancel
        validTransitions.put(DownloadStatus.PAUSED,
            EnumSet.of(DownloadStatus.PENDING, DownloadStatus.FAILED));

        // explicit retry
        validTransitions.put(DownloadStatus.COMPLETED, EnumSet.of(DownloadStatus.PENDING));
        validTransitions.put(DownloadStatus.FAILED, EnumSet.of(DownloadStatus.PENDING));
    }

    /**
     * Check if a state transition is valid.
     *
     * @param currentState Current state
     * @param newState Desired new state
     * @return true if transition is valid
     */
    public boolean isValidTransition(@NonNull DownloadStatus currentState, @NonNull DownloadStatus newState) {
        if (currentState == newState) {
            // progress ticks and metadata corrections keep the status
            return true;
        }

        Set<DownloadStatus> allowedTransitions = validTransitions.get(currentState);
        return allowedTransitions != null && allowedTransitions.contains(newState);
    }

    /**
     * Validate a transition, logging and keeping the current state when it is not allowed.
     *
     * @return New state if valid, current state if invalid
     */
    public DownloadStatus transition(
            @NonNull String itemId,
            @NonNull DownloadStatus currentState,
            @NonNull DownloadStatus newState) {

        if (isValidTransition(currentState, newState)) {
            if (currentState != newState) {
                log.debug("Item {} state transition: {} → {}", itemId, currentState, newState);
            }
            return newState;
        } else {
            log.warn("Item {} invalid state transition attempted: {} → {} (rejected)",
                    itemId, currentState, newState);
            return currentState;
        }
    }

    /**
     * Check that a user operation may be applied to an item in {@code currentState}.
     *
     * @throws InvalidTransitionException if the operation is not permitted
     */
    public void requireAllowed(
            @NonNull String itemId,
            @NonNull DownloadStatus currentState,
            @NonNull QueueOperation operation) {

        if (!operation.isAllowedFrom(currentState)) {
            log.debug("Item {} rejected {} while {}", itemId, operation.getVerb(), currentState);
            throw new InvalidTransitionException(itemId, currentState, operation.getVerb());
        }
    }

    /**
     * Terminal for the current run: only an explicit user action moves the item on.
     */
    public boolean isTerminalState(@NonNull DownloadStatus state) {
        return TERMINAL_STATES.contains(state);
    }

    public Set<DownloadStatus> getValidNextStates(@NonNull DownloadStatus currentState) {
        Set<DownloadStatus> states = validTransitions.get(currentState);
        return states != null ? EnumSet.copyOf(states) : EnumSet.noneOf(DownloadStatus.class);
    }
}
