package com.github.deemusic.service.state;

import com.github.deemusic.exception.InvalidTransitionException;
import com.github.deemusic.model.DownloadStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DownloadStateMachine")
class DownloadStateMachineTest {

    private DownloadStateMachine stateMachine;
    private static final String ITEM_ID = "album-302127";

    @BeforeEach
    void setUp() {
        stateMachine = new DownloadStateMachine();
    }

    @Nested
    @DisplayName("isValidTransition")
    class IsValidTransitionTests {

        @Test
        @DisplayName("same state should always be valid (idempotent)")
        void sameStateShouldAlwaysBeValid() {
            for (DownloadStatus status : DownloadStatus.values()) {
                assertTrue(stateMachine.isValidTransition(status, status),
                        "Same state transition should be valid for " + status);
            }
        }

        @Test
        @DisplayName("PENDING can be claimed")
        void pendingCanBeClaimed() {
            assertTrue(stateMachine.isValidTransition(DownloadStatus.PENDING, DownloadStatus.DOWNLOADING));
        }

        @Test
        @DisplayName("PENDING cannot complete without being downloaded")
        void pendingCannotComplete() {
            assertFalse(stateMachine.isValidTransition(DownloadStatus.PENDING, DownloadStatus.COMPLETED));
        }

        @Test
        @DisplayName("PENDING cannot be paused")
        void pendingCannotBePaused() {
            assertFalse(stateMachine.isValidTransition(DownloadStatus.PENDING, DownloadStatus.PAUSED));
        }

        @ParameterizedTest
        @EnumSource(value = DownloadStatus.class, names = {"COMPLETED", "FAILED", "PENDING", "PAUSED"})
        @DisplayName("DOWNLOADING can settle in any other status")
        void downloadingCanSettle(DownloadStatus target) {
            assertTrue(stateMachine.isValidTransition(DownloadStatus.DOWNLOADING, target));
        }

        @Test
        @DisplayName("PAUSED resumes to PENDING, never straight to DOWNLOADING")
        void pausedResumesToPending() {
            assertTrue(stateMachine.isValidTransition(DownloadStatus.PAUSED, DownloadStatus.PENDING));
            assertFalse(stateMachine.isValidTransition(DownloadStatus.PAUSED, DownloadStatus.DOWNLOADING));
        }

        @ParameterizedTest
        @EnumSource(value = DownloadStatus.class, names = {"COMPLETED", "FAILED"})
        @DisplayName("terminal states only leave through an explicit retry")
        void terminalStatesOnlyRetry(DownloadStatus terminal) {
            assertEquals(Set.of(DownloadStatus.PENDING), stateMachine.getValidNextStates(terminal));
        }
    }

    @Nested
    @DisplayName("transition")
    class TransitionTests {

        @Test
        @DisplayName("should return new state for valid transition")
        void shouldReturnNewStateForValidTransition() {
            assertEquals(DownloadStatus.PAUSED,
                    stateMachine.transition(ITEM_ID, DownloadStatus.DOWNLOADING, DownloadStatus.PAUSED));
        }

        @Test
        @DisplayName("should keep current state for invalid transition")
        void shouldKeepCurrentStateForInvalidTransition() {
            assertEquals(DownloadStatus.COMPLETED,
                    stateMachine.transition(ITEM_ID, DownloadStatus.COMPLETED, DownloadStatus.DOWNLOADING));
        }
    }

    @Nested
    @DisplayName("requireAllowed")
    class RequireAllowedTests {

        @Test
        @DisplayName("pause should be rejected on a pending item")
        void pauseRejectedOnPending() {
            InvalidTransitionException ex = assertThrows(InvalidTransitionException.class,
                    () -> stateMachine.requireAllowed(ITEM_ID, DownloadStatus.PENDING, QueueOperation.PAUSE));

            assertEquals(ITEM_ID, ex.getItemId());
            assertEquals(DownloadStatus.PENDING, ex.getCurrentStatus());
        }

        @Test
        @DisplayName("pause should be rejected on a completed item")
        void pauseRejectedOnCompleted() {
            assertThrows(InvalidTransitionException.class,
                    () -> stateMachine.requireAllowed(ITEM_ID, DownloadStatus.COMPLETED, QueueOperation.PAUSE));
        }

        @Test
        @DisplayName("pause should be accepted on a downloading item")
        void pauseAcceptedOnDownloading() {
            assertDoesNotThrow(
                    () -> stateMachine.requireAllowed(ITEM_ID, DownloadStatus.DOWNLOADING, QueueOperation.PAUSE));
        }

        @ParameterizedTest
        @EnumSource(value = DownloadStatus.class, names = {"PENDING", "DOWNLOADING", "PAUSED"})
        @DisplayName("retry should be rejected until the item is completed or failed")
        void retryRejectedWhileActive(DownloadStatus status) {
            assertThrows(InvalidTransitionException.class,
                    () -> stateMachine.requireAllowed(ITEM_ID, status, QueueOperation.RETRY));
        }

        @ParameterizedTest
        @EnumSource(DownloadStatus.class)
        @DisplayName("remove should be accepted from every status")
        void removeAcceptedEverywhere(DownloadStatus status) {
            assertDoesNotThrow(() -> stateMachine.requireAllowed(ITEM_ID, status, QueueOperation.REMOVE));
        }

        @ParameterizedTest
        @EnumSource(value = DownloadStatus.class, names = {"COMPLETED", "FAILED"})
        @DisplayName("cancel should be rejected on settled items")
        void cancelRejectedOnSettled(DownloadStatus status) {
            assertThrows(InvalidTransitionException.class,
                    () -> stateMachine.requireAllowed(ITEM_ID, status, QueueOperation.CANCEL));
        }
    }

    @Nested
    @DisplayName("isTerminalState")
    class TerminalStateTests {

        @ParameterizedTest
        @EnumSource(value = DownloadStatus.class, names = {"COMPLETED", "FAILED"})
        @DisplayName("completed and failed are terminal")
        void terminal(DownloadStatus status) {
            assertTrue(stateMachine.isTerminalState(status));
        }

        @ParameterizedTest
        @EnumSource(value = DownloadStatus.class, names = {"PENDING", "DOWNLOADING", "PAUSED"})
        @DisplayName("other states are not terminal")
        void notTerminal(DownloadStatus status) {
            assertFalse(stateMachine.isTerminalState(status));
        }
    }
}
