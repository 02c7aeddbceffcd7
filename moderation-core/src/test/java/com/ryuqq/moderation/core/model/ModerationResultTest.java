package com.ryuqq.moderation.core.model;

import com.ryuqq.moderation.core.statemachine.ModerationStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ModerationResult 테스트.
 *
 * @author Moderation Team
 * @since 1.0.0
 */
class ModerationResultTest {

    private static final Instant CREATED = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant PROCESSED = Instant.parse("2024-01-01T00:00:05Z");

    @Test
    void pending_HasNoOutcomeFields() {
        // When
        ModerationResult result = ModerationResult.pending(TaskId.of(1L), 10L, CREATED);

        // Then
        assertEquals(ModerationStatus.PENDING, result.status());
        assertNull(result.isViolation());
        assertNull(result.probability());
        assertNull(result.errorMessage());
        assertNull(result.processedAt());
        assertFalse(result.isTerminal());
    }

    @Test
    void complete_FromPending_SetsPredictionAndProcessedAt() {
        // Given
        ModerationResult pending = ModerationResult.pending(TaskId.of(1L), 10L, CREATED);

        // When
        ModerationResult completed = pending.complete(Prediction.of(true, 0.8), PROCESSED);

        // Then
        assertEquals(ModerationStatus.COMPLETED, completed.status());
        assertEquals(Boolean.TRUE, completed.isViolation());
        assertEquals(0.8, completed.probability());
        assertEquals(PROCESSED, completed.processedAt());
        assertEquals(CREATED, completed.createdAt());
    }

    @Test
    void fail_FromPending_SetsErrorMessage() {
        // Given
        ModerationResult pending = ModerationResult.pending(TaskId.of(1L), 10L, CREATED);

        // When
        ModerationResult failed = pending.fail("Item not found", PROCESSED);

        // Then
        assertEquals(ModerationStatus.FAILED, failed.status());
        assertEquals("Item not found", failed.errorMessage());
        assertNull(failed.isViolation());
        assertTrue(failed.isTerminal());
    }

    @Test
    void complete_FromCompleted_ThrowsIllegalStateException() {
        // Given
        ModerationResult completed = ModerationResult.pending(TaskId.of(1L), 10L, CREATED)
            .complete(Prediction.of(false, 0.1), PROCESSED);

        // When & Then
        assertThrows(IllegalStateException.class,
            () -> completed.complete(Prediction.of(true, 0.9), PROCESSED));
    }

    @Test
    void fail_FromCompleted_ThrowsIllegalStateException() {
        // Given
        ModerationResult completed = ModerationResult.pending(TaskId.of(1L), 10L, CREATED)
            .complete(Prediction.of(false, 0.1), PROCESSED);

        // When & Then
        assertThrows(IllegalStateException.class, () -> completed.fail("late failure", PROCESSED));
    }

    @Test
    void constructor_TerminalWithoutProcessedAt_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> new ModerationResult(
            TaskId.of(1L), 10L, ModerationStatus.FAILED, null, null, "x", CREATED, null));
    }

    @Test
    void constructor_ProbabilityOutOfRange_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class, () -> new ModerationResult(
            TaskId.of(1L), 10L, ModerationStatus.COMPLETED, true, 1.5, null, CREATED, PROCESSED));
        assertTrue(exception.getMessage().contains("probability must be between 0.0 and 1.0"));
    }
}
