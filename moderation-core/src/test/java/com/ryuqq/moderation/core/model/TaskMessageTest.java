package com.ryuqq.moderation.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TaskMessage 테스트.
 *
 * @author Moderation Team
 * @since 1.0.0
 */
class TaskMessageTest {

    private static final Instant ENQUEUED_AT = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void first_CreatesMessageWithZeroRetryCount() {
        // When
        TaskMessage message = TaskMessage.first(TaskId.of(1L), 10L, ENQUEUED_AT);

        // Then
        assertEquals(0, message.retryCount());
        assertNull(message.lastError());
        assertEquals(ENQUEUED_AT, message.enqueuedAt());
    }

    @Test
    void nextRetry_IncrementsRetryCountByExactlyOne() {
        // Given
        TaskMessage message = TaskMessage.first(TaskId.of(1L), 10L, ENQUEUED_AT);

        // When
        TaskMessage retried = message.nextRetry("model unavailable").nextRetry("model unavailable again");

        // Then
        assertEquals(2, retried.retryCount());
        assertEquals("model unavailable again", retried.lastError());
        assertEquals(message.taskId(), retried.taskId());
        assertEquals(message.itemId(), retried.itemId());
        assertEquals(ENQUEUED_AT, retried.enqueuedAt());
        assertEquals(0, message.retryCount());
    }

    @Test
    void resetForReplay_ClearsRetryCountAndLastError() {
        // Given
        TaskMessage exhausted = new TaskMessage(TaskId.of(5L), 10L, ENQUEUED_AT, 3, "timeout");

        // When
        TaskMessage replay = exhausted.resetForReplay();

        // Then
        assertEquals(0, replay.retryCount());
        assertNull(replay.lastError());
        assertEquals(TaskId.of(5L), replay.taskId());
    }

    @Test
    void constructor_NegativeRetryCount_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new TaskMessage(TaskId.of(1L), 10L, ENQUEUED_AT, -1, null)
        );
        assertTrue(exception.getMessage().contains("retryCount must be non-negative"));
    }

    @Test
    void constructor_NonPositiveItemId_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> TaskMessage.first(TaskId.of(1L), 0L, ENQUEUED_AT)
        );
        assertTrue(exception.getMessage().contains("itemId must be positive"));
    }

    @Test
    void constructor_NullTaskId_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> TaskMessage.first(null, 10L, ENQUEUED_AT));
    }
}
