package com.ryuqq.moderation.core.outcome;

import com.ryuqq.moderation.core.exception.ErrorType;
import com.ryuqq.moderation.core.model.Prediction;
import com.ryuqq.moderation.core.model.TaskId;
import com.ryuqq.moderation.core.statemachine.ModerationStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outcome 계층 테스트.
 *
 * @author Moderation Team
 * @since 1.0.0
 */
class OutcomeTest {

    @Test
    void typeChecks_MatchConcreteType() {
        Outcome ok = new Ok(TaskId.of(1L), Prediction.of(true, 0.7), true);
        Outcome duplicate = new Duplicate(TaskId.of(1L), ModerationStatus.FAILED);
        Outcome retry = new Retry(ErrorType.INFRASTRUCTURE, "store unreachable");
        Outcome fail = new Fail(ErrorType.MALFORMED_MESSAGE, "bad json");

        assertTrue(ok.isOk());
        assertTrue(duplicate.isDuplicate());
        assertTrue(retry.isRetry());
        assertTrue(fail.isFail());
        assertFalse(ok.isRetry());
        assertFalse(fail.isOk());
    }

    @Test
    void retry_NonRetryableErrorType_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new Retry(ErrorType.ITEM_NOT_FOUND, "missing")
        );
        assertTrue(exception.getMessage().contains("errorType must be retryable"));
    }

    @Test
    void fail_RetryableErrorType_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Fail(ErrorType.MODEL_UNAVAILABLE, "down"));
    }

    @Test
    void duplicate_PendingStatus_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new Duplicate(TaskId.of(1L), ModerationStatus.PENDING)
        );
        assertTrue(exception.getMessage().contains("existingStatus must be terminal"));
    }

    @Test
    void retry_BlankReason_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new Retry(ErrorType.UNEXPECTED, " ")
        );
        assertTrue(exception.getMessage().contains("reason cannot be null or blank"));
    }
}
