package com.ryuqq.moderation.core.statemachine;

import org.junit.jupiter.api.Test;

import static com.ryuqq.moderation.core.statemachine.ModerationStatus.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * StatusTransition 테스트.
 *
 * <ul>
 *   <li>PENDING → COMPLETED, PENDING → FAILED 허용</li>
 *   <li>종료 상태에서의 모든 전이는 IllegalStateException</li>
 * </ul>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
class StatusTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void validate_PendingToCompleted_Succeeds() {
        assertDoesNotThrow(() -> StatusTransition.validate(PENDING, COMPLETED));
    }

    @Test
    void validate_PendingToFailed_Succeeds() {
        assertDoesNotThrow(() -> StatusTransition.validate(PENDING, FAILED));
    }

    // ========== 종료 상태 전이 금지 ==========

    @Test
    void validate_CompletedToFailed_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StatusTransition.validate(COMPLETED, FAILED)
        );
        assertTrue(exception.getMessage().contains("Cannot transition from terminal state"));
    }

    @Test
    void validate_FailedToCompleted_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> StatusTransition.validate(FAILED, COMPLETED));
    }

    @Test
    void validate_CompletedToPending_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> StatusTransition.validate(COMPLETED, PENDING));
    }

    @Test
    void validate_PendingToPending_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StatusTransition.validate(PENDING, PENDING)
        );
        assertTrue(exception.getMessage().contains("Invalid state transition"));
    }

    @Test
    void validate_NullState_ThrowsIllegalArgumentException() {
        assertThrows(IllegalArgumentException.class, () -> StatusTransition.validate(null, COMPLETED));
    }

    // ========== wire name ==========

    @Test
    void fromWireName_KnownValue_ReturnsStatus() {
        assertEquals(COMPLETED, ModerationStatus.fromWireName("completed"));
        assertEquals("failed", FAILED.wireName());
    }
}
