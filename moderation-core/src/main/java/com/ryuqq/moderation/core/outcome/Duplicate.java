package com.ryuqq.moderation.core.outcome;

import com.ryuqq.moderation.core.model.TaskId;
import com.ryuqq.moderation.core.statemachine.ModerationStatus;

/**
 * 이미 종료된 Task의 재배달.
 *
 * <p>at-least-once 배달로 인해 같은 TaskId가 다시 도착한 경우이며, 어떤 변경도 하지 않고 ACK만 합니다.</p>
 *
 * @param taskId Task ID
 * @param existingStatus Result Store에 이미 기록된 종료 상태
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public record Duplicate(
    TaskId taskId,
    ModerationStatus existingStatus
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException taskId가 null이거나 existingStatus가 종료 상태가 아닌 경우
     */
    public Duplicate {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (existingStatus == null || !existingStatus.isTerminal()) {
            throw new IllegalArgumentException("existingStatus must be terminal (current: " + existingStatus + ")");
        }
    }
}
