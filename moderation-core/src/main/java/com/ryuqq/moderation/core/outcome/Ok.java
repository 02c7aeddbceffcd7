package com.ryuqq.moderation.core.outcome;

import com.ryuqq.moderation.core.model.Prediction;
import com.ryuqq.moderation.core.model.TaskId;

/**
 * 성공 결과.
 *
 * @param taskId Task ID
 * @param prediction 기록된 추론 결과
 * @param fromCache Prediction Cache에서 재사용했는지 여부
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public record Ok(
    TaskId taskId,
    Prediction prediction,
    boolean fromCache
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException taskId 또는 prediction이 null인 경우
     */
    public Ok {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (prediction == null) {
            throw new IllegalArgumentException("prediction cannot be null");
        }
    }
}
