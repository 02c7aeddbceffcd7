package com.ryuqq.moderation.core.outcome;

import com.ryuqq.moderation.core.exception.ErrorType;

/**
 * 재시도 가능한 일시적 실패.
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>모델 일시 사용 불가</li>
 *   <li>Result Store / 메시지 버스 연결 실패</li>
 *   <li>분류되지 않은 런타임 오류</li>
 * </ul>
 *
 * @param errorType 오류 유형 (재시도 가능 유형이어야 함)
 * @param reason 재시도 사유
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public record Retry(
    ErrorType errorType,
    String reason
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public Retry {
        if (errorType == null || !errorType.isRetryable()) {
            throw new IllegalArgumentException("errorType must be retryable (current: " + errorType + ")");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }
}
