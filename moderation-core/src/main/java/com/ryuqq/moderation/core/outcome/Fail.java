package com.ryuqq.moderation.core.outcome;

import com.ryuqq.moderation.core.exception.ErrorType;

/**
 * 영구적 실패 (재시도 불가).
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>참조된 아이템이 존재하지 않음</li>
 *   <li>메시지 스키마 오류</li>
 *   <li>Task에 대응하는 Result Store 레코드 없음</li>
 * </ul>
 *
 * @param errorType 오류 유형 (재시도 불가 유형이어야 함)
 * @param reason 실패 사유
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public record Fail(
    ErrorType errorType,
    String reason
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public Fail {
        if (errorType == null || errorType.isRetryable()) {
            throw new IllegalArgumentException("errorType must not be retryable (current: " + errorType + ")");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }
}
