package com.ryuqq.moderation.core.model;

import com.ryuqq.moderation.core.exception.ErrorType;

import java.time.Instant;

/**
 * Dead-letter 토픽으로 발행되는 봉투.
 *
 * <p>원본 TaskMessage를 그대로 감싸며, 실패 사유와 dead-letter 시점의 retryCount를 함께 기록합니다.
 * DLQ Monitor는 이 봉투를 조회하고, 명시적 요청이 있을 때만 원본 메시지를 재게시합니다.</p>
 *
 * @param originalMessage 원본 Task 메시지
 * @param failureReason 실패 사유
 * @param failureType 분류 (PERMANENT, EXHAUSTED_RETRIES)
 * @param errorCode 마지막 실패의 오류 유형
 * @param retryCountAtFailure dead-letter 시점의 retryCount
 * @param deadLetteredAt dead-letter 시각
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public record DeadLetterEnvelope(
    TaskMessage originalMessage,
    String failureReason,
    FailureType failureType,
    ErrorType errorCode,
    int retryCountAtFailure,
    Instant deadLetteredAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 retryCountAtFailure가 음수인 경우
     */
    public DeadLetterEnvelope {
        if (originalMessage == null) {
            throw new IllegalArgumentException("originalMessage cannot be null");
        }
        if (failureReason == null || failureReason.isBlank()) {
            throw new IllegalArgumentException("failureReason cannot be null or blank");
        }
        if (failureType == null) {
            throw new IllegalArgumentException("failureType cannot be null");
        }
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        if (retryCountAtFailure < 0) {
            throw new IllegalArgumentException(
                "retryCountAtFailure must be non-negative (current: " + retryCountAtFailure + ")");
        }
        if (deadLetteredAt == null) {
            throw new IllegalArgumentException("deadLetteredAt cannot be null");
        }
    }

    /**
     * 원본 메시지의 retryCount를 그대로 사용해 봉투 생성.
     *
     * @param message 원본 메시지
     * @param failureReason 실패 사유
     * @param failureType 분류
     * @param errorCode 오류 유형
     * @param deadLetteredAt dead-letter 시각
     * @return DeadLetterEnvelope
     */
    public static DeadLetterEnvelope of(TaskMessage message, String failureReason, FailureType failureType,
                                        ErrorType errorCode, Instant deadLetteredAt) {
        if (message == null) {
            throw new IllegalArgumentException("originalMessage cannot be null");
        }
        return new DeadLetterEnvelope(message, failureReason, failureType, errorCode,
            message.retryCount(), deadLetteredAt);
    }

    /**
     * 원본 Task ID 조회.
     *
     * @return Task ID
     */
    public TaskId taskId() {
        return originalMessage.taskId();
    }
}
