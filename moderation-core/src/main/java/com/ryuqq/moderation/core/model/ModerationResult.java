package com.ryuqq.moderation.core.model;

import com.ryuqq.moderation.core.statemachine.ModerationStatus;
import com.ryuqq.moderation.core.statemachine.StatusTransition;

import java.time.Instant;

/**
 * Task 하나의 모더레이션 결과 레코드 (Result Store의 행 하나).
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>PENDING 레코드는 isViolation, probability, errorMessage, processedAt이 모두 null</li>
 *   <li>COMPLETED 레코드는 isViolation, probability, processedAt이 채워짐</li>
 *   <li>FAILED 레코드는 errorMessage, processedAt이 채워짐</li>
 *   <li>processedAt은 종료 상태로 전이될 때 단 한 번 기록됨</li>
 * </ul>
 *
 * <p>레코드 자체는 불변이며, {@link #complete(Prediction, Instant)} 및
 * {@link #fail(String, Instant)}는 {@link StatusTransition}으로 검증한 뒤 새 인스턴스를 반환합니다.</p>
 *
 * @param taskId Task ID
 * @param itemId 아이템 ID
 * @param status 상태
 * @param isViolation 위반 여부 (완료 전 null)
 * @param probability 위반 확률 (완료 전 null)
 * @param errorMessage 실패 메시지 (실패 전 null)
 * @param createdAt 생성 시각
 * @param processedAt 종료 시각 (종료 전 null)
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public record ModerationResult(
    TaskId taskId,
    long itemId,
    ModerationStatus status,
    Boolean isViolation,
    Double probability,
    String errorMessage,
    Instant createdAt,
    Instant processedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드 누락 또는 상태별 불변식 위반 시
     */
    public ModerationResult {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        if (status.isTerminal() && processedAt == null) {
            throw new IllegalArgumentException("processedAt is required for terminal status " + status);
        }
        if (!status.isTerminal() && processedAt != null) {
            throw new IllegalArgumentException("processedAt must be null while " + status);
        }
        if (status == ModerationStatus.COMPLETED && (isViolation == null || probability == null)) {
            throw new IllegalArgumentException("isViolation and probability are required for COMPLETED");
        }
        if (probability != null && (probability < 0.0 || probability > 1.0)) {
            throw new IllegalArgumentException("probability must be between 0.0 and 1.0 (current: " + probability + ")");
        }
    }

    /**
     * PENDING 레코드 생성.
     *
     * @param taskId Task ID
     * @param itemId 아이템 ID
     * @param createdAt 생성 시각
     * @return PENDING 상태의 ModerationResult
     */
    public static ModerationResult pending(TaskId taskId, long itemId, Instant createdAt) {
        return new ModerationResult(taskId, itemId, ModerationStatus.PENDING, null, null, null, createdAt, null);
    }

    /**
     * COMPLETED로 전이한 새 레코드 반환.
     *
     * @param prediction 추론 결과
     * @param processedAt 처리 시각
     * @return COMPLETED 상태의 ModerationResult
     * @throws IllegalStateException 이미 종료 상태인 경우
     */
    public ModerationResult complete(Prediction prediction, Instant processedAt) {
        if (prediction == null) {
            throw new IllegalArgumentException("prediction cannot be null");
        }
        StatusTransition.validate(status, ModerationStatus.COMPLETED);
        return new ModerationResult(taskId, itemId, ModerationStatus.COMPLETED,
            prediction.violation(), prediction.probability(), null, createdAt, processedAt);
    }

    /**
     * FAILED로 전이한 새 레코드 반환.
     *
     * @param errorMessage 실패 메시지
     * @param processedAt 처리 시각
     * @return FAILED 상태의 ModerationResult
     * @throws IllegalStateException 이미 종료 상태인 경우
     */
    public ModerationResult fail(String errorMessage, Instant processedAt) {
        if (errorMessage == null || errorMessage.isBlank()) {
            throw new IllegalArgumentException("errorMessage cannot be null or blank");
        }
        StatusTransition.validate(status, ModerationStatus.FAILED);
        return new ModerationResult(taskId, itemId, ModerationStatus.FAILED,
            null, null, errorMessage, createdAt, processedAt);
    }

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED 또는 FAILED이면 true
     */
    public boolean isTerminal() {
        return status.isTerminal();
    }
}
