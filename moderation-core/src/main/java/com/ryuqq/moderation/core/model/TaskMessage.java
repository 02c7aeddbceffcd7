package com.ryuqq.moderation.core.model;

import java.time.Instant;

/**
 * 메시지 버스로 전달되는 모더레이션 작업 메시지.
 *
 * <p>Intake가 Result Store에 PENDING 레코드를 만든 뒤 발행하며, Worker가 소비합니다.
 * 발행 후에는 불변이며, 재시도 시 {@link #nextRetry(String)}로 retryCount만 1 증가한
 * 새 인스턴스를 만듭니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>taskId:</strong> 멱등성 키</li>
 *   <li><strong>itemId:</strong> 검사 대상 아이템</li>
 *   <li><strong>enqueuedAt:</strong> 최초 발행 시각 (재시도 시에도 유지)</li>
 *   <li><strong>retryCount:</strong> 재게시 횟수 (0 이상)</li>
 *   <li><strong>lastError:</strong> 직전 실패 사유 (최초 발행 시 null)</li>
 * </ul>
 *
 * @param taskId Task ID
 * @param itemId 아이템 ID (양수)
 * @param enqueuedAt 최초 발행 시각
 * @param retryCount 재시도 횟수 (0 이상)
 * @param lastError 직전 실패 사유 (null 허용)
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public record TaskMessage(
    TaskId taskId,
    long itemId,
    Instant enqueuedAt,
    int retryCount,
    String lastError
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 범위를 벗어난 경우
     */
    public TaskMessage {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (itemId <= 0) {
            throw new IllegalArgumentException("itemId must be positive (current: " + itemId + ")");
        }
        if (enqueuedAt == null) {
            throw new IllegalArgumentException("enqueuedAt cannot be null");
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be non-negative (current: " + retryCount + ")");
        }
        // lastError는 null 허용
    }

    /**
     * 최초 발행용 메시지 생성 (retryCount = 0).
     *
     * @param taskId Task ID
     * @param itemId 아이템 ID
     * @param enqueuedAt 발행 시각
     * @return TaskMessage 인스턴스
     */
    public static TaskMessage first(TaskId taskId, long itemId, Instant enqueuedAt) {
        return new TaskMessage(taskId, itemId, enqueuedAt, 0, null);
    }

    /**
     * 재시도용 메시지 생성.
     *
     * <p>retryCount가 정확히 1 증가하며, 나머지 식별 정보는 유지됩니다.</p>
     *
     * @param error 이번 실패 사유
     * @return retryCount + 1 인 새 TaskMessage
     */
    public TaskMessage nextRetry(String error) {
        return new TaskMessage(taskId, itemId, enqueuedAt, retryCount + 1, error);
    }

    /**
     * 수동 재처리(replay)용 메시지 생성 (retryCount = 0, lastError 제거).
     *
     * @return retryCount가 0으로 초기화된 새 TaskMessage
     */
    public TaskMessage resetForReplay() {
        return new TaskMessage(taskId, itemId, enqueuedAt, 0, null);
    }
}
