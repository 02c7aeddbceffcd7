package com.ryuqq.moderation.core.statemachine;

/**
 * Result Store 레코드의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>PENDING → COMPLETED (추론 성공)</li>
 *   <li>PENDING → FAILED (영구 실패 또는 재시도 소진)</li>
 *   <li><strong>종료 상태는 불변 (불변식)</strong></li>
 * </ul>
 *
 * <pre>
 * PENDING
 *    │
 *    ├─► COMPLETED
 *    │
 *    └─► FAILED
 *
 * 금지된 전이:
 * - COMPLETED → * ❌
 * - FAILED → * ❌
 * </pre>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public enum ModerationStatus {

    /**
     * 작업 대기 중 (Task 발행 전에 생성됨).
     */
    PENDING("pending"),

    /**
     * 완료 (isViolation, probability 기록됨).
     */
    COMPLETED("completed"),

    /**
     * 실패 (errorMessage 기록됨).
     */
    FAILED("failed");

    private final String wireName;

    ModerationStatus(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * 외부 표현 (소문자) 조회.
     *
     * @return "pending", "completed", "failed" 중 하나
     */
    public String wireName() {
        return wireName;
    }

    /**
     * 외부 표현으로부터 상태 변환.
     *
     * @param wireName 소문자 상태명
     * @return ModerationStatus
     * @throws IllegalArgumentException 알 수 없는 상태명인 경우
     */
    public static ModerationStatus fromWireName(String wireName) {
        for (ModerationStatus status : values()) {
            if (status.wireName.equals(wireName)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown moderation status: " + wireName);
    }
}
