package com.ryuqq.moderation.core.statemachine;

/**
 * Worker가 Task 하나를 처리하는 동안 거치는 상태.
 *
 * <p><strong>정상 경로:</strong></p>
 * <pre>
 * IDLE → FETCHED → CACHE_CHECKED ─┬─► CACHE_HIT ─┬─► PERSISTED → ACKED
 *                                 └─► INFERRING ─┘
 * </pre>
 *
 * <p><strong>실패 경로:</strong></p>
 * <pre>
 * (비종료 상태) ─► RETRYING ─► ACKED          (지연 재시도 토픽으로 재게시 후 원본 ACK)
 * (비종료 상태) ─► DEAD_LETTERED               (dead-letter 발행 후 원본 ACK)
 * (비종료 상태) ─► RELEASED                    (ACK 없이 반환, 버스가 재배달)
 * FETCHED ─► ACKED                             (이미 종료된 Task의 중복 배달)
 * </pre>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public enum WorkerState {

    /** 메시지 대기 중. */
    IDLE,

    /** 메시지 수신 및 디코딩 완료, 멱등성 검사 단계. */
    FETCHED,

    /** 아이템 로드 및 캐시 조회 완료. */
    CACHE_CHECKED,

    /** 캐시 적중, 모델 호출 생략. */
    CACHE_HIT,

    /** 캐시 미스, 모델 추론 중. */
    INFERRING,

    /** Result Store에 COMPLETED 기록됨. */
    PERSISTED,

    /** 지연 재시도 토픽으로 재게시 중. */
    RETRYING,

    /** 원본 메시지 ACK 완료 (종료). */
    ACKED,

    /** dead-letter 토픽으로 라우팅됨 (종료). */
    DEAD_LETTERED,

    /** ACK 없이 반환됨, 버스의 재배달에 맡김 (종료). */
    RELEASED;

    /**
     * 종료 상태인지 확인.
     *
     * @return ACKED, DEAD_LETTERED, RELEASED인 경우 true
     */
    public boolean isTerminal() {
        return this == ACKED || this == DEAD_LETTERED || this == RELEASED;
    }
}
