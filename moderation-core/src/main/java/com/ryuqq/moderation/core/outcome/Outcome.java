package com.ryuqq.moderation.core.outcome;

/**
 * Task 처리 결과 분류.
 *
 * <p>Worker는 예외를 Task 경계 밖으로 던지지 않고, 모든 처리 결과를 Outcome으로 변환합니다.</p>
 * <ul>
 *   <li>{@link Ok}: 추론 결과가 Result Store에 기록됨</li>
 *   <li>{@link Duplicate}: 이미 종료된 Task의 재배달 (no-op)</li>
 *   <li>{@link Retry}: 일시적 실패, 재시도 가능</li>
 *   <li>{@link Fail}: 영구적 실패, 재시도 불가</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 RetryPolicy가 모든 케이스를 처리하도록 강제합니다.</p>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Duplicate, Retry, Fail {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 중복 배달인지 확인.
     *
     * @return 중복 여부
     */
    default boolean isDuplicate() {
        return this instanceof Duplicate;
    }

    /**
     * 결과가 재시도 가능한지 확인.
     *
     * @return 재시도 가능 여부
     */
    default boolean isRetry() {
        return this instanceof Retry;
    }

    /**
     * 결과가 영구 실패인지 확인.
     *
     * @return 영구 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
