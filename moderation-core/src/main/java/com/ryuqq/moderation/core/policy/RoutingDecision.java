package com.ryuqq.moderation.core.policy;

import com.ryuqq.moderation.core.exception.ErrorType;
import com.ryuqq.moderation.core.model.FailureType;

import java.time.Duration;

/**
 * {@link RetryPolicy}가 내린 메시지 라우팅 결정.
 *
 * <ul>
 *   <li>{@link Acknowledge}: 원본 메시지 ACK</li>
 *   <li>{@link RetryWithDelay}: 지연 재시도 토픽으로 재게시 후 ACK</li>
 *   <li>{@link DeadLetter}: 결과를 FAILED로 기록하고 dead-letter 토픽으로 발행 후 ACK</li>
 * </ul>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public sealed interface RoutingDecision
    permits RoutingDecision.Acknowledge, RoutingDecision.RetryWithDelay, RoutingDecision.DeadLetter {

    /**
     * 처리 완료 또는 중복 배달. 추가 라우팅 없음.
     */
    record Acknowledge() implements RoutingDecision {
    }

    /**
     * 지연 재시도.
     *
     * @param nextRetryCount 재게시될 메시지의 retryCount
     * @param delay 재게시 지연
     * @param reason 재시도 사유 (메시지의 lastError로 기록)
     */
    record RetryWithDelay(int nextRetryCount, Duration delay, String reason) implements RoutingDecision {

        public RetryWithDelay {
            if (nextRetryCount <= 0) {
                throw new IllegalArgumentException(
                    "nextRetryCount must be positive (current: " + nextRetryCount + ")");
            }
            if (delay == null || delay.isNegative()) {
                throw new IllegalArgumentException("delay cannot be null or negative (current: " + delay + ")");
            }
            if (reason == null) {
                throw new IllegalArgumentException("reason cannot be null");
            }
        }
    }

    /**
     * Dead-letter 라우팅.
     *
     * @param failureType 영구 실패 또는 재시도 소진
     * @param errorCode 오류 유형
     * @param reason 실패 사유 (Result Store의 errorMessage로 기록)
     */
    record DeadLetter(FailureType failureType, ErrorType errorCode, String reason) implements RoutingDecision {

        public DeadLetter {
            if (failureType == null) {
                throw new IllegalArgumentException("failureType cannot be null");
            }
            if (errorCode == null) {
                throw new IllegalArgumentException("errorCode cannot be null");
            }
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("reason cannot be null or blank");
            }
        }
    }
}
