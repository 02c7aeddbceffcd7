package com.ryuqq.moderation.core.policy;

import com.ryuqq.moderation.core.exception.ErrorType;
import com.ryuqq.moderation.core.model.FailureType;
import com.ryuqq.moderation.core.outcome.Duplicate;
import com.ryuqq.moderation.core.outcome.Fail;
import com.ryuqq.moderation.core.outcome.Ok;
import com.ryuqq.moderation.core.outcome.Outcome;
import com.ryuqq.moderation.core.outcome.Retry;

/**
 * 재시도 / Dead-letter 정책.
 *
 * <p>Outcome과 현재 retryCount만으로 라우팅을 결정하는 순수 함수입니다.
 * 상태를 갖지 않으므로 모든 Worker가 하나의 인스턴스를 공유합니다.</p>
 *
 * <p><strong>결정 규칙:</strong></p>
 * <ul>
 *   <li>Ok, Duplicate → ACK</li>
 *   <li>Fail → retryCount와 무관하게 dead-letter (PERMANENT)</li>
 *   <li>Retry, retryCount &lt; maxRetries → retryCount + 1로 지연 재게시</li>
 *   <li>Retry, retryCount ≥ maxRetries → dead-letter (EXHAUSTED_RETRIES)</li>
 * </ul>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public final class RetryPolicy {

    /**
     * 기본 최대 재시도 횟수.
     */
    public static final int DEFAULT_MAX_RETRIES = 3;

    private final int maxRetries;
    private final BackoffCalculator backoff;

    /**
     * 기본 설정 (maxRetries=3, 5초 기반 지수 백오프).
     */
    public RetryPolicy() {
        this(DEFAULT_MAX_RETRIES, new BackoffCalculator());
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param maxRetries 최대 재시도 횟수 (0 이상)
     * @param backoff 백오프 계산기
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryPolicy(int maxRetries, BackoffCalculator backoff) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative (current: " + maxRetries + ")");
        }
        if (backoff == null) {
            throw new IllegalArgumentException("backoff cannot be null");
        }
        this.maxRetries = maxRetries;
        this.backoff = backoff;
    }

    /**
     * 라우팅 결정.
     *
     * @param outcome 처리 결과
     * @param retryCount 처리한 메시지의 retryCount
     * @return 라우팅 결정
     * @throws IllegalArgumentException outcome이 null이거나 retryCount가 음수인 경우
     */
    public RoutingDecision decide(Outcome outcome, int retryCount) {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be non-negative (current: " + retryCount + ")");
        }

        if (outcome instanceof Ok || outcome instanceof Duplicate) {
            return new RoutingDecision.Acknowledge();
        }

        if (outcome instanceof Fail fail) {
            return new RoutingDecision.DeadLetter(FailureType.PERMANENT, fail.errorType(), fail.reason());
        }

        Retry retry = (Retry) outcome;
        if (retryCount >= maxRetries) {
            return new RoutingDecision.DeadLetter(
                FailureType.EXHAUSTED_RETRIES,
                ErrorType.EXHAUSTED_RETRIES,
                "Max retries exceeded (" + maxRetries + "): " + retry.reason()
            );
        }

        int nextRetryCount = retryCount + 1;
        return new RoutingDecision.RetryWithDelay(nextRetryCount, backoff.calculate(nextRetryCount), retry.reason());
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public BackoffCalculator getBackoff() {
        return backoff;
    }
}
