package com.ryuqq.moderation.core.policy;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential Backoff 계산기.
 *
 * <p>재시도 간격을 재시도 횟수에 따라 지수적으로 증가시킵니다.
 * Jitter는 선택 사항이며 기본값은 0 (결정적 지연)입니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * 2^retryCount + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=5000ms, jitterFactor=0.0):</strong></p>
 * <ul>
 *   <li>retryCount=1: 10000ms (2^1 * base)</li>
 *   <li>retryCount=2: 20000ms (2^2 * base)</li>
 *   <li>retryCount=3: 40000ms (2^3 * base)</li>
 *   <li>retryCount=10: 5120000ms (capped at maxDelay=300000ms)</li>
 * </ul>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: baseDelay=5000ms, maxDelay=300000ms, jitterFactor=0.0</p>
     */
    public BackoffCalculator() {
        this(5000, 300000, 0.0);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 양수여야 함)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }

        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
    }

    /**
     * 재게시 지연 시간 계산.
     *
     * @param retryCount 재게시될 메시지의 retryCount (1부터 시작)
     * @return 재게시 전 대기 시간
     * @throws IllegalArgumentException retryCount가 양수가 아닌 경우
     */
    public Duration calculate(int retryCount) {
        if (retryCount <= 0) {
            throw new IllegalArgumentException(
                "retryCount must be positive (current: " + retryCount + ")"
            );
        }

        // 1. 지수적 백오프 (shift overflow 방지)
        long exponential = retryCount >= 31
            ? maxDelayMs
            : Math.min(baseDelayMs * (1L << retryCount), maxDelayMs);

        // 2. Jitter 추가
        long jitter = jitterFactor == 0.0
            ? 0L
            : (long) (exponential * jitterFactor * ThreadLocalRandom.current().nextDouble());

        // 3. 최대값 제한
        return Duration.ofMillis(Math.min(exponential + jitter, maxDelayMs));
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
