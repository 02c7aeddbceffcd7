package com.ryuqq.moderation.adapter.runner;

import com.ryuqq.moderation.core.policy.BackoffCalculator;
import com.ryuqq.moderation.core.policy.RetryPolicy;

import java.time.Duration;

/**
 * WorkerPool 설정 (불변 record).
 *
 * <p>이 record는 WorkerPool과 ModerationWorker의 동작을 제어하는 설정값을 담고 있습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 동시 처리 스레드 수 (기본 4)</li>
 *   <li>pollTimeout: 작업 토픽 폴링 대기 시간 (기본 1초)</li>
 *   <li>maxRetries: 최대 재시도 횟수 (기본 3)</li>
 *   <li>retryBaseDelay: 백오프 기본 지연 (기본 5초, n번째 재시도는 base × 2^n)</li>
 *   <li>maxRetryDelay: 백오프 상한 (기본 5분)</li>
 *   <li>shutdownTimeout: 종료 시 진행 중 작업 대기 시간 (기본 30초)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>모델 추론이 느린 경우: concurrency 증가 (4 → 16)</li>
 *   <li>빠른 종료가 필요한 경우: pollTimeout 감소 (1초 → 200ms)</li>
 * </ul>
 *
 * @author Moderation Team
 * @since 1.0.0
 * @param concurrency 동시 처리 스레드 수 (1 이상이어야 함)
 * @param pollTimeout 폴링 대기 시간 (양수여야 함)
 * @param maxRetries 최대 재시도 횟수 (0 이상이어야 함)
 * @param retryBaseDelay 백오프 기본 지연 (양수여야 함)
 * @param maxRetryDelay 백오프 상한 (retryBaseDelay 이상이어야 함)
 * @param shutdownTimeout 종료 대기 시간 (양수여야 함)
 */
public record WorkerConfig(
    int concurrency,
    Duration pollTimeout,
    int maxRetries,
    Duration retryBaseDelay,
    Duration maxRetryDelay,
    Duration shutdownTimeout
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: concurrency=4, pollTimeout=1s, maxRetries=3, retryBaseDelay=5s,
     * maxRetryDelay=5m, shutdownTimeout=30s</p>
     */
    public WorkerConfig() {
        this(4, Duration.ofSeconds(1), RetryPolicy.DEFAULT_MAX_RETRIES, Duration.ofSeconds(5),
            Duration.ofMinutes(5), Duration.ofSeconds(30));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public WorkerConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        requirePositive("pollTimeout", pollTimeout);
        if (maxRetries < 0) {
            throw new IllegalArgumentException(
                "maxRetries must be non-negative (current: " + maxRetries + ")"
            );
        }
        requirePositive("retryBaseDelay", retryBaseDelay);
        requirePositive("maxRetryDelay", maxRetryDelay);
        if (maxRetryDelay.compareTo(retryBaseDelay) < 0) {
            throw new IllegalArgumentException(
                "maxRetryDelay must be >= retryBaseDelay (base: " + retryBaseDelay + ", max: " + maxRetryDelay + ")"
            );
        }
        requirePositive("shutdownTimeout", shutdownTimeout);
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive (current: " + value + ")");
        }
    }

    /**
     * 이 설정의 재시도 한도와 백오프로 RetryPolicy 생성.
     *
     * @return RetryPolicy (jitter 없음)
     */
    public RetryPolicy retryPolicy() {
        BackoffCalculator backoff = new BackoffCalculator(retryBaseDelay.toMillis(), maxRetryDelay.toMillis(), 0.0);
        return new RetryPolicy(maxRetries, backoff);
    }

    /**
     * concurrency만 변경한 새 인스턴스 생성.
     */
    public WorkerConfig withConcurrency(int concurrency) {
        return new WorkerConfig(concurrency, pollTimeout, maxRetries, retryBaseDelay, maxRetryDelay, shutdownTimeout);
    }

    /**
     * pollTimeout만 변경한 새 인스턴스 생성.
     */
    public WorkerConfig withPollTimeout(Duration pollTimeout) {
        return new WorkerConfig(concurrency, pollTimeout, maxRetries, retryBaseDelay, maxRetryDelay, shutdownTimeout);
    }

    /**
     * maxRetries만 변경한 새 인스턴스 생성.
     */
    public WorkerConfig withMaxRetries(int maxRetries) {
        return new WorkerConfig(concurrency, pollTimeout, maxRetries, retryBaseDelay, maxRetryDelay, shutdownTimeout);
    }

    /**
     * retryBaseDelay만 변경한 새 인스턴스 생성.
     */
    public WorkerConfig withRetryBaseDelay(Duration retryBaseDelay) {
        return new WorkerConfig(concurrency, pollTimeout, maxRetries, retryBaseDelay, maxRetryDelay, shutdownTimeout);
    }

    /**
     * maxRetryDelay만 변경한 새 인스턴스 생성.
     */
    public WorkerConfig withMaxRetryDelay(Duration maxRetryDelay) {
        return new WorkerConfig(concurrency, pollTimeout, maxRetries, retryBaseDelay, maxRetryDelay, shutdownTimeout);
    }

    /**
     * shutdownTimeout만 변경한 새 인스턴스 생성.
     */
    public WorkerConfig withShutdownTimeout(Duration shutdownTimeout) {
        return new WorkerConfig(concurrency, pollTimeout, maxRetries, retryBaseDelay, maxRetryDelay, shutdownTimeout);
    }
}
