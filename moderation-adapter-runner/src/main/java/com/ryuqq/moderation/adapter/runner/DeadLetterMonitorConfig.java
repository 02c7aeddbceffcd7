package com.ryuqq.moderation.adapter.runner;

import java.time.Duration;

/**
 * DeadLetterMonitor 설정 (불변 record).
 *
 * @author Moderation Team
 * @since 1.0.0
 * @param historySize 보관할 최근 봉투 수 (1 이상이어야 함, 기본 1000)
 * @param pollTimeout dead-letter 토픽 폴링 대기 시간 (양수여야 함, 기본 1초)
 */
public record DeadLetterMonitorConfig(int historySize, Duration pollTimeout) {

    public DeadLetterMonitorConfig() {
        this(1000, Duration.ofSeconds(1));
    }

    public DeadLetterMonitorConfig {
        if (historySize <= 0) {
            throw new IllegalArgumentException("historySize must be positive (current: " + historySize + ")");
        }
        if (pollTimeout == null) {
            throw new IllegalArgumentException("pollTimeout cannot be null");
        }
        if (pollTimeout.isZero() || pollTimeout.isNegative()) {
            throw new IllegalArgumentException("pollTimeout must be positive (current: " + pollTimeout + ")");
        }
    }

    public DeadLetterMonitorConfig withHistorySize(int historySize) {
        return new DeadLetterMonitorConfig(historySize, pollTimeout);
    }

    public DeadLetterMonitorConfig withPollTimeout(Duration pollTimeout) {
        return new DeadLetterMonitorConfig(historySize, pollTimeout);
    }
}
