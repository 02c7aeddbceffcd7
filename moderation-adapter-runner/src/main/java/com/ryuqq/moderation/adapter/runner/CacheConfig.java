package com.ryuqq.moderation.adapter.runner;

import java.time.Duration;

/**
 * 예측 캐시 설정 (불변 record).
 *
 * <p>기본값: ttl=15분, maxEntries=10000, enabled=true.
 * enabled=false이면 모든 조회가 miss가 되어 매번 모델을 호출합니다.</p>
 *
 * @author Moderation Team
 * @since 1.0.0
 * @param ttl 엔트리 유효 시간 (양수여야 함)
 * @param maxEntries 최대 엔트리 수 (1 이상이어야 함)
 * @param enabled 캐시 사용 여부
 */
public record CacheConfig(Duration ttl, int maxEntries, boolean enabled) {

    public CacheConfig() {
        this(Duration.ofMinutes(15), 10_000, true);
    }

    public CacheConfig {
        if (ttl == null) {
            throw new IllegalArgumentException("ttl cannot be null");
        }
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive (current: " + ttl + ")");
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive (current: " + maxEntries + ")");
        }
    }

    public CacheConfig withTtl(Duration ttl) {
        return new CacheConfig(ttl, maxEntries, enabled);
    }

    public CacheConfig withMaxEntries(int maxEntries) {
        return new CacheConfig(ttl, maxEntries, enabled);
    }

    public CacheConfig withEnabled(boolean enabled) {
        return new CacheConfig(ttl, maxEntries, enabled);
    }
}
