package com.ryuqq.moderation.adapter.inmemory.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.ryuqq.moderation.core.model.Fingerprint;
import com.ryuqq.moderation.core.model.Prediction;
import com.ryuqq.moderation.core.spi.PredictionCache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * In-memory implementation of {@link PredictionCache} SPI, backed by Caffeine.
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>잠금 없음: 같은 키의 동시 쓰기는 마지막 쓰기가 이김</li>
 *   <li>TTL: 저장 시점 + ttl 이후에는 미스 ({@code expireAfterWrite})</li>
 *   <li>용량: maxEntries를 넘으면 Caffeine의 크기 기반 정책으로 제거</li>
 * </ul>
 *
 * <p>만료 판단은 주입된 {@link Clock}을 Caffeine {@link Ticker}로 변환해 사용하므로
 * 테스트에서 시간을 직접 움직일 수 있습니다. 적중/미스 횟수는 {@code recordStats()}로 집계합니다.</p>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public class InMemoryPredictionCache implements PredictionCache {

    /**
     * 기본 TTL: 15분.
     */
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(15);

    /**
     * 기본 최대 항목 수.
     */
    public static final int DEFAULT_MAX_ENTRIES = 10_000;

    private final Cache<Fingerprint, Prediction> cache;
    private final Duration ttl;
    private final int maxEntries;

    public InMemoryPredictionCache() {
        this(DEFAULT_TTL, DEFAULT_MAX_ENTRIES, Clock.systemUTC());
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param ttl 항목 유효 기간 (양수)
     * @param maxEntries 최대 항목 수 (양수)
     * @param clock 시계
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public InMemoryPredictionCache(Duration ttl, int maxEntries, Clock clock) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive (current: " + ttl + ")");
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive (current: " + maxEntries + ")");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.ttl = ttl;
        this.maxEntries = maxEntries;
        this.cache = Caffeine.newBuilder()
            .expireAfterWrite(ttl)
            .maximumSize(maxEntries)
            .ticker(tickerOf(clock))
            .recordStats()
            .build();
    }

    @Override
    public Optional<Prediction> get(Fingerprint fingerprint) {
        if (fingerprint == null) {
            throw new IllegalArgumentException("fingerprint cannot be null");
        }
        return Optional.ofNullable(cache.getIfPresent(fingerprint));
    }

    @Override
    public void put(Fingerprint fingerprint, Prediction prediction) {
        if (fingerprint == null) {
            throw new IllegalArgumentException("fingerprint cannot be null");
        }
        if (prediction == null) {
            throw new IllegalArgumentException("prediction cannot be null");
        }
        cache.put(fingerprint, prediction);
    }

    /**
     * 만료/초과 항목을 정리한 뒤의 항목 수.
     *
     * @return 항목 수
     */
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public long getHitCount() {
        return cache.stats().hitCount();
    }

    public long getMissCount() {
        return cache.stats().missCount();
    }

    public Duration getTtl() {
        return ttl;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    /**
     * 모든 항목 제거.
     */
    public void clear() {
        cache.invalidateAll();
    }

    private static Ticker tickerOf(Clock clock) {
        return () -> {
            Instant now = clock.instant();
            return now.getEpochSecond() * 1_000_000_000L + now.getNano();
        };
    }
}
