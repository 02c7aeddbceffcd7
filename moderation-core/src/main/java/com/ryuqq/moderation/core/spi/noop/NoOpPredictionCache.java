package com.ryuqq.moderation.core.spi.noop;

import com.ryuqq.moderation.core.model.Fingerprint;
import com.ryuqq.moderation.core.model.Prediction;
import com.ryuqq.moderation.core.spi.PredictionCache;

import java.util.Optional;

/**
 * 캐시 비활성화용 No-Op 구현체.
 *
 * <p>모든 조회는 미스이며, 저장은 무시됩니다. 캐시가 꺼져 있어도 Worker의
 * 처리 경로는 동일하게 유지됩니다 (항상 INFERRING).</p>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public final class NoOpPredictionCache implements PredictionCache {

    /**
     * 싱글톤 인스턴스.
     */
    public static final NoOpPredictionCache INSTANCE = new NoOpPredictionCache();

    private NoOpPredictionCache() {
    }

    @Override
    public Optional<Prediction> get(Fingerprint fingerprint) {
        return Optional.empty();
    }

    @Override
    public void put(Fingerprint fingerprint, Prediction prediction) {
        // No-op
    }
}
