package com.ryuqq.moderation.core.spi;

import com.ryuqq.moderation.core.model.Fingerprint;
import com.ryuqq.moderation.core.model.Prediction;

import java.util.Optional;

/**
 * Read-through prediction cache SPI.
 *
 * <p>The cache is an optimization only. Callers treat a read error as a miss and
 * ignore write errors, so implementations may throw unchecked exceptions freely.
 * Concurrent writers for the same fingerprint race with last-write-wins semantics.</p>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public interface PredictionCache {

    /**
     * Looks up a cached prediction.
     *
     * @param fingerprint content fingerprint
     * @return cached prediction, or empty on miss or expiry
     */
    Optional<Prediction> get(Fingerprint fingerprint);

    /**
     * Stores a prediction.
     *
     * @param fingerprint content fingerprint
     * @param prediction prediction to cache
     */
    void put(Fingerprint fingerprint, Prediction prediction);
}
