package com.ryuqq.moderation.core.spi;

import com.ryuqq.moderation.core.exception.ModelUnavailableException;
import com.ryuqq.moderation.core.model.Item;
import com.ryuqq.moderation.core.model.Prediction;

/**
 * Violation classifier.
 *
 * <p>Instances are immutable after construction and are shared read-only by every
 * worker, so {@link #predict(Item)} must be safe to call concurrently. For a given
 * item content the prediction is deterministic.</p>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public interface ModerationModel {

    /**
     * Classifies an item.
     *
     * @param item item to classify
     * @return prediction
     * @throws ModelUnavailableException if the model cannot serve right now (transient)
     */
    Prediction predict(Item item);
}
