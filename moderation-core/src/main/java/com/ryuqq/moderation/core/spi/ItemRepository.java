package com.ryuqq.moderation.core.spi;

import com.ryuqq.moderation.core.model.Item;

import java.util.Optional;

/**
 * Read access to item content and seller verification.
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public interface ItemRepository {

    /**
     * Loads an item together with its seller's verification flag.
     *
     * @param itemId item id
     * @return the item, or empty if it does not exist
     * @throws com.ryuqq.moderation.core.exception.InfrastructureException if the repository is unreachable
     */
    Optional<Item> findById(long itemId);
}
