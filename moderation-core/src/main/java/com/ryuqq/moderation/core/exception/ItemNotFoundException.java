package com.ryuqq.moderation.core.exception;

/**
 * The item referenced by a task does not exist. Permanent.
 */
public class ItemNotFoundException extends ModerationException {

    private final long itemId;

    public ItemNotFoundException(long itemId) {
        super(ErrorType.ITEM_NOT_FOUND, "Item not found: item_id=" + itemId);
        this.itemId = itemId;
    }

    public long getItemId() {
        return itemId;
    }
}
