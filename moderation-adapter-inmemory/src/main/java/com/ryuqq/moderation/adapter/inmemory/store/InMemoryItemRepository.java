package com.ryuqq.moderation.adapter.inmemory.store;

import com.ryuqq.moderation.core.model.Item;
import com.ryuqq.moderation.core.spi.ItemRepository;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link ItemRepository} SPI.
 *
 * <p>아이템은 {@link #save(Item)}로 등록하며, 같은 ID로 다시 저장하면 덮어씁니다.</p>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public class InMemoryItemRepository implements ItemRepository {

    private final ConcurrentHashMap<Long, Item> items = new ConcurrentHashMap<>();

    @Override
    public Optional<Item> findById(long itemId) {
        return Optional.ofNullable(items.get(itemId));
    }

    /**
     * 아이템 저장.
     *
     * @param item 아이템
     * @return 저장한 아이템
     * @throws IllegalArgumentException item이 null인 경우
     */
    public Item save(Item item) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        items.put(item.id(), item);
        return item;
    }

    /**
     * 아이템 삭제.
     *
     * @param itemId 아이템 ID
     * @return 삭제되었으면 true
     */
    public boolean delete(long itemId) {
        return items.remove(itemId) != null;
    }

    public int size() {
        return items.size();
    }
}
