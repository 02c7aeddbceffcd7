package com.ryuqq.moderation.adapter.inmemory.store;

import com.ryuqq.moderation.core.model.Item;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * InMemoryItemRepository 테스트.
 *
 * @author Moderation Team
 * @since 1.0.0
 */
class InMemoryItemRepositoryTest {

    private final InMemoryItemRepository repository = new InMemoryItemRepository();

    @Test
    void save_후_findById로_조회됨() {
        // given
        Item item = new Item(1L, 100L, "Chair", "Wooden chair", 12, 3, true);

        // when
        repository.save(item);

        // then
        assertThat(repository.findById(1L)).contains(item);
        assertThat(repository.findById(2L)).isEmpty();
    }

    @Test
    void delete_후에는_조회되지_않음() {
        // given
        repository.save(new Item(1L, 100L, "Chair", "Wooden chair", 12, 3, true));

        // when & then
        assertThat(repository.delete(1L)).isTrue();
        assertThat(repository.delete(1L)).isFalse();
        assertThat(repository.findById(1L)).isEmpty();
    }
}
