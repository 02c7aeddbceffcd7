package com.ryuqq.moderation.adapter.runner;

import com.ryuqq.moderation.core.spi.Topic;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TopicConfig 테스트.
 *
 * @author Moderation Team
 * @since 1.0.0
 */
class TopicConfigTest {

    @Test
    void 기본_토픽_이름() {
        // when
        TopicConfig topics = new TopicConfig();

        // then
        assertThat(topics.taskTopic()).isEqualTo(Topic.of("moderation"));
        assertThat(topics.retryTopic()).isEqualTo(Topic.of("moderation_retry"));
        assertThat(topics.deadLetterTopic()).isEqualTo(Topic.of("moderation_dlq"));
        assertThat(topics.hasSeparateRetryTopic()).isTrue();
    }

    @Test
    void retry_토픽은_task_토픽과_같을_수_있음() {
        // when
        TopicConfig topics = new TopicConfig().withRetry("moderation");

        // then
        assertThat(topics.hasSeparateRetryTopic()).isFalse();
    }

    @Test
    void deadLetter_토픽이_task_토픽과_같으면_IllegalArgumentException() {
        assertThatThrownBy(() -> new TopicConfig().withDeadLetter("moderation"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("deadLetter must differ");
    }

    @Test
    void 빈_토픽_이름은_IllegalArgumentException() {
        assertThatThrownBy(() -> new TopicConfig().withTask(" "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("task cannot be null or blank");
    }
}
