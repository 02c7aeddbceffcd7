package com.ryuqq.moderation.adapter.runner;

import com.ryuqq.moderation.core.spi.Topic;

/**
 * 토픽 이름 설정 (불변 record).
 *
 * <p>기본값: task=moderation, retry=moderation_retry, deadLetter=moderation_dlq</p>
 *
 * <p>dead-letter 토픽은 작업/재시도 토픽과 달라야 합니다. 재시도 토픽은 작업 토픽과
 * 같아도 되며, 이 경우 지연 메시지가 작업 토픽에 직접 쌓입니다.</p>
 *
 * @author Moderation Team
 * @since 1.0.0
 * @param task 작업 토픽 이름
 * @param retry 지연 재시도 토픽 이름
 * @param deadLetter dead-letter 토픽 이름
 */
public record TopicConfig(String task, String retry, String deadLetter) {

    public TopicConfig() {
        this("moderation", "moderation_retry", "moderation_dlq");
    }

    public TopicConfig {
        if (task == null || task.isBlank()) {
            throw new IllegalArgumentException("task cannot be null or blank");
        }
        if (retry == null || retry.isBlank()) {
            throw new IllegalArgumentException("retry cannot be null or blank");
        }
        if (deadLetter == null || deadLetter.isBlank()) {
            throw new IllegalArgumentException("deadLetter cannot be null or blank");
        }
        if (deadLetter.equals(task) || deadLetter.equals(retry)) {
            throw new IllegalArgumentException(
                "deadLetter must differ from task and retry topics (current: " + deadLetter + ")"
            );
        }
    }

    public Topic taskTopic() {
        return Topic.of(task);
    }

    public Topic retryTopic() {
        return Topic.of(retry);
    }

    public Topic deadLetterTopic() {
        return Topic.of(deadLetter);
    }

    /**
     * 작업 토픽과 재시도 토픽이 분리되어 있는지 여부.
     */
    public boolean hasSeparateRetryTopic() {
        return !retry.equals(task);
    }

    public TopicConfig withTask(String task) {
        return new TopicConfig(task, retry, deadLetter);
    }

    public TopicConfig withRetry(String retry) {
        return new TopicConfig(task, retry, deadLetter);
    }

    public TopicConfig withDeadLetter(String deadLetter) {
        return new TopicConfig(task, retry, deadLetter);
    }
}
