package com.ryuqq.moderation.application.codec;

import com.ryuqq.moderation.core.exception.ErrorType;
import com.ryuqq.moderation.core.exception.MalformedMessageException;
import com.ryuqq.moderation.core.model.DeadLetterEnvelope;
import com.ryuqq.moderation.core.model.FailureType;
import com.ryuqq.moderation.core.model.TaskId;
import com.ryuqq.moderation.core.model.TaskMessage;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DeadLetterCodec 테스트.
 *
 * @author Moderation Team
 * @since 1.0.0
 */
class DeadLetterCodecTest {

    private final DeadLetterCodec codec = new DeadLetterCodec();

    private static TaskMessage exhaustedMessage() {
        return new TaskMessage(TaskId.of(9L), 5L, Instant.parse("2024-01-01T00:00:00Z"), 3, "Model not loaded");
    }

    @Test
    void encode_재시도_소진은_max_retries_exceeded로_표기됨() {
        // given
        DeadLetterEnvelope envelope = DeadLetterEnvelope.of(exhaustedMessage(),
            "Max retries exceeded (3): Model not loaded", FailureType.EXHAUSTED_RETRIES,
            ErrorType.EXHAUSTED_RETRIES, Instant.parse("2024-01-01T00:01:10Z"));

        // when
        String json = codec.encode(envelope);

        // then
        assertThat(json)
            .contains("\"original_message\":{")
            .contains("\"failure_type\":\"max_retries_exceeded\"")
            .contains("\"error_code\":\"EXHAUSTED_RETRIES\"")
            .contains("\"retry_count_at_failure\":3")
            .contains("\"dead_lettered_at\":\"2024-01-01T00:01:10Z\"");
    }

    @Test
    void decode_영구_실패_봉투를_복원함() {
        // given
        DeadLetterEnvelope envelope = DeadLetterEnvelope.of(TaskMessage.first(TaskId.of(1L), 999L,
                Instant.parse("2024-01-01T00:00:00Z")),
            "Item not found: item_id=999", FailureType.PERMANENT, ErrorType.ITEM_NOT_FOUND,
            Instant.parse("2024-01-01T00:00:01Z"));

        // when
        DeadLetterEnvelope decoded = codec.decode(codec.encode(envelope));

        // then
        assertThat(decoded).isEqualTo(envelope);
        assertThat(decoded.retryCountAtFailure()).isZero();
    }

    @Test
    void decode_알_수_없는_failure_type은_MalformedMessageException() {
        String payload = "{\"original_message\":{\"task_id\":1,\"item_id\":2,\"timestamp\":\"2024-01-01T00:00:00Z\"},"
            + "\"failure_reason\":\"x\",\"failure_type\":\"weird\",\"error_code\":\"UNEXPECTED\","
            + "\"retry_count_at_failure\":0,\"dead_lettered_at\":\"2024-01-01T00:00:00Z\"}";

        assertThatThrownBy(() -> codec.decode(payload))
            .isInstanceOf(MalformedMessageException.class)
            .hasMessageContaining("failure_type");
    }

    @Test
    void decode_original_message가_없으면_MalformedMessageException() {
        assertThatThrownBy(() -> codec.decode("{\"failure_reason\":\"x\"}"))
            .isInstanceOf(MalformedMessageException.class)
            .hasMessageContaining("original_message");
    }

    @Test
    void decode_JSON_null이면_MalformedMessageException() {
        assertThatThrownBy(() -> codec.decode("null"))
            .isInstanceOf(MalformedMessageException.class);
    }

    @Test
    void encodeMalformed_읽을_수_있는_필드는_original_message에_남김() {
        // when
        String json = codec.encodeMalformed("{\"task_id\": 4, \"retry_count\": 2}",
            "Task payload is missing item_id", Instant.parse("2024-01-01T00:00:05Z"));

        // then
        assertThat(json)
            .contains("\"original_message\":{\"task_id\":4")
            .contains("\"failure_type\":\"permanent\"")
            .contains("\"error_code\":\"MALFORMED_MESSAGE\"")
            .contains("\"retry_count_at_failure\":2");
        assertThatThrownBy(() -> codec.decode(json))
            .isInstanceOf(MalformedMessageException.class);
    }

    @Test
    void encodeMalformed_JSON이_아니면_original_message_생략() {
        // when
        String json = codec.encodeMalformed("not-json", "Task payload is not valid JSON",
            Instant.parse("2024-01-01T00:00:05Z"));

        // then
        assertThat(json)
            .doesNotContain("original_message")
            .contains("\"retry_count_at_failure\":0");
    }
}
