package com.ryuqq.moderation.application.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.moderation.core.exception.ErrorType;
import com.ryuqq.moderation.core.exception.MalformedMessageException;
import com.ryuqq.moderation.core.model.DeadLetterEnvelope;
import com.ryuqq.moderation.core.model.FailureType;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * DeadLetterEnvelope ↔ JSON 코덱.
 *
 * <p><strong>Wire format:</strong></p>
 * <pre>
 * {
 *   "original_message": {"task_id": 42, "item_id": 7, "timestamp": "...", "retry_count": 3},
 *   "failure_reason": "Max retries exceeded (3): Model not loaded",
 *   "failure_type": "max_retries_exceeded",
 *   "error_code": "EXHAUSTED_RETRIES",
 *   "retry_count_at_failure": 3,
 *   "dead_lettered_at": "2024-01-01T00:01:10Z"
 * }
 * </pre>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public class DeadLetterCodec {

    private final ObjectMapper objectMapper;
    private final TaskMessageCodec taskMessageCodec;

    public DeadLetterCodec() {
        this(ModerationJson.newObjectMapper());
    }

    public DeadLetterCodec(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
        this.taskMessageCodec = new TaskMessageCodec(objectMapper);
    }

    /**
     * 봉투를 JSON으로 직렬화.
     *
     * @param envelope dead-letter 봉투
     * @return JSON 문자열
     */
    public String encode(DeadLetterEnvelope envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        DeadLetterJson json = new DeadLetterJson();
        json.setOriginalMessage(taskMessageCodec.toJson(envelope.originalMessage()));
        json.setFailureReason(envelope.failureReason());
        json.setFailureType(wireName(envelope.failureType()));
        json.setErrorCode(envelope.errorCode().name());
        json.setRetryCountAtFailure(envelope.retryCountAtFailure());
        json.setDeadLetteredAt(envelope.deadLetteredAt().toString());
        try {
            return objectMapper.writeValueAsString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode dead-letter envelope: " + envelope.taskId(), e);
        }
    }

    /**
     * TaskMessage로 디코딩할 수 없는 원본 페이로드를 dead-letter JSON으로 직렬화.
     *
     * <p>original_message에는 읽을 수 있는 필드만 담깁니다. 원본이 JSON이 아니면 original_message는 생략됩니다.
     * 이 봉투는 {@link #decode(String)}로 복원되지 않으며 모니터는 원본 그대로 로그에 남깁니다.</p>
     *
     * @param payload 원본 페이로드 (null 허용)
     * @param failureReason 실패 사유
     * @param deadLetteredAt dead-letter 시각
     * @return JSON 문자열
     */
    public String encodeMalformed(String payload, String failureReason, Instant deadLetteredAt) {
        if (failureReason == null || failureReason.isBlank()) {
            throw new IllegalArgumentException("failureReason cannot be null or blank");
        }
        if (deadLetteredAt == null) {
            throw new IllegalArgumentException("deadLetteredAt cannot be null");
        }
        TaskMessageJson original = readLeniently(payload);
        DeadLetterJson json = new DeadLetterJson();
        json.setOriginalMessage(original);
        json.setFailureReason(failureReason);
        json.setFailureType(wireName(FailureType.PERMANENT));
        json.setErrorCode(ErrorType.MALFORMED_MESSAGE.name());
        json.setRetryCountAtFailure(
            original == null || original.getRetryCount() == null ? 0 : Math.max(0, original.getRetryCount()));
        json.setDeadLetteredAt(deadLetteredAt.toString());
        try {
            return objectMapper.writeValueAsString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode malformed dead-letter payload", e);
        }
    }

    /**
     * JSON을 봉투로 역직렬화.
     *
     * @param payload JSON 문자열
     * @return DeadLetterEnvelope
     * @throws MalformedMessageException 파싱 실패 또는 필드 검증 실패 시
     */
    public DeadLetterEnvelope decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new MalformedMessageException("Dead-letter payload is empty");
        }
        DeadLetterJson json;
        try {
            json = objectMapper.readValue(payload, DeadLetterJson.class);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Dead-letter payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (json == null || json.getOriginalMessage() == null) {
            throw new MalformedMessageException("Dead-letter payload is missing original_message");
        }
        if (json.getDeadLetteredAt() == null) {
            throw new MalformedMessageException("Dead-letter payload is missing dead_lettered_at");
        }
        try {
            return new DeadLetterEnvelope(
                taskMessageCodec.fromJson(json.getOriginalMessage()),
                json.getFailureReason(),
                fromWireName(json.getFailureType()),
                json.getErrorCode() == null ? null : ErrorType.valueOf(json.getErrorCode()),
                json.getRetryCountAtFailure() == null ? 0 : json.getRetryCountAtFailure(),
                ModerationJson.parseInstant(json.getDeadLetteredAt())
            );
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new MalformedMessageException("Dead-letter payload is invalid: " + e.getMessage(), e);
        }
    }

    private TaskMessageJson readLeniently(String payload) {
        if (payload == null || payload.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(payload, TaskMessageJson.class);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static String wireName(FailureType failureType) {
        return failureType == FailureType.PERMANENT ? "permanent" : "max_retries_exceeded";
    }

    private static FailureType fromWireName(String wireName) {
        if ("permanent".equals(wireName)) {
            return FailureType.PERMANENT;
        }
        if ("max_retries_exceeded".equals(wireName)) {
            return FailureType.EXHAUSTED_RETRIES;
        }
        throw new IllegalArgumentException("Unknown failure_type: " + wireName);
    }
}
