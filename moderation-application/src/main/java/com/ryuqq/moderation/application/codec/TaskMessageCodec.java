package com.ryuqq.moderation.application.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.moderation.core.exception.MalformedMessageException;
import com.ryuqq.moderation.core.model.TaskId;
import com.ryuqq.moderation.core.model.TaskMessage;

import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * TaskMessage ↔ JSON 코덱.
 *
 * <p><strong>Wire format:</strong></p>
 * <pre>
 * {"task_id": 42, "item_id": 7, "timestamp": "2024-01-01T00:00:00Z", "retry_count": 0, "last_error": "..."}
 * </pre>
 *
 * <p>retry_count가 없으면 0, last_error가 없으면 null로 해석합니다.
 * 그 외 필수 필드가 없거나 타입이 맞지 않으면 {@link MalformedMessageException}을 던집니다.</p>
 *
 * <p>Thread-safe: ObjectMapper는 설정 이후 불변이므로 하나의 인스턴스를 모든 Worker가 공유합니다.</p>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public class TaskMessageCodec {

    private final ObjectMapper objectMapper;

    public TaskMessageCodec() {
        this(ModerationJson.newObjectMapper());
    }

    public TaskMessageCodec(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    /**
     * TaskMessage를 JSON으로 직렬화.
     *
     * @param message 메시지
     * @return JSON 문자열
     * @throws IllegalArgumentException message가 null인 경우
     */
    public String encode(TaskMessage message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        try {
            return objectMapper.writeValueAsString(toJson(message));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode task message: " + message.taskId(), e);
        }
    }

    /**
     * JSON을 TaskMessage로 역직렬화.
     *
     * @param payload JSON 문자열
     * @return TaskMessage
     * @throws MalformedMessageException 파싱 실패 또는 필드 검증 실패 시
     */
    public TaskMessage decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new MalformedMessageException("Task payload is empty");
        }
        TaskMessageJson json;
        try {
            json = objectMapper.readValue(payload, TaskMessageJson.class);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Task payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return fromJson(json);
    }

    /**
     * 손상된 페이로드에서 task_id만 최대한 읽어냄.
     *
     * <p>디코딩에 실패한 메시지라도 task_id를 읽을 수 있으면 Worker가
     * 해당 레코드를 FAILED로 기록할 수 있습니다.</p>
     *
     * @param payload JSON 문자열
     * @return 양수 task_id가 있으면 TaskId, 아니면 empty
     */
    public Optional<TaskId> peekTaskId(String payload) {
        if (payload == null || payload.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(payload);
            JsonNode taskId = node == null ? null : node.get("task_id");
            if (taskId == null || !taskId.canConvertToLong() || !taskId.isIntegralNumber() || taskId.asLong() <= 0) {
                return Optional.empty();
            }
            return Optional.of(TaskId.of(taskId.asLong()));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    TaskMessageJson toJson(TaskMessage message) {
        TaskMessageJson json = new TaskMessageJson();
        json.setTaskId(message.taskId().getValue());
        json.setItemId(message.itemId());
        json.setTimestamp(message.enqueuedAt().toString());
        json.setRetryCount(message.retryCount());
        json.setLastError(message.lastError());
        return json;
    }

    TaskMessage fromJson(TaskMessageJson json) {
        if (json == null) {
            throw new MalformedMessageException("Task payload is null");
        }
        if (json.getTaskId() == null) {
            throw new MalformedMessageException("Task payload is missing task_id");
        }
        if (json.getItemId() == null) {
            throw new MalformedMessageException("Task payload is missing item_id");
        }
        if (json.getTimestamp() == null) {
            throw new MalformedMessageException("Task payload is missing timestamp");
        }
        try {
            return new TaskMessage(
                TaskId.of(json.getTaskId()),
                json.getItemId(),
                ModerationJson.parseInstant(json.getTimestamp()),
                json.getRetryCount() == null ? 0 : json.getRetryCount(),
                json.getLastError()
            );
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new MalformedMessageException("Task payload is invalid: " + e.getMessage(), e);
        }
    }
}
