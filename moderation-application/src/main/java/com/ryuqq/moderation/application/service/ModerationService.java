package com.ryuqq.moderation.application.service;

import com.ryuqq.moderation.application.codec.TaskMessageCodec;
import com.ryuqq.moderation.core.exception.ItemNotFoundException;
import com.ryuqq.moderation.core.model.ModerationResult;
import com.ryuqq.moderation.core.model.TaskId;
import com.ryuqq.moderation.core.model.TaskMessage;
import com.ryuqq.moderation.core.spi.ItemRepository;
import com.ryuqq.moderation.core.spi.MessageBus;
import com.ryuqq.moderation.core.spi.ResultStore;
import com.ryuqq.moderation.core.spi.Topic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * 모더레이션 요청 접수 및 결과 조회.
 *
 * <p>요청 처리 경계(HTTP 등)가 소비하는 계약입니다. 추론을 기다리지 않고
 * Task ID를 즉시 반환하며, 결과는 {@link #lookup(TaskId)}로 폴링합니다.</p>
 *
 * <p><strong>submit 순서:</strong></p>
 * <ol>
 *   <li>아이템 존재 확인 (없으면 {@link ItemNotFoundException}, 레코드 미생성)</li>
 *   <li>Result Store에 PENDING 레코드 생성</li>
 *   <li>Task 토픽으로 메시지 발행</li>
 *   <li>발행 실패 시 레코드를 FAILED로 기록하고 예외 전파</li>
 * </ol>
 *
 * <p>PENDING 레코드가 발행보다 먼저 존재하므로 Worker는 항상 레코드를 찾을 수 있습니다.</p>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public class ModerationService {

    private static final Logger log = LoggerFactory.getLogger(ModerationService.class);

    private final ResultStore resultStore;
    private final ItemRepository itemRepository;
    private final MessageBus messageBus;
    private final Topic taskTopic;
    private final TaskMessageCodec codec;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param resultStore Result Store
     * @param itemRepository 아이템 저장소
     * @param messageBus 메시지 버스
     * @param taskTopic Task 토픽
     * @param codec Task 메시지 코덱
     * @param clock 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ModerationService(ResultStore resultStore, ItemRepository itemRepository, MessageBus messageBus,
                             Topic taskTopic, TaskMessageCodec codec, Clock clock) {
        if (resultStore == null) {
            throw new IllegalArgumentException("resultStore cannot be null");
        }
        if (itemRepository == null) {
            throw new IllegalArgumentException("itemRepository cannot be null");
        }
        if (messageBus == null) {
            throw new IllegalArgumentException("messageBus cannot be null");
        }
        if (taskTopic == null) {
            throw new IllegalArgumentException("taskTopic cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.resultStore = resultStore;
        this.itemRepository = itemRepository;
        this.messageBus = messageBus;
        this.taskTopic = taskTopic;
        this.codec = codec;
        this.clock = clock;
    }

    /**
     * 모더레이션 요청 접수.
     *
     * @param itemId 아이템 ID (양수)
     * @return 발급된 Task ID
     * @throws IllegalArgumentException itemId가 양수가 아닌 경우
     * @throws ItemNotFoundException 아이템이 존재하지 않는 경우
     * @throws RuntimeException 발행 실패 시 버스가 던진 예외 (레코드는 FAILED로 기록됨)
     */
    public TaskId submit(long itemId) {
        if (itemId <= 0) {
            throw new IllegalArgumentException("itemId must be positive (current: " + itemId + ")");
        }
        log.info("Moderation requested: itemId={}", itemId);

        if (itemRepository.findById(itemId).isEmpty()) {
            log.warn("Item not found: itemId={}", itemId);
            throw new ItemNotFoundException(itemId);
        }

        TaskId taskId = resultStore.createPending(itemId);
        log.info("Moderation task created: taskId={}, itemId={}", taskId.getValue(), itemId);

        TaskMessage message = TaskMessage.first(taskId, itemId, clock.instant());
        try {
            messageBus.publish(taskTopic, codec.encode(message));
        } catch (RuntimeException e) {
            log.error("Failed to publish task: taskId={}, itemId={}", taskId.getValue(), itemId, e);
            resultStore.fail(taskId, "Failed to publish task: " + e.getMessage());
            throw e;
        }

        log.info("Task published: taskId={}, topic={}", taskId.getValue(), taskTopic);
        return taskId;
    }

    /**
     * 결과 조회.
     *
     * @param taskId Task ID
     * @return 결과 레코드, 없으면 empty
     * @throws IllegalArgumentException taskId가 null인 경우
     */
    public Optional<ModerationResult> lookup(TaskId taskId) {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        return resultStore.get(taskId);
    }

    /**
     * 아이템에 대해 발급된 모든 Task의 결과 조회 (오래된 순).
     *
     * @param itemId 아이템 ID
     * @return 결과 목록
     */
    public List<ModerationResult> lookupByItem(long itemId) {
        return resultStore.findTaskIdsByItem(itemId).stream()
            .map(resultStore::get)
            .flatMap(Optional::stream)
            .toList();
    }
}
