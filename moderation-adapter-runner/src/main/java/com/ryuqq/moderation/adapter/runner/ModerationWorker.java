package com.ryuqq.moderation.adapter.runner;

import com.ryuqq.moderation.application.codec.DeadLetterCodec;
import com.ryuqq.moderation.application.codec.TaskMessageCodec;
import com.ryuqq.moderation.core.exception.ErrorType;
import com.ryuqq.moderation.core.exception.ItemNotFoundException;
import com.ryuqq.moderation.core.exception.MalformedMessageException;
import com.ryuqq.moderation.core.exception.ModerationException;
import com.ryuqq.moderation.core.model.DeadLetterEnvelope;
import com.ryuqq.moderation.core.model.FailureType;
import com.ryuqq.moderation.core.model.Fingerprint;
import com.ryuqq.moderation.core.model.Item;
import com.ryuqq.moderation.core.model.ModerationResult;
import com.ryuqq.moderation.core.model.Prediction;
import com.ryuqq.moderation.core.model.TaskId;
import com.ryuqq.moderation.core.model.TaskMessage;
import com.ryuqq.moderation.core.outcome.Duplicate;
import com.ryuqq.moderation.core.outcome.Fail;
import com.ryuqq.moderation.core.outcome.Ok;
import com.ryuqq.moderation.core.outcome.Outcome;
import com.ryuqq.moderation.core.outcome.Retry;
import com.ryuqq.moderation.core.policy.RetryPolicy;
import com.ryuqq.moderation.core.policy.RoutingDecision;
import com.ryuqq.moderation.core.spi.Delivery;
import com.ryuqq.moderation.core.spi.ItemRepository;
import com.ryuqq.moderation.core.spi.MessageBus;
import com.ryuqq.moderation.core.spi.ModerationModel;
import com.ryuqq.moderation.core.spi.PredictionCache;
import com.ryuqq.moderation.core.spi.ResultStore;
import com.ryuqq.moderation.core.statemachine.WorkerState;
import com.ryuqq.moderation.core.statemachine.WorkerStateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.util.Optional;

/**
 * 하나의 배달(Delivery)을 끝까지 처리하는 Worker.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <ol>
 *   <li>페이로드 디코딩 (손상 시 영구 실패)</li>
 *   <li>Result Store 조회: 레코드가 없으면 영구 실패, 이미 종료 상태이면 ack 후 종료</li>
 *   <li>아이템 로드 (없으면 영구 실패)</li>
 *   <li>Fingerprint 계산 후 캐시 조회 (조회 오류는 miss로 간주)</li>
 *   <li>miss이면 모델 추론 후 캐시 저장 (저장 오류는 무시)</li>
 *   <li>Result Store에 COMPLETED 기록</li>
 *   <li>원본 메시지 ack</li>
 * </ol>
 *
 * <p>처리 중 발생한 모든 예외는 {@link Outcome}으로 변환되고 {@link RetryPolicy}가
 * ack / 지연 재발행 / dead-letter 중 하나를 결정합니다. {@link Error}만 호출자에게 전파됩니다.</p>
 *
 * <p><strong>Ack 규칙:</strong></p>
 * <ul>
 *   <li>Result Store 기록 또는 재시도/dead-letter 발행이 끝난 뒤에만 ack</li>
 *   <li>dead-letter 발행이 끝난 뒤에 레코드를 FAILED로 기록</li>
 *   <li>dead-letter 발행이 실패하면 레코드를 건드리지 않고 nack하여 재배달되도록 함</li>
 * </ul>
 *
 * <p>Thread-safe: 상태를 갖지 않으므로 하나의 인스턴스를 여러 스레드가 공유합니다.</p>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public class ModerationWorker {

    private static final Logger log = LoggerFactory.getLogger(ModerationWorker.class);

    static final String MDC_TASK_ID = "taskId";
    static final String MDC_ITEM_ID = "itemId";
    static final String MDC_RETRY_COUNT = "retryCount";

    private final MessageBus messageBus;
    private final ResultStore resultStore;
    private final ItemRepository itemRepository;
    private final PredictionCache predictionCache;
    private final ModerationModel model;
    private final RetryPolicy retryPolicy;
    private final TopicConfig topics;
    private final TaskMessageCodec taskCodec;
    private final DeadLetterCodec deadLetterCodec;
    private final Clock clock;

    /**
     * ModerationWorker 생성.
     *
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public ModerationWorker(
        MessageBus messageBus,
        ResultStore resultStore,
        ItemRepository itemRepository,
        PredictionCache predictionCache,
        ModerationModel model,
        RetryPolicy retryPolicy,
        TopicConfig topics,
        TaskMessageCodec taskCodec,
        DeadLetterCodec deadLetterCodec,
        Clock clock
    ) {
        if (messageBus == null) {
            throw new IllegalArgumentException("messageBus cannot be null");
        }
        if (resultStore == null) {
            throw new IllegalArgumentException("resultStore cannot be null");
        }
        if (itemRepository == null) {
            throw new IllegalArgumentException("itemRepository cannot be null");
        }
        if (predictionCache == null) {
            throw new IllegalArgumentException("predictionCache cannot be null");
        }
        if (model == null) {
            throw new IllegalArgumentException("model cannot be null");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        if (topics == null) {
            throw new IllegalArgumentException("topics cannot be null");
        }
        if (taskCodec == null) {
            throw new IllegalArgumentException("taskCodec cannot be null");
        }
        if (deadLetterCodec == null) {
            throw new IllegalArgumentException("deadLetterCodec cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }

        this.messageBus = messageBus;
        this.resultStore = resultStore;
        this.itemRepository = itemRepository;
        this.predictionCache = predictionCache;
        this.model = model;
        this.retryPolicy = retryPolicy;
        this.topics = topics;
        this.taskCodec = taskCodec;
        this.deadLetterCodec = deadLetterCodec;
        this.clock = clock;
    }

    /**
     * 배달 하나를 처리.
     *
     * @param delivery 버스에서 받은 배달
     * @return 최종 WorkerState (ACKED, DEAD_LETTERED, RELEASED 중 하나)
     * @throws IllegalArgumentException delivery가 null인 경우
     */
    public WorkerState process(Delivery delivery) {
        if (delivery == null) {
            throw new IllegalArgumentException("delivery cannot be null");
        }

        Progress progress = new Progress();
        progress.moveTo(WorkerState.FETCHED);

        TaskMessage message;
        try {
            message = taskCodec.decode(delivery.payload());
        } catch (MalformedMessageException e) {
            return deadLetterMalformed(delivery, e.getMessage(), progress);
        }

        MDC.put(MDC_TASK_ID, String.valueOf(message.taskId().getValue()));
        MDC.put(MDC_ITEM_ID, String.valueOf(message.itemId()));
        MDC.put(MDC_RETRY_COUNT, String.valueOf(message.retryCount()));
        try {
            if (delivery.isRedelivery()) {
                log.debug("Redelivered task message: taskId={}, deliveryCount={}",
                    message.taskId(), delivery.deliveryCount());
            }
            Outcome outcome = evaluate(message, progress);
            return settle(delivery, message, outcome, progress);
        } finally {
            MDC.remove(MDC_TASK_ID);
            MDC.remove(MDC_ITEM_ID);
            MDC.remove(MDC_RETRY_COUNT);
        }
    }

    /**
     * 메시지를 평가하여 Outcome으로 변환.
     *
     * <p>예외를 밖으로 던지지 않습니다 ({@link Error} 제외).</p>
     */
    Outcome evaluate(TaskMessage message, Progress progress) {
        TaskId taskId = message.taskId();
        try {
            Optional<ModerationResult> existing = resultStore.get(taskId);
            if (existing.isEmpty()) {
                return new Fail(ErrorType.RESULT_NOT_FOUND, "Result record not found: task_id=" + taskId.getValue());
            }
            if (existing.get().isTerminal()) {
                return new Duplicate(taskId, existing.get().status());
            }

            Item item = itemRepository.findById(message.itemId())
                .orElseThrow(() -> new ItemNotFoundException(message.itemId()));

            Fingerprint fingerprint = Fingerprint.of(item);
            Optional<Prediction> cached = readCache(fingerprint);
            progress.moveTo(WorkerState.CACHE_CHECKED);

            Prediction prediction;
            boolean fromCache = cached.isPresent();
            if (fromCache) {
                progress.moveTo(WorkerState.CACHE_HIT);
                prediction = cached.get();
            } else {
                progress.moveTo(WorkerState.INFERRING);
                prediction = model.predict(item);
                writeCache(fingerprint, prediction);
            }

            boolean applied = resultStore.complete(taskId, prediction);
            progress.moveTo(WorkerState.PERSISTED);
            if (!applied) {
                // 다른 Worker가 먼저 종료 상태로 기록함
                Optional<ModerationResult> current = resultStore.get(taskId);
                if (current.isPresent() && current.get().isTerminal()) {
                    return new Duplicate(taskId, current.get().status());
                }
                return new Fail(ErrorType.RESULT_NOT_FOUND, "Result record not found: task_id=" + taskId.getValue());
            }
            return new Ok(taskId, prediction, fromCache);

        } catch (ModerationException e) {
            String reason = describe(e);
            return e.isRetryable() ? new Retry(e.getErrorType(), reason) : new Fail(e.getErrorType(), reason);
        } catch (RuntimeException e) {
            log.error("Unexpected error while processing task: taskId={}", taskId, e);
            return new Retry(ErrorType.UNEXPECTED, describe(e));
        }
    }

    private Optional<Prediction> readCache(Fingerprint fingerprint) {
        try {
            return predictionCache.get(fingerprint);
        } catch (RuntimeException e) {
            log.warn("Prediction cache read failed, treating as miss: fingerprint={}", fingerprint, e);
            return Optional.empty();
        }
    }

    private void writeCache(Fingerprint fingerprint, Prediction prediction) {
        try {
            predictionCache.put(fingerprint, prediction);
        } catch (RuntimeException e) {
            log.warn("Prediction cache write failed, ignoring: fingerprint={}", fingerprint, e);
        }
    }

    private WorkerState settle(Delivery delivery, TaskMessage message, Outcome outcome, Progress progress) {
        RoutingDecision decision = retryPolicy.decide(outcome, message.retryCount());

        if (decision instanceof RoutingDecision.Acknowledge) {
            logAcknowledged(message, outcome);
            return acknowledge(delivery, progress);
        }
        if (decision instanceof RoutingDecision.RetryWithDelay retry) {
            return scheduleRetry(delivery, message, retry, progress);
        }
        return deadLetter(delivery, message, (RoutingDecision.DeadLetter) decision, progress);
    }

    private void logAcknowledged(TaskMessage message, Outcome outcome) {
        if (outcome instanceof Ok ok) {
            log.info("Moderation completed: taskId={}, itemId={}, violation={}, probability={}, fromCache={}",
                ok.taskId(), message.itemId(), ok.prediction().violation(),
                String.format("%.4f", ok.prediction().probability()), ok.fromCache());
        } else if (outcome instanceof Duplicate duplicate) {
            log.info("Task already {}, discarding delivery: taskId={}",
                duplicate.existingStatus().wireName(), duplicate.taskId());
        }
    }

    private WorkerState scheduleRetry(Delivery delivery, TaskMessage message,
                                      RoutingDecision.RetryWithDelay retry, Progress progress) {
        progress.moveTo(WorkerState.RETRYING);
        TaskMessage next = message.nextRetry(retry.reason());
        try {
            messageBus.publishDelayed(topics.retryTopic(), taskCodec.encode(next), retry.delay());
        } catch (RuntimeException e) {
            log.error("Failed to schedule retry, dead-lettering: taskId={}", message.taskId(), e);
            RoutingDecision.DeadLetter fallback = new RoutingDecision.DeadLetter(
                FailureType.PERMANENT, ErrorType.INFRASTRUCTURE, "Failed to schedule retry: " + describe(e));
            return deadLetter(delivery, message, fallback, progress);
        }

        log.warn("Retry scheduled #{}/{}: taskId={}, delay={}ms, reason={}",
            retry.nextRetryCount(), retryPolicy.getMaxRetries(), message.taskId(),
            retry.delay().toMillis(), retry.reason());
        return acknowledge(delivery, progress);
    }

    private WorkerState deadLetter(Delivery delivery, TaskMessage message,
                                   RoutingDecision.DeadLetter decision, Progress progress) {
        DeadLetterEnvelope envelope = DeadLetterEnvelope.of(message, decision.reason(),
            decision.failureType(), decision.errorCode(), clock.instant());
        try {
            messageBus.publish(topics.deadLetterTopic(), deadLetterCodec.encode(envelope));
        } catch (RuntimeException e) {
            // 레코드는 PENDING으로 남아 재배달 시 다시 dead-letter 경로를 탐
            log.error("Failed to publish dead letter, releasing delivery: taskId={}", message.taskId(), e);
            return release(delivery, progress);
        }
        failRecord(message.taskId(), decision.reason());

        log.warn("Task dead-lettered: taskId={}, itemId={}, type={}, errorCode={}, retryCount={}, reason={}",
            message.taskId(), message.itemId(), decision.failureType(), decision.errorCode(),
            message.retryCount(), decision.reason());
        return acknowledgeAs(delivery, progress, WorkerState.DEAD_LETTERED);
    }

    private WorkerState deadLetterMalformed(Delivery delivery, String reason, Progress progress) {
        String failureReason = reason == null || reason.isBlank() ? "Malformed task message" : reason;
        Optional<TaskId> taskId = taskCodec.peekTaskId(delivery.payload());

        try {
            messageBus.publish(topics.deadLetterTopic(),
                deadLetterCodec.encodeMalformed(delivery.payload(), failureReason, clock.instant()));
        } catch (RuntimeException e) {
            log.error("Failed to publish malformed message to dead letter, releasing delivery: topic={}",
                delivery.topic(), e);
            return release(delivery, progress);
        }
        taskId.ifPresent(id -> failRecord(id, failureReason));

        log.warn("Malformed task message dead-lettered: topic={}, taskId={}, reason={}",
            delivery.topic(), taskId.map(TaskId::getValue).orElse(null), failureReason);
        return acknowledgeAs(delivery, progress, WorkerState.DEAD_LETTERED);
    }

    private void failRecord(TaskId taskId, String reason) {
        try {
            if (resultStore.fail(taskId, reason)) {
                log.info("Task marked failed: taskId={}, error={}", taskId, reason);
            } else {
                log.warn("No pending record to mark failed: taskId={}", taskId);
            }
        } catch (RuntimeException e) {
            log.error("Failed to mark task failed: taskId={}", taskId, e);
        }
    }

    private WorkerState acknowledge(Delivery delivery, Progress progress) {
        return acknowledgeAs(delivery, progress, WorkerState.ACKED);
    }

    private WorkerState acknowledgeAs(Delivery delivery, Progress progress, WorkerState settled) {
        try {
            messageBus.ack(delivery.handle());
        } catch (RuntimeException e) {
            log.warn("Ack failed, delivery will be redelivered: handle={}", delivery.handle(), e);
            return progress.moveTo(WorkerState.RELEASED);
        }
        return progress.moveTo(settled);
    }

    private WorkerState release(Delivery delivery, Progress progress) {
        try {
            messageBus.nack(delivery.handle());
        } catch (RuntimeException e) {
            log.error("Nack failed, delivery waits for visibility timeout: handle={}", delivery.handle(), e);
        }
        return progress.moveTo(WorkerState.RELEASED);
    }

    private static String describe(RuntimeException e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            return e.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * Task 하나의 WorkerState 진행 상황.
     */
    static final class Progress {

        private WorkerState state = WorkerState.IDLE;

        WorkerState moveTo(WorkerState next) {
            state = WorkerStateTransition.transition(state, next);
            return state;
        }

        WorkerState current() {
            return state;
        }
    }
}
