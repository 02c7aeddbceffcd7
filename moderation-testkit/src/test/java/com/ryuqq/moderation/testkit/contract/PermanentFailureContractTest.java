package com.ryuqq.moderation.testkit.contract;

import com.ryuqq.moderation.core.exception.ErrorType;
import com.ryuqq.moderation.core.model.DeadLetterEnvelope;
import com.ryuqq.moderation.core.model.FailureType;
import com.ryuqq.moderation.core.model.TaskId;
import com.ryuqq.moderation.core.model.TaskMessage;
import com.ryuqq.moderation.core.statemachine.ModerationStatus;
import com.ryuqq.moderation.core.statemachine.WorkerState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: permanent failures skip the retry path entirely.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Item deleted after submit → dead-lettered on the first attempt</li>
 *   <li>Task without a result record → dead-lettered</li>
 *   <li>Malformed payload → dead-lettered, record failed when the task id is readable</li>
 * </ul>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
class PermanentFailureContractTest extends AbstractContractTest {

    @Test
    void testItemNotFound_DeadLetteredWithoutRetry() {
        // Given
        givenItem(999L, false, 0);
        TaskId taskId = service.submit(999L);
        items.delete(999L);

        // When
        drain();

        // Then
        assertTrue(waitingRetries().isEmpty(), "Permanent failure must not be retried");
        assertEquals(0, model.getCallCount());

        List<DeadLetterEnvelope> deadLetters = collectDeadLetters();
        assertEquals(1, deadLetters.size());
        DeadLetterEnvelope envelope = deadLetters.get(0);
        assertEquals(FailureType.PERMANENT, envelope.failureType());
        assertEquals(ErrorType.ITEM_NOT_FOUND, envelope.errorCode());
        assertEquals(0, envelope.retryCountAtFailure());
        assertEquals(999L, envelope.originalMessage().itemId());

        assertStatus(taskId, ModerationStatus.FAILED);
        assertEquals("Item not found: item_id=999", result(taskId).errorMessage());
    }

    @Test
    void testItemNotFoundOnRetry_DeadLetteredRegardlessOfRetryCount() {
        // Given: a retry message whose item disappeared meanwhile
        givenItem(50L, false, 0);
        TaskId taskId = service.submit(50L);
        TaskMessage retry = taskCodec.decode(takeTaskDelivery().payload()).nextRetry("Model not loaded");
        items.delete(50L);
        bus.publish(topics.retryTopic(), taskCodec.encode(retry));

        // When
        drain();

        // Then
        DeadLetterEnvelope envelope = collectDeadLetters().get(0);
        assertEquals(FailureType.PERMANENT, envelope.failureType());
        assertEquals(1, envelope.retryCountAtFailure());
        assertStatus(taskId, ModerationStatus.FAILED);
    }

    @Test
    void testMissingResultRecord_DeadLettered() {
        // Given: a task published without a pending record
        givenItem(7L, true, 2);
        TaskMessage orphan = TaskMessage.first(TaskId.of(77L), 7L, START);
        bus.publish(topics.taskTopic(), taskCodec.encode(orphan));

        // When
        drain();

        // Then
        DeadLetterEnvelope envelope = collectDeadLetters().get(0);
        assertEquals(ErrorType.RESULT_NOT_FOUND, envelope.errorCode());
        assertEquals(TaskId.of(77L), envelope.taskId());
        assertTrue(service.lookup(TaskId.of(77L)).isEmpty(), "No record may be created by the worker");
        assertEquals(0, model.getCallCount());
    }

    @Test
    void testMalformedPayload_DeadLetteredAndRecordFailed() {
        // Given
        givenItem(8L, true, 2);
        TaskId taskId = service.submit(8L);
        takeTaskDelivery();
        bus.publish(topics.taskTopic(), "{\"task_id\": " + taskId.getValue() + ", \"item_id\": \"eight\"}");

        // When
        WorkerState state = process(takeTaskDelivery());

        // Then
        assertEquals(WorkerState.DEAD_LETTERED, state);
        assertStatus(taskId, ModerationStatus.FAILED);
        collectDeadLetters();
        assertEquals(1, monitor.getUnreadableCount(), "Malformed envelopes are logged, not kept");
    }

    @Test
    void testUnreadablePayload_DeadLetteredWithoutRecordWrite() {
        // Given
        bus.publish(topics.taskTopic(), "not-json");

        // When
        WorkerState state = process(takeTaskDelivery());

        // Then
        assertEquals(WorkerState.DEAD_LETTERED, state);
        assertEquals(0, store.size());
        assertEquals(1, bus.queueSize(topics.deadLetterTopic()));
    }
}
