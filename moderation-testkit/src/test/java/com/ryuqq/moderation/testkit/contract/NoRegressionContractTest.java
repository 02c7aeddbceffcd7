package com.ryuqq.moderation.testkit.contract;

import com.ryuqq.moderation.core.model.ModerationResult;
import com.ryuqq.moderation.core.model.Prediction;
import com.ryuqq.moderation.core.model.TaskId;
import com.ryuqq.moderation.core.model.TaskMessage;
import com.ryuqq.moderation.core.statemachine.ModerationStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: a terminal record never changes again.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>A stale retry for a completed task is acknowledged without work</li>
 *   <li>Replaying a failed task leaves it failed</li>
 *   <li>Direct store writes after a terminal write are rejected</li>
 * </ul>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
class NoRegressionContractTest extends AbstractContractTest {

    @Test
    void testStaleRetry_AfterCompletion_RecordUnchanged() {
        // Given
        givenItem(100L, true, 6);
        TaskId taskId = service.submit(100L);
        drain();
        ModerationResult completed = result(taskId);
        assertEquals(ModerationStatus.COMPLETED, completed.status());

        // When: a retry scheduled by an earlier attempt shows up late
        clock.advance(Duration.ofSeconds(10));
        TaskMessage stale = new TaskMessage(taskId, 100L, START, 1, "Model not loaded");
        bus.publish(topics.retryTopic(), taskCodec.encode(stale));
        drain();

        // Then
        assertEquals(completed, result(taskId));
        assertEquals(1, model.getCallCount());
        assertTrue(waitingRetries().isEmpty());
        assertTrue(collectDeadLetters().isEmpty());
    }

    @Test
    void testReplayOfFailedTask_StaysFailed() {
        // Given
        givenItem(100L, true, 6);
        TaskId taskId = service.submit(100L);
        items.delete(100L);
        drain();
        collectDeadLetters();
        ModerationResult failed = result(taskId);
        assertEquals(ModerationStatus.FAILED, failed.status());

        // When: the item comes back and an operator replays the task
        givenItem(100L, true, 6);
        assertTrue(monitor.replay(taskId));
        drain();

        // Then
        assertEquals(failed, result(taskId));
        assertEquals(0, model.getCallCount());
        assertEquals(0, bus.queueSize(topics.deadLetterTopic()), "Replay must not dead-letter again");
    }

    @Test
    void testFailAfterComplete_Rejected() {
        // Given
        givenItem(100L, false, 1);
        TaskId taskId = service.submit(100L);
        drain();
        ModerationResult completed = result(taskId);

        // When
        boolean applied = store.fail(taskId, "Max retries exceeded (3): Model not loaded");

        // Then
        assertFalse(applied);
        assertEquals(completed, result(taskId));
    }

    @Test
    void testCompleteAfterFail_Rejected() {
        // Given
        givenItem(100L, false, 1);
        TaskId taskId = service.submit(100L);
        assertTrue(store.fail(taskId, "Item not found: item_id=100"));

        // When
        boolean applied = store.complete(taskId, Prediction.of(false, 0.12));

        // Then
        assertFalse(applied);
        assertStatus(taskId, ModerationStatus.FAILED);
        assertNull(result(taskId).probability());
    }
}
