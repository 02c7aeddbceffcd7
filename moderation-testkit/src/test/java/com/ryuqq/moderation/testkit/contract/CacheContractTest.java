package com.ryuqq.moderation.testkit.contract;

import com.ryuqq.moderation.core.model.Item;
import com.ryuqq.moderation.core.model.ModerationResult;
import com.ryuqq.moderation.core.model.Prediction;
import com.ryuqq.moderation.core.model.TaskId;
import com.ryuqq.moderation.core.spi.Delivery;
import com.ryuqq.moderation.core.statemachine.ModerationStatus;
import com.ryuqq.moderation.core.statemachine.WorkerState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: items with identical content share one prediction while the cache entry lives.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Second item with the same content is served from the cache</li>
 *   <li>Concurrent misses for the same content record the same prediction</li>
 *   <li>An expired entry sends the next task back to the model</li>
 * </ul>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
class CacheContractTest extends AbstractContractTest {

    private void givenTwinItems(long firstId, long secondId) {
        items.save(new Item(firstId, 1L, "Vintage lamp", "Brass lamp, works fine", 42, 3, true));
        items.save(new Item(secondId, 2L, "Vintage lamp", "Brass lamp, works fine", 42, 3, true));
    }

    @Test
    void testIdenticalContent_SecondTaskServedFromCache() {
        // Given
        givenTwinItems(1L, 2L);
        TaskId first = service.submit(1L);
        TaskId second = service.submit(2L);

        // When
        drain();

        // Then
        assertEquals(1, model.getCallCount(), "Model must be called once for identical content");
        assertEquals(1, cache.getHitCount());
        ModerationResult firstResult = result(first);
        ModerationResult secondResult = result(second);
        assertEquals(ModerationStatus.COMPLETED, firstResult.status());
        assertEquals(ModerationStatus.COMPLETED, secondResult.status());
        assertEquals(firstResult.isViolation(), secondResult.isViolation());
        assertEquals(firstResult.probability(), secondResult.probability());
    }

    @Test
    void testDifferentContent_EachTaskCallsModel() {
        // Given
        givenItem(1L, true, 4);
        givenItem(2L, true, 4);
        service.submit(1L);
        service.submit(2L);

        // When
        drain();

        // Then
        assertEquals(2, model.getCallCount());
        assertEquals(0, cache.getHitCount());
    }

    @Test
    void testConcurrentMisses_SameContent_RecordSamePrediction() throws Exception {
        // Given: both deliveries in hand before either reaches the model
        givenTwinItems(1L, 2L);
        TaskId first = service.submit(1L);
        TaskId second = service.submit(2L);
        Delivery firstDelivery = takeTaskDelivery();
        Delivery secondDelivery = takeTaskDelivery();
        model.withLatencyMs(100);

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch startLatch = new CountDownLatch(1);

        try {
            // When
            Future<WorkerState> a = executor.submit(() -> {
                startLatch.await();
                return process(firstDelivery);
            });
            Future<WorkerState> b = executor.submit(() -> {
                startLatch.await();
                return process(secondDelivery);
            });
            startLatch.countDown();

            // Then
            assertEquals(WorkerState.ACKED, a.get(5, TimeUnit.SECONDS));
            assertEquals(WorkerState.ACKED, b.get(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }

        assertTrue(model.getCallCount() <= 2);
        assertEquals(result(first).probability(), result(second).probability());
        assertEquals(result(first).isViolation(), result(second).isViolation());
    }

    @Test
    void testCacheEntryExpired_ModelCalledAgain() {
        // Given
        givenTwinItems(1L, 2L);
        service.submit(1L);
        drain();
        assertEquals(1, model.getCallCount());

        // When
        clock.advance(Duration.ofMinutes(16));
        TaskId second = service.submit(2L);
        drain();

        // Then
        assertEquals(2, model.getCallCount(), "Expired entry must not be served");
        assertStatus(second, ModerationStatus.COMPLETED);
    }

    @Test
    void testCacheEntryWithinTtl_PinnedResponseNotConsulted() {
        // Given: first prediction cached, then the model would answer differently
        givenTwinItems(1L, 2L);
        model.respondWith(Prediction.of(true, 0.91));
        TaskId first = service.submit(1L);
        drain();

        // When
        clock.advance(Duration.ofMinutes(14));
        model.respondWith(Prediction.of(false, 0.05));
        TaskId second = service.submit(2L);
        drain();

        // Then
        assertEquals(1, model.getCallCount());
        assertEquals(Boolean.TRUE, result(second).isViolation());
        assertEquals(0.91, result(second).probability().doubleValue(), 1e-9);
        assertEquals(result(first).processedAt().plus(Duration.ofMinutes(14)), result(second).processedAt());
    }
}
