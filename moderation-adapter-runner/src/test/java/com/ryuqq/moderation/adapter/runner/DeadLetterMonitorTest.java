package com.ryuqq.moderation.adapter.runner;

import com.ryuqq.moderation.adapter.inmemory.bus.InMemoryMessageBus;
import com.ryuqq.moderation.application.codec.DeadLetterCodec;
import com.ryuqq.moderation.application.codec.TaskMessageCodec;
import com.ryuqq.moderation.core.exception.ErrorType;
import com.ryuqq.moderation.core.model.DeadLetterEnvelope;
import com.ryuqq.moderation.core.model.FailureType;
import com.ryuqq.moderation.core.model.TaskId;
import com.ryuqq.moderation.core.model.TaskMessage;
import com.ryuqq.moderation.core.spi.Delivery;
import com.ryuqq.moderation.core.spi.Topic;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * DeadLetterMonitor 테스트.
 *
 * @author Moderation Team
 * @since 1.0.0
 */
class DeadLetterMonitorTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");
    private static final Topic TASK_TOPIC = Topic.of("moderation");
    private static final Topic DLQ_TOPIC = Topic.of("moderation_dlq");

    private final TaskMessageCodec taskCodec = new TaskMessageCodec();
    private final DeadLetterCodec deadLetterCodec = new DeadLetterCodec();

    private InMemoryMessageBus bus;
    private DeadLetterMonitor monitor;

    @BeforeEach
    void setUp() {
        bus = new InMemoryMessageBus();
        monitor = newMonitor(new DeadLetterMonitorConfig(1000, Duration.ofMillis(10)));
    }

    private DeadLetterMonitor newMonitor(DeadLetterMonitorConfig config) {
        return new DeadLetterMonitor(bus, new TopicConfig(), deadLetterCodec, taskCodec, config);
    }

    private DeadLetterEnvelope publishDeadLetter(long taskId, int retryCount, String reason) {
        TaskMessage message = new TaskMessage(TaskId.of(taskId), 7L, NOW, retryCount, "Model not loaded");
        DeadLetterEnvelope envelope = DeadLetterEnvelope.of(message, reason,
            retryCount > 0 ? FailureType.EXHAUSTED_RETRIES : FailureType.PERMANENT,
            retryCount > 0 ? ErrorType.EXHAUSTED_RETRIES : ErrorType.ITEM_NOT_FOUND, NOW);
        bus.publish(DLQ_TOPIC, deadLetterCodec.encode(envelope));
        return envelope;
    }

    // ============================================================
    // 1. 수신과 보관
    // ============================================================

    @Test
    void pollOnce_봉투를_보관하고_ack함() throws Exception {
        // given
        DeadLetterEnvelope envelope = publishDeadLetter(1L, 3, "Max retries exceeded (3): Model not loaded");

        // when
        boolean consumed = monitor.pollOnce();

        // then
        assertThat(consumed).isTrue();
        assertThat(monitor.recent()).containsExactly(envelope);
        assertThat(monitor.getReceivedCount()).isEqualTo(1);
        assertThat(bus.inFlightSize(DLQ_TOPIC)).isZero();
        assertThat(bus.queueSize(DLQ_TOPIC)).isZero();
    }

    @Test
    void pollOnce_비어있으면_false() throws Exception {
        assertThat(monitor.pollOnce()).isFalse();
    }

    @Test
    void pollOnce_읽을_수_없는_봉투도_ack하고_보관하지_않음() throws Exception {
        // given
        bus.publish(DLQ_TOPIC, deadLetterCodec.encodeMalformed("not-json", "Task payload is not valid JSON", NOW));

        // when
        boolean consumed = monitor.pollOnce();

        // then
        assertThat(consumed).isTrue();
        assertThat(monitor.recent()).isEmpty();
        assertThat(monitor.getUnreadableCount()).isEqualTo(1);
        assertThat(bus.inFlightSize(DLQ_TOPIC)).isZero();
    }

    @Test
    void recent_historySize를_넘으면_오래된_봉투부터_제거() throws Exception {
        // given
        monitor = newMonitor(new DeadLetterMonitorConfig(2, Duration.ofMillis(10)));
        publishDeadLetter(1L, 0, "Item not found: item_id=7");
        DeadLetterEnvelope second = publishDeadLetter(2L, 0, "Item not found: item_id=7");
        DeadLetterEnvelope third = publishDeadLetter(3L, 0, "Item not found: item_id=7");

        // when
        while (monitor.pollOnce()) {
            // drain
        }

        // then
        assertThat(monitor.recent()).containsExactly(second, third);
        assertThat(monitor.find(TaskId.of(1L))).isEmpty();
    }

    @Test
    void find_같은_Task의_가장_최근_봉투를_반환() throws Exception {
        // given
        publishDeadLetter(5L, 0, "first failure");
        DeadLetterEnvelope latest = publishDeadLetter(5L, 3, "second failure");
        monitor.pollOnce();
        monitor.pollOnce();

        // when
        Optional<DeadLetterEnvelope> found = monitor.find(TaskId.of(5L));

        // then
        assertThat(found).contains(latest);
    }

    // ============================================================
    // 2. replay
    // ============================================================

    @Test
    void replay_원본_메시지를_retry_count_0으로_task_토픽에_재발행() throws Exception {
        // given
        publishDeadLetter(9L, 3, "Max retries exceeded (3): Model not loaded");
        monitor.pollOnce();

        // when
        boolean replayed = monitor.replay(TaskId.of(9L));

        // then
        assertThat(replayed).isTrue();
        Optional<Delivery> delivery = bus.consume(TASK_TOPIC, Duration.ZERO);
        assertThat(delivery).isPresent();
        TaskMessage message = taskCodec.decode(delivery.get().payload());
        assertThat(message.taskId()).isEqualTo(TaskId.of(9L));
        assertThat(message.itemId()).isEqualTo(7L);
        assertThat(message.retryCount()).isZero();
        assertThat(message.lastError()).isNull();
    }

    @Test
    void replay_보관되지_않은_Task면_false이고_발행하지_않음() {
        // when
        boolean replayed = monitor.replay(TaskId.of(404L));

        // then
        assertThat(replayed).isFalse();
        assertThat(bus.queueSize(TASK_TOPIC)).isZero();
    }

    // ============================================================
    // 3. 스레드 구동
    // ============================================================

    @Test
    void start_모니터_스레드가_봉투를_수신하고_stop으로_종료() throws Exception {
        // given
        publishDeadLetter(1L, 0, "Item not found: item_id=7");

        // when
        monitor.start();
        long deadline = System.currentTimeMillis() + 5000;
        while (monitor.getReceivedCount() < 1 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        monitor.stop();

        // then
        assertThat(monitor.getReceivedCount()).isEqualTo(1);
        assertThat(monitor.isRunning()).isFalse();
    }
}
