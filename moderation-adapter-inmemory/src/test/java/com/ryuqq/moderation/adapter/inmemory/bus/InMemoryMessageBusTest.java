package com.ryuqq.moderation.adapter.inmemory.bus;

import com.ryuqq.moderation.core.spi.Delivery;
import com.ryuqq.moderation.core.spi.Topic;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryMessageBus 테스트.
 *
 * @author Moderation Team
 * @since 1.0.0
 */
class InMemoryMessageBusTest {

    private static final Topic TASKS = Topic.of("moderation");
    private static final Topic RETRIES = Topic.of("moderation_retry");

    private InMemoryMessageBus bus;

    @BeforeEach
    void setUp() {
        bus = new InMemoryMessageBus();
    }

    // ============================================================
    // 1. publish / consume / ack
    // ============================================================

    @Test
    void consume_발행_순서대로_전달됨() throws InterruptedException {
        // given
        bus.publish(TASKS, "a");
        bus.publish(TASKS, "b");

        // when
        Delivery first = bus.consume(TASKS, Duration.ZERO).orElseThrow();
        Delivery second = bus.consume(TASKS, Duration.ZERO).orElseThrow();

        // then
        assertThat(first.payload()).isEqualTo("a");
        assertThat(second.payload()).isEqualTo("b");
        assertThat(first.deliveryCount()).isEqualTo(1);
        assertThat(first.isRedelivery()).isFalse();
    }

    @Test
    void consume_토픽끼리_격리됨() throws InterruptedException {
        // given
        bus.publish(TASKS, "task");

        // when & then
        assertThat(bus.consume(RETRIES, Duration.ZERO)).isEmpty();
        assertThat(bus.consume(TASKS, Duration.ZERO)).isPresent();
    }

    @Test
    void consume_빈_토픽은_timeout_후_empty() throws InterruptedException {
        // when
        long start = System.nanoTime();
        Optional<Delivery> delivery = bus.consume(TASKS, Duration.ofMillis(50));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        // then
        assertThat(delivery).isEmpty();
        assertThat(elapsedMs).isGreaterThanOrEqualTo(40);
    }

    @Test
    void ack_후에는_재전달되지_않음() throws InterruptedException {
        // given
        bus.publish(TASKS, "a");
        Delivery delivery = bus.consume(TASKS, Duration.ZERO).orElseThrow();

        // when
        bus.ack(delivery.handle());
        bus.ack(delivery.handle()); // idempotent

        // then
        assertThat(bus.inFlightSize(TASKS)).isZero();
        assertThat(bus.expireVisibilityTimeouts(TASKS)).isZero();
        assertThat(bus.consume(TASKS, Duration.ZERO)).isEmpty();
    }

    // ============================================================
    // 2. 지연 발행
    // ============================================================

    @Test
    void publishDelayed_지연_전에는_보이지_않음() throws InterruptedException {
        // given
        bus.publishDelayed(RETRIES, "later", Duration.ofSeconds(10));

        // when & then
        assertThat(bus.consume(RETRIES, Duration.ZERO)).isEmpty();
        assertThat(bus.queuedMessages(RETRIES))
            .singleElement()
            .satisfies(m -> assertThat(m.requestedDelay()).isEqualTo(Duration.ofSeconds(10)));
    }

    @Test
    void publishDelayed_지연_경과_후_전달됨() throws InterruptedException {
        // given
        bus.publishDelayed(RETRIES, "soon", Duration.ofMillis(30));

        // when
        Optional<Delivery> delivery = bus.consume(RETRIES, Duration.ofSeconds(2));

        // then
        assertThat(delivery).map(Delivery::payload).contains("soon");
    }

    @Test
    void expireDelays_지연_메시지를_즉시_보이게_함() throws InterruptedException {
        // given
        bus.publishDelayed(RETRIES, "x", Duration.ofMinutes(5));

        // when
        int expired = bus.expireDelays(RETRIES);

        // then
        assertThat(expired).isEqualTo(1);
        assertThat(bus.consume(RETRIES, Duration.ZERO)).map(Delivery::payload).contains("x");
    }

    @Test
    void publishDelayed_음수_지연은_예외() {
        assertThatThrownBy(() -> bus.publishDelayed(TASKS, "x", Duration.ofMillis(-1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("delay cannot be null or negative");
    }

    // ============================================================
    // 3. 재전달 (at-least-once)
    // ============================================================

    @Test
    void nack_즉시_재전달되고_deliveryCount가_증가함() throws InterruptedException {
        // given
        bus.publish(TASKS, "a");
        Delivery first = bus.consume(TASKS, Duration.ZERO).orElseThrow();

        // when
        bus.nack(first.handle());
        Delivery second = bus.consume(TASKS, Duration.ZERO).orElseThrow();

        // then
        assertThat(second.payload()).isEqualTo("a");
        assertThat(second.deliveryCount()).isEqualTo(2);
        assertThat(second.isRedelivery()).isTrue();
        assertThat(second.handle()).isNotEqualTo(first.handle());
    }

    @Test
    void visibility_timeout_만료_시_다음_consume에서_재전달됨() throws InterruptedException {
        // given
        InMemoryMessageBus shortTimeout = new InMemoryMessageBus(20);
        shortTimeout.publish(TASKS, "a");
        Delivery first = shortTimeout.consume(TASKS, Duration.ZERO).orElseThrow();

        // when
        Thread.sleep(50);
        Optional<Delivery> redelivered = shortTimeout.consume(TASKS, Duration.ZERO);

        // then
        assertThat(redelivered).isPresent();
        assertThat(redelivered.get().deliveryCount()).isEqualTo(2);

        // 만료된 handle의 ack는 no-op
        shortTimeout.ack(first.handle());
        assertThat(shortTimeout.inFlightSize(TASKS)).isEqualTo(1);
    }

    @Test
    void expireVisibilityTimeouts_미확인_메시지를_큐로_되돌림() throws InterruptedException {
        // given
        bus.publish(TASKS, "a");
        bus.consume(TASKS, Duration.ZERO).orElseThrow();

        // when
        int returned = bus.expireVisibilityTimeouts(TASKS);

        // then
        assertThat(returned).isEqualTo(1);
        assertThat(bus.queueSize(TASKS)).isEqualTo(1);
        assertThat(bus.inFlightSize(TASKS)).isZero();
    }

    // ============================================================
    // 4. 동시성
    // ============================================================

    @Test
    void consume_동시_소비자는_같은_메시지를_중복으로_받지_않음() throws InterruptedException {
        // given
        int messages = 200;
        for (int i = 0; i < messages; i++) {
            bus.publish(TASKS, "m" + i);
        }
        Set<String> seen = ConcurrentHashMap.newKeySet();
        List<String> duplicates = new ArrayList<>();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(4);

        // when
        for (int t = 0; t < 4; t++) {
            executor.submit(() -> {
                try {
                    Optional<Delivery> delivery;
                    while ((delivery = bus.consume(TASKS, Duration.ZERO)).isPresent()) {
                        if (!seen.add(delivery.get().payload())) {
                            synchronized (duplicates) {
                                duplicates.add(delivery.get().payload());
                            }
                        }
                        bus.ack(delivery.get().handle());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        done.await(5, TimeUnit.SECONDS);
        executor.shutdownNow();

        // then
        assertThat(seen).hasSize(messages);
        assertThat(duplicates).isEmpty();
    }
}
