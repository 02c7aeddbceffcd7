package com.ryuqq.moderation.adapter.runner;

import com.ryuqq.moderation.application.codec.DeadLetterCodec;
import com.ryuqq.moderation.application.codec.TaskMessageCodec;
import com.ryuqq.moderation.core.exception.MalformedMessageException;
import com.ryuqq.moderation.core.model.DeadLetterEnvelope;
import com.ryuqq.moderation.core.model.TaskId;
import com.ryuqq.moderation.core.model.TaskMessage;
import com.ryuqq.moderation.core.spi.Delivery;
import com.ryuqq.moderation.core.spi.MessageBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Dead-letter 토픽 모니터.
 *
 * <p>전용 스레드에서 dead-letter 토픽을 읽어 각 봉투를 로그에 남기고 ack합니다.
 * 최근 봉투는 historySize만큼 메모리에 보관되어 조회 및 재처리에 사용됩니다.</p>
 *
 * <p><strong>재처리 (replay):</strong></p>
 * <pre>
 * replay(taskId)
 *   ↓
 * 보관 중인 봉투 검색 (없으면 false)
 *   ↓
 * original_message.retry_count = 0 으로 초기화
 *   ↓
 * task 토픽으로 재발행
 * </pre>
 *
 * <p>replay는 Result Store를 변경하지 않습니다. 이미 종료된 레코드의 Task는 Worker가
 * 중복으로 판단하여 버리므로, 실제로 재처리되는 것은 레코드가 아직 PENDING인 Task뿐입니다.</p>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public final class DeadLetterMonitor {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterMonitor.class);

    private final MessageBus messageBus;
    private final TopicConfig topics;
    private final DeadLetterCodec deadLetterCodec;
    private final TaskMessageCodec taskCodec;
    private final DeadLetterMonitorConfig config;

    private final Deque<DeadLetterEnvelope> history = new ArrayDeque<>();
    private final AtomicLong receivedCount = new AtomicLong();
    private final AtomicLong unreadableCount = new AtomicLong();

    private volatile boolean running;
    private Thread thread;

    /**
     * 생성자.
     *
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DeadLetterMonitor(
        MessageBus messageBus,
        TopicConfig topics,
        DeadLetterCodec deadLetterCodec,
        TaskMessageCodec taskCodec,
        DeadLetterMonitorConfig config
    ) {
        if (messageBus == null) {
            throw new IllegalArgumentException("messageBus cannot be null");
        }
        if (topics == null) {
            throw new IllegalArgumentException("topics cannot be null");
        }
        if (deadLetterCodec == null) {
            throw new IllegalArgumentException("deadLetterCodec cannot be null");
        }
        if (taskCodec == null) {
            throw new IllegalArgumentException("taskCodec cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.messageBus = messageBus;
        this.topics = topics;
        this.deadLetterCodec = deadLetterCodec;
        this.taskCodec = taskCodec;
        this.config = config;
    }

    /**
     * 모니터 스레드 시작.
     *
     * @throws IllegalStateException 이미 시작된 경우
     */
    public synchronized void start() {
        if (thread != null) {
            throw new IllegalStateException("DeadLetterMonitor already started");
        }
        running = true;
        thread = new Thread(this::runLoop, "moderation-dlq-monitor");
        thread.setUncaughtExceptionHandler((t, e) -> log.error("DeadLetterMonitor thread died", e));
        thread.start();
        log.info("DeadLetterMonitor started: topic={}, historySize={}", topics.deadLetter(), config.historySize());
    }

    private void runLoop() {
        while (running) {
            try {
                pollOnce();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("DeadLetterMonitor poll failed", e);
            }
        }
    }

    /**
     * 모니터 스레드 종료.
     *
     * <p>현재 poll이 끝날 때까지 최대 pollTimeout만큼 기다린 뒤 인터럽트합니다.</p>
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public void stop() throws InterruptedException {
        Thread toStop;
        synchronized (this) {
            running = false;
            toStop = thread;
        }
        if (toStop == null) {
            return;
        }
        toStop.join(config.pollTimeout().toMillis() * 2);
        if (toStop.isAlive()) {
            toStop.interrupt();
            toStop.join();
        }
        log.info("DeadLetterMonitor stopped: received={}, unreadable={}", receivedCount.get(), unreadableCount.get());
    }

    /**
     * Dead-letter 토픽에서 봉투 하나를 읽어 기록하고 ack.
     *
     * @return 봉투를 하나 읽었으면 true
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public boolean pollOnce() throws InterruptedException {
        Optional<Delivery> delivery = messageBus.consume(topics.deadLetterTopic(), config.pollTimeout());
        if (delivery.isEmpty()) {
            return false;
        }

        String payload = delivery.get().payload();
        try {
            DeadLetterEnvelope envelope = deadLetterCodec.decode(payload);
            remember(envelope);
            receivedCount.incrementAndGet();
            log.warn("Dead letter received: taskId={}, itemId={}, type={}, errorCode={}, retryCount={}, reason={}",
                envelope.taskId(), envelope.originalMessage().itemId(), envelope.failureType(),
                envelope.errorCode(), envelope.retryCountAtFailure(), envelope.failureReason());
        } catch (MalformedMessageException e) {
            unreadableCount.incrementAndGet();
            log.error("Unreadable dead letter: reason={}, payload={}", e.getMessage(), payload);
        }

        try {
            messageBus.ack(delivery.get().handle());
        } catch (RuntimeException e) {
            log.warn("Dead letter ack failed: handle={}", delivery.get().handle(), e);
        }
        return true;
    }

    private void remember(DeadLetterEnvelope envelope) {
        synchronized (history) {
            history.addLast(envelope);
            while (history.size() > config.historySize()) {
                history.removeFirst();
            }
        }
    }

    /**
     * 보관 중인 최근 봉투 (오래된 것부터).
     *
     * @return 봉투 목록 복사본
     */
    public List<DeadLetterEnvelope> recent() {
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    /**
     * Task ID로 가장 최근 봉투 조회.
     *
     * @param taskId Task ID
     * @return 봉투, 보관 중이 아니면 empty
     * @throws IllegalArgumentException taskId가 null인 경우
     */
    public Optional<DeadLetterEnvelope> find(TaskId taskId) {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        synchronized (history) {
            Iterator<DeadLetterEnvelope> newestFirst = history.descendingIterator();
            while (newestFirst.hasNext()) {
                DeadLetterEnvelope envelope = newestFirst.next();
                if (envelope.taskId().equals(taskId)) {
                    return Optional.of(envelope);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * 보관 중인 봉투의 원본 메시지를 retry_count=0으로 task 토픽에 재발행.
     *
     * @param taskId Task ID
     * @return 재발행했으면 true, 보관 중인 봉투가 없으면 false
     * @throws IllegalArgumentException taskId가 null인 경우
     */
    public boolean replay(TaskId taskId) {
        Optional<DeadLetterEnvelope> envelope = find(taskId);
        if (envelope.isEmpty()) {
            log.warn("Replay requested for unknown dead letter: taskId={}", taskId);
            return false;
        }

        TaskMessage replayed = envelope.get().originalMessage().resetForReplay();
        messageBus.publish(topics.taskTopic(), taskCodec.encode(replayed));
        log.info("Dead letter replayed: taskId={}, itemId={}, previousRetryCount={}",
            taskId, replayed.itemId(), envelope.get().retryCountAtFailure());
        return true;
    }

    public boolean isRunning() {
        return running;
    }

    public long getReceivedCount() {
        return receivedCount.get();
    }

    public long getUnreadableCount() {
        return unreadableCount.get();
    }
}
