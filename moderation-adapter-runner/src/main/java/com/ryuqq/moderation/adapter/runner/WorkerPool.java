package com.ryuqq.moderation.adapter.runner;

import com.ryuqq.moderation.application.runtime.Runtime;
import com.ryuqq.moderation.core.spi.Delivery;
import com.ryuqq.moderation.core.spi.MessageBus;
import com.ryuqq.moderation.core.statemachine.WorkerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 고정 크기 Worker 스레드 풀.
 *
 * <p>각 스레드는 {@link #pump()}를 반복 호출하며, 한 번에 메시지 하나를 끝까지 처리한 뒤
 * 다음 메시지를 가져옵니다.</p>
 *
 * <p><strong>소비 순서:</strong></p>
 * <pre>
 * pump() 호출
 *   ↓
 * retry 토픽 consume (대기 없음)
 *   ↓ 비어 있으면
 * task 토픽 consume (pollTimeout 대기)
 *   ↓
 * ModerationWorker.process(delivery)
 * </pre>
 *
 * <p><strong>종료 절차 (graceful shutdown):</strong></p>
 * <ol>
 *   <li>새 메시지 fetch 중단</li>
 *   <li>진행 중 작업 완료 대기 (shutdownTimeout)</li>
 *   <li>시간 초과 시 인터럽트 (shutdownNow)</li>
 * </ol>
 *
 * <p>Worker가 던진 {@link Error}는 해당 스레드를 종료시키며, 풀이 실행 중이면 같은 루프를
 * 새 스레드에서 다시 시작하여 소비자 수를 concurrency로 유지합니다.</p>
 *
 * <p>{@link #start()} 없이 {@link #pump()}를 직접 호출하여 동기적으로 구동할 수도 있습니다.</p>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public final class WorkerPool implements Runtime {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final MessageBus messageBus;
    private final ModerationWorker worker;
    private final TopicConfig topics;
    private final WorkerConfig config;
    private final Map<WorkerState, AtomicLong> settledCounts;
    private final AtomicInteger activeThreads = new AtomicInteger();
    private final AtomicLong restartedLoops = new AtomicLong();

    private volatile boolean running;
    private volatile boolean shutdown;
    private ExecutorService executor;

    /**
     * WorkerPool 생성.
     *
     * @param messageBus 메시지 버스
     * @param worker 메시지 처리 Worker
     * @param topics 토픽 설정
     * @param config Worker 설정
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public WorkerPool(MessageBus messageBus, ModerationWorker worker, TopicConfig topics, WorkerConfig config) {
        if (messageBus == null) {
            throw new IllegalArgumentException("messageBus cannot be null");
        }
        if (worker == null) {
            throw new IllegalArgumentException("worker cannot be null");
        }
        if (topics == null) {
            throw new IllegalArgumentException("topics cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        this.messageBus = messageBus;
        this.worker = worker;
        this.topics = topics;
        this.config = config;
        this.settledCounts = new EnumMap<>(WorkerState.class);
        for (WorkerState state : WorkerState.values()) {
            if (state.isTerminal()) {
                settledCounts.put(state, new AtomicLong());
            }
        }
    }

    /**
     * concurrency 개수만큼 Worker 스레드를 시작.
     *
     * @throws IllegalStateException 이미 시작되었거나 종료된 경우
     */
    public synchronized void start() {
        if (shutdown) {
            throw new IllegalStateException("WorkerPool has been shut down");
        }
        if (executor != null) {
            throw new IllegalStateException("WorkerPool already started");
        }

        running = true;
        executor = Executors.newFixedThreadPool(config.concurrency(), new WorkerThreadFactory());
        for (int i = 0; i < config.concurrency(); i++) {
            executor.execute(this::runLoop);
        }
        log.info("WorkerPool started: concurrency={}, taskTopic={}, retryTopic={}",
            config.concurrency(), topics.task(), topics.retry());
    }

    private void runLoop() {
        activeThreads.incrementAndGet();
        try {
            while (running && !Thread.currentThread().isInterrupted()) {
                pumpOnce();
            }
        } catch (Error e) {
            log.error("Worker loop died, restarting on a new thread: thread={}", Thread.currentThread().getName(), e);
            restartLoop();
            throw e;
        } finally {
            activeThreads.decrementAndGet();
        }
    }

    private synchronized void restartLoop() {
        if (!running || executor == null) {
            return;
        }
        try {
            executor.execute(this::runLoop);
            restartedLoops.incrementAndGet();
        } catch (RejectedExecutionException e) {
            log.warn("Worker loop not restarted, pool is shutting down");
        }
    }

    @Override
    public boolean pump() {
        if (shutdown) {
            throw new IllegalStateException("WorkerPool has been shut down");
        }
        return pumpOnce();
    }

    private boolean pumpOnce() {
        Optional<Delivery> delivery;
        try {
            delivery = fetch();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (RuntimeException e) {
            log.error("Failed to consume from bus", e);
            return false;
        }

        if (delivery.isEmpty()) {
            return false;
        }

        WorkerState settled;
        try {
            settled = worker.process(delivery.get());
        } catch (RuntimeException e) {
            log.error("Unhandled error while processing delivery, releasing: topic={}", delivery.get().topic(), e);
            releaseQuietly(delivery.get());
            settled = WorkerState.RELEASED;
        }
        settledCounts.get(settled).incrementAndGet();
        return true;
    }

    private Optional<Delivery> fetch() throws InterruptedException {
        if (topics.hasSeparateRetryTopic()) {
            Optional<Delivery> retry = messageBus.consume(topics.retryTopic(), Duration.ZERO);
            if (retry.isPresent()) {
                return retry;
            }
        }
        return messageBus.consume(topics.taskTopic(), config.pollTimeout());
    }

    private void releaseQuietly(Delivery delivery) {
        try {
            messageBus.nack(delivery.handle());
        } catch (RuntimeException e) {
            log.error("Nack failed, delivery waits for visibility timeout: handle={}", delivery.handle(), e);
        }
    }

    /**
     * WorkerPool 종료 (graceful shutdown).
     *
     * <p>새 메시지 fetch를 멈추고 진행 중인 작업이 shutdownTimeout 안에 끝나기를 기다립니다.
     * 시간 안에 끝나지 않으면 스레드를 인터럽트합니다.</p>
     *
     * @return 모든 작업이 제한 시간 안에 끝났으면 true
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public boolean shutdown() throws InterruptedException {
        ExecutorService toStop;
        synchronized (this) {
            if (shutdown) {
                return true;
            }
            shutdown = true;
            running = false;
            toStop = executor;
        }
        if (toStop == null) {
            return true;
        }

        log.info("WorkerPool shutting down: shutdownTimeout={}ms", config.shutdownTimeout().toMillis());
        toStop.shutdown();
        try {
            if (!toStop.awaitTermination(config.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("WorkerPool did not stop within {}ms, interrupting workers",
                    config.shutdownTimeout().toMillis());
                toStop.shutdownNow();
                return false;
            }
        } catch (InterruptedException e) {
            toStop.shutdownNow();
            throw e;
        }
        log.info("WorkerPool stopped");
        return true;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * 현재 루프를 돌고 있는 Worker 스레드 수.
     */
    public int getActiveThreads() {
        return activeThreads.get();
    }

    /**
     * {@link Error}로 죽은 뒤 새 스레드에서 다시 시작된 Worker 루프 수.
     */
    public long getRestartedLoopCount() {
        return restartedLoops.get();
    }

    /**
     * 주어진 최종 상태로 끝난 배달 수.
     *
     * @param state 종료 상태 (ACKED, DEAD_LETTERED, RELEASED)
     * @return 처리 건수
     * @throws IllegalArgumentException 종료 상태가 아닌 경우
     */
    public long getSettledCount(WorkerState state) {
        AtomicLong count = state == null ? null : settledCounts.get(state);
        if (count == null) {
            throw new IllegalArgumentException("state must be terminal (current: " + state + ")");
        }
        return count.get();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "moderation-worker-" + sequence.incrementAndGet());
            thread.setUncaughtExceptionHandler((t, e) -> log.error("Worker thread died: {}", t.getName(), e));
            return thread;
        }
    }
}
