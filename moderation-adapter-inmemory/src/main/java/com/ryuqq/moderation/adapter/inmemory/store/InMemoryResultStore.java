package com.ryuqq.moderation.adapter.inmemory.store;

import com.ryuqq.moderation.core.model.ModerationResult;
import com.ryuqq.moderation.core.model.Prediction;
import com.ryuqq.moderation.core.model.TaskId;
import com.ryuqq.moderation.core.spi.ResultStore;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * In-memory implementation of {@link ResultStore} SPI for testing and reference purposes.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>results:</strong> ConcurrentHashMap&lt;TaskId, ModerationResult&gt; - one immutable record per task</li>
 *   <li><strong>sequence:</strong> AtomicLong - task id generator (1, 2, 3, ...)</li>
 * </ul>
 *
 * <p><strong>Concurrency:</strong></p>
 * <ul>
 *   <li>Reads are linearizable (ConcurrentHashMap get)</li>
 *   <li>complete / fail run inside {@link ConcurrentHashMap#compute}, so the PENDING check
 *       and the terminal write are one atomic step per key</li>
 *   <li>Of two racing terminal writes exactly one returns true</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ResultStore store = new InMemoryResultStore();
 *
 * // 1. PENDING 레코드 생성
 * TaskId taskId = store.createPending(42L);
 *
 * // 2. 종료 상태로 전이 (한 번만 성공)
 * boolean applied = store.complete(taskId, Prediction.of(true, 0.91));
 * </pre>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public class InMemoryResultStore implements ResultStore {

    private final ConcurrentHashMap<TaskId, ModerationResult> results;
    private final AtomicLong sequence;
    private final Clock clock;

    /**
     * Creates a new store using the system UTC clock.
     */
    public InMemoryResultStore() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a new store with a custom clock.
     *
     * @param clock clock for createdAt / processedAt
     * @throws IllegalArgumentException if clock is null
     */
    public InMemoryResultStore(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.results = new ConcurrentHashMap<>();
        this.sequence = new AtomicLong();
        this.clock = clock;
    }

    @Override
    public TaskId createPending(long itemId) {
        if (itemId <= 0) {
            throw new IllegalArgumentException("itemId must be positive (current: " + itemId + ")");
        }
        TaskId taskId = TaskId.of(sequence.incrementAndGet());
        results.put(taskId, ModerationResult.pending(taskId, itemId, clock.instant()));
        return taskId;
    }

    @Override
    public Optional<ModerationResult> get(TaskId taskId) {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        return Optional.ofNullable(results.get(taskId));
    }

    @Override
    public boolean complete(TaskId taskId, Prediction prediction) {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (prediction == null) {
            throw new IllegalArgumentException("prediction cannot be null");
        }
        return transitionIfPending(taskId, current -> current.complete(prediction, clock.instant()));
    }

    @Override
    public boolean fail(TaskId taskId, String errorMessage) {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (errorMessage == null || errorMessage.isBlank()) {
            throw new IllegalArgumentException("errorMessage cannot be null or blank");
        }
        return transitionIfPending(taskId, current -> current.fail(errorMessage, clock.instant()));
    }

    @Override
    public List<TaskId> findTaskIdsByItem(long itemId) {
        return results.values().stream()
            .filter(result -> result.itemId() == itemId)
            .map(ModerationResult::taskId)
            .sorted(Comparator.comparingLong(TaskId::getValue))
            .toList();
    }

    /**
     * Returns the number of stored records. Used for test assertions.
     *
     * @return record count
     */
    public int size() {
        return results.size();
    }

    /**
     * Removes all records. Used for test cleanup.
     */
    public void clear() {
        results.clear();
    }

    private boolean transitionIfPending(TaskId taskId, UnaryOperator<ModerationResult> transition) {
        AtomicBoolean applied = new AtomicBoolean(false);
        results.computeIfPresent(taskId, (id, current) -> {
            if (current.isTerminal()) {
                return current;
            }
            applied.set(true);
            return transition.apply(current);
        });
        return applied.get();
    }
}
