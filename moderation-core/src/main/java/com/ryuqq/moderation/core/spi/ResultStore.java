package com.ryuqq.moderation.core.spi;

import com.ryuqq.moderation.core.model.ModerationResult;
import com.ryuqq.moderation.core.model.Prediction;
import com.ryuqq.moderation.core.model.TaskId;

import java.util.List;
import java.util.Optional;

/**
 * Result Store SPI.
 *
 * <p>Holds one {@link ModerationResult} per task id. The store is the source of
 * truth for idempotency: the worker reads it before doing any work, and the only
 * writes after creation are the two terminal transitions.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Reads are linearizable with respect to {@link #complete} and {@link #fail}</li>
 *   <li>{@link #complete} and {@link #fail} are single atomic conditional updates
 *       that apply only while the record is PENDING</li>
 *   <li>Terminal records are never modified again</li>
 * </ul>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public interface ResultStore {

    /**
     * Creates a PENDING record and assigns a new task id.
     *
     * @param itemId item to moderate (positive)
     * @return newly assigned task id
     * @throws IllegalArgumentException if itemId is not positive
     * @throws com.ryuqq.moderation.core.exception.InfrastructureException if the store is unreachable
     */
    TaskId createPending(long itemId);

    /**
     * Reads the current record.
     *
     * @param taskId task id
     * @return the record, or empty if none exists
     * @throws IllegalArgumentException if taskId is null
     * @throws com.ryuqq.moderation.core.exception.InfrastructureException if the store is unreachable
     */
    Optional<ModerationResult> get(TaskId taskId);

    /**
     * Transitions a PENDING record to COMPLETED.
     *
     * @param taskId task id
     * @param prediction inference result
     * @return true if this call performed the transition; false if the record is absent or already terminal
     * @throws IllegalArgumentException if an argument is null
     * @throws com.ryuqq.moderation.core.exception.InfrastructureException if the store is unreachable
     */
    boolean complete(TaskId taskId, Prediction prediction);

    /**
     * Transitions a PENDING record to FAILED.
     *
     * @param taskId task id
     * @param errorMessage failure description
     * @return true if this call performed the transition; false if the record is absent or already terminal
     * @throws IllegalArgumentException if an argument is null
     * @throws com.ryuqq.moderation.core.exception.InfrastructureException if the store is unreachable
     */
    boolean fail(TaskId taskId, String errorMessage);

    /**
     * Lists every task id created for an item, oldest first.
     *
     * @param itemId item id
     * @return task ids (possibly empty)
     */
    List<TaskId> findTaskIdsByItem(long itemId);
}
