/**
 * State machines of the moderation pipeline.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.moderation.core.statemachine.ModerationStatus} - Result record lifecycle (enum)</li>
 *   <li>{@link com.ryuqq.moderation.core.statemachine.StatusTransition} - Result record transition validation</li>
 *   <li>{@link com.ryuqq.moderation.core.statemachine.WorkerState} - Per-task worker states (enum)</li>
 *   <li>{@link com.ryuqq.moderation.core.statemachine.WorkerStateTransition} - Worker transition validation</li>
 * </ul>
 *
 * <h2>Result Record Rules</h2>
 * <pre>
 * PENDING → COMPLETED
 * PENDING → FAILED
 *
 * Forbidden:
 * - COMPLETED → * (terminal state)
 * - FAILED → * (terminal state)
 * </pre>
 *
 * @since 1.0.0
 * @author Moderation Team
 */
package com.ryuqq.moderation.core.statemachine;
