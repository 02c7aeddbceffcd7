/**
 * Task processing outcome package.
 *
 * <p>This package defines the sealed interface hierarchy the worker produces for every
 * delivered task. The retry policy consumes an outcome together with the current retry
 * count and turns it into a routing decision.</p>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.moderation.core.outcome.Ok} - Result persisted</li>
 *   <li>{@link com.ryuqq.moderation.core.outcome.Duplicate} - Redelivery of a terminal task</li>
 *   <li>{@link com.ryuqq.moderation.core.outcome.Retry} - Transient failure (retryable)</li>
 *   <li>{@link com.ryuqq.moderation.core.outcome.Fail} - Permanent failure (non-retryable)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Moderation Team
 */
package com.ryuqq.moderation.core.outcome;
