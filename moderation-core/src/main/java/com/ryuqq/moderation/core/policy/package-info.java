/**
 * Retry and dead-letter routing.
 *
 * <p>{@link com.ryuqq.moderation.core.policy.RetryPolicy} turns an
 * {@link com.ryuqq.moderation.core.outcome.Outcome} plus the message's retry count
 * into a {@link com.ryuqq.moderation.core.policy.RoutingDecision}. It performs no I/O.</p>
 *
 * @since 1.0.0
 * @author Moderation Team
 */
package com.ryuqq.moderation.core.policy;
