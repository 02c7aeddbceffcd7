/**
 * Failure taxonomy of the moderation pipeline.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.moderation.core.exception.ModelUnavailableException} - transient</li>
 *   <li>{@link com.ryuqq.moderation.core.exception.InfrastructureException} - transient</li>
 *   <li>{@link com.ryuqq.moderation.core.exception.ItemNotFoundException} - permanent</li>
 *   <li>{@link com.ryuqq.moderation.core.exception.MalformedMessageException} - permanent</li>
 * </ul>
 *
 * <p>{@link com.ryuqq.moderation.core.exception.ErrorType#EXHAUSTED_RETRIES} is derived by the
 * retry policy and has no exception class.</p>
 *
 * @since 1.0.0
 * @author Moderation Team
 */
package com.ryuqq.moderation.core.exception;
