/**
 * Runtime contract for message-driven task processing.
 *
 * <p>{@link com.ryuqq.moderation.application.runtime.Runtime} is implemented by the
 * worker pool in moderation-adapter-runner.</p>
 *
 * @since 1.0.0
 * @author Moderation Team
 */
package com.ryuqq.moderation.application.runtime;
