/**
 * YAML configuration for the moderation worker.
 *
 * <p>{@link com.ryuqq.moderation.adapter.runner.config.ModerationConfigLoader} reads
 * {@code moderation.yaml} into {@link com.ryuqq.moderation.adapter.runner.config.ModerationProperties},
 * which converts each section to the immutable runner configuration records.</p>
 */
package com.ryuqq.moderation.adapter.runner.config;
