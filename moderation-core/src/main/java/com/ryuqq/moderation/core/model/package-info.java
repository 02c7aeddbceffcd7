/**
 * Core domain model of the moderation pipeline.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.moderation.core.model.TaskId} - Task identifier and idempotency key</li>
 *   <li>{@link com.ryuqq.moderation.core.model.Fingerprint} - Content hash used as the cache key</li>
 *   <li>{@link com.ryuqq.moderation.core.model.Prediction} - Model output (violation flag, probability)</li>
 * </ul>
 *
 * <h2>Messages and Records</h2>
 * <ul>
 *   <li>{@link com.ryuqq.moderation.core.model.TaskMessage} - Task published to the bus</li>
 *   <li>{@link com.ryuqq.moderation.core.model.DeadLetterEnvelope} - Dead-lettered task with failure metadata</li>
 *   <li>{@link com.ryuqq.moderation.core.model.ModerationResult} - Result Store row</li>
 *   <li>{@link com.ryuqq.moderation.core.model.Item} - Item content as loaded for inference</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Every type is a record or a final class with final fields</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Moderation Team
 */
package com.ryuqq.moderation.core.model;
