/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the interfaces that infrastructure adapters implement
 * so the worker pipeline never depends on a concrete bus, store, cache or model.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.moderation.core.spi.MessageBus} - At-least-once topic bus with delayed publish</li>
 *   <li>{@link com.ryuqq.moderation.core.spi.ResultStore} - Per-task lifecycle record, source of idempotency</li>
 *   <li>{@link com.ryuqq.moderation.core.spi.PredictionCache} - Optional read-through cache keyed by fingerprint</li>
 *   <li>{@link com.ryuqq.moderation.core.spi.ItemRepository} - Item content lookup</li>
 *   <li>{@link com.ryuqq.moderation.core.spi.ModerationModel} - Immutable shared classifier</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., moderation-adapter-inmemory) provide concrete implementations.</p>
 *
 * @since 1.0.0
 * @author Moderation Team
 */
package com.ryuqq.moderation.core.spi;
