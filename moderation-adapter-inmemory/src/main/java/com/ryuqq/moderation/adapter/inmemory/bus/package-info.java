/**
 * In-memory message bus adapter.
 *
 * <p>Provides {@link com.ryuqq.moderation.adapter.inmemory.bus.InMemoryMessageBus}, a
 * thread-safe implementation of {@link com.ryuqq.moderation.core.spi.MessageBus} with
 * delayed delivery and visibility timeouts, for tests and single-process deployments.</p>
 *
 * @since 1.0.0
 * @author Moderation Team
 */
package com.ryuqq.moderation.adapter.inmemory.bus;
