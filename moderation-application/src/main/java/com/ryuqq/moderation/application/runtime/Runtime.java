package com.ryuqq.moderation.application.runtime;

/**
 * Asynchronous moderation runtime.
 *
 * <p>This interface defines the core runtime behavior for asynchronous task
 * processing via message bus polling.</p>
 *
 * <p><strong>Runtime Operation Flow:</strong></p>
 * <pre>
 * pump() starts
 *   ↓
 * while (running):
 *   1. Consume one message (retry topic first, then task topic)
 *   2. Decode TaskMessage
 *   3. Terminal check against Result Store → duplicate? ack and continue
 *   4. Load item → fingerprint → cache check → (miss) model inference
 *   5. Result Store complete → ack
 *   6. On failure: RetryPolicy → delayed republish or dead-letter
 * </pre>
 *
 * <p><strong>Execution Context:</strong></p>
 * <ul>
 *   <li>pump() is invoked repeatedly by each worker thread</li>
 *   <li>Implementations must be thread-safe: many workers pump concurrently</li>
 *   <li>Graceful shutdown: a stopped runtime returns from pump() without consuming</li>
 * </ul>
 *
 * <p><strong>Error Handling Strategy:</strong></p>
 * <ul>
 *   <li>Transient errors → delayed retry with exponential backoff</li>
 *   <li>Permanent errors → Result Store FAILED, publish to the dead-letter topic</li>
 *   <li>Per-message exceptions never escape pump()</li>
 * </ul>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public interface Runtime {

    /**
     * Executes a single pump cycle: consume, process, settle.
     *
     * <p><strong>Processing Guarantees:</strong></p>
     * <ul>
     *   <li>At-least-once processing: Messages may be processed multiple times</li>
     *   <li>Idempotency: A message for a terminal task is acknowledged without work</li>
     *   <li>Durability: The Result Store is written before the message is acknowledged</li>
     * </ul>
     *
     * <p><strong>Blocking Behavior:</strong></p>
     * <ul>
     *   <li>Blocks at most for the configured poll timeout when the bus is empty</li>
     *   <li>Returns after processing one message or if nothing was visible</li>
     *   <li>Caller is responsible for continuous invocation (loop)</li>
     * </ul>
     *
     * @return true if a message was consumed in this cycle
     * @throws IllegalStateException if the runtime has been shut down
     */
    boolean pump();
}
