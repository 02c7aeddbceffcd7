/**
 * JSON wire codecs for bus payloads.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.moderation.application.codec.TaskMessageCodec} - task topic and retry topic payloads</li>
 *   <li>{@link com.ryuqq.moderation.application.codec.DeadLetterCodec} - dead-letter topic payloads</li>
 * </ul>
 *
 * <p>Decoding failures surface as
 * {@link com.ryuqq.moderation.core.exception.MalformedMessageException}, which the worker
 * treats as a permanent failure.</p>
 *
 * @since 1.0.0
 * @author Moderation Team
 */
package com.ryuqq.moderation.application.codec;
