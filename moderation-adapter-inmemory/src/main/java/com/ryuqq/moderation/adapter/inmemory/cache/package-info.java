/**
 * In-memory prediction cache adapter.
 *
 * @since 1.0.0
 * @author Moderation Team
 */
package com.ryuqq.moderation.adapter.inmemory.cache;
