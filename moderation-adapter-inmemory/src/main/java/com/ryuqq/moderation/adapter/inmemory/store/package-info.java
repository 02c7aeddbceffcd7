/**
 * In-memory Result Store and Item Repository adapters.
 *
 * @since 1.0.0
 * @author Moderation Team
 */
package com.ryuqq.moderation.adapter.inmemory.store;
