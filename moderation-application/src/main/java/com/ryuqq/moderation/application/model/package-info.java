/**
 * Built-in moderation model.
 *
 * @since 1.0.0
 * @author Moderation Team
 */
package com.ryuqq.moderation.application.model;
