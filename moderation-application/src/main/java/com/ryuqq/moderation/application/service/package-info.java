/**
 * Intake boundary: submit moderation requests and look up results.
 *
 * @since 1.0.0
 * @author Moderation Team
 */
package com.ryuqq.moderation.application.service;
