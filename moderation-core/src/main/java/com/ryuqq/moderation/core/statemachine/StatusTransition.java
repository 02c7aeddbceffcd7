package com.ryuqq.moderation.core.statemachine;

/**
 * Result Store 상태 전이 검증.
 *
 * <p>허용되는 전이는 PENDING → COMPLETED, PENDING → FAILED 뿐이며,
 * 종료 상태에서의 전이는 모두 거부됩니다.</p>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public final class StatusTransition {

    // Utility class - prevent instantiation
    private StatusTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(ModerationStatus from, ModerationStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        if (!to.isTerminal()) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이가 허용되는지 여부 (예외 없이).
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용되면 true
     */
    public static boolean isAllowed(ModerationStatus from, ModerationStatus to) {
        return from == ModerationStatus.PENDING && to != null && to.isTerminal();
    }
}
