package com.ryuqq.moderation.core.statemachine;

/**
 * Worker 상태 전이 검증.
 *
 * <p>비종료 상태에서는 언제든 RETRYING, DEAD_LETTERED, RELEASED로 빠질 수 있고,
 * 그 외에는 정상 경로의 다음 단계로만 전이할 수 있습니다.</p>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public final class WorkerStateTransition {

    // Utility class - prevent instantiation
    private WorkerStateTransition() {
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
    public static void validate(WorkerState from, WorkerState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        if (!isAllowed(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static WorkerState transition(WorkerState current, WorkerState next) {
        validate(current, next);
        return next;
    }

    private static boolean isAllowed(WorkerState from, WorkerState to) {
        // 실패 경로: IDLE을 제외한 비종료 상태에서 허용
        if (from != WorkerState.IDLE
            && (to == WorkerState.DEAD_LETTERED || to == WorkerState.RELEASED)) {
            return true;
        }
        if (to == WorkerState.RETRYING) {
            return from != WorkerState.IDLE && from != WorkerState.RETRYING;
        }

        return switch (from) {
            case IDLE -> to == WorkerState.FETCHED;
            case FETCHED -> to == WorkerState.CACHE_CHECKED || to == WorkerState.ACKED;
            case CACHE_CHECKED -> to == WorkerState.CACHE_HIT || to == WorkerState.INFERRING;
            case CACHE_HIT, INFERRING -> to == WorkerState.PERSISTED;
            case PERSISTED, RETRYING -> to == WorkerState.ACKED;
            case ACKED, DEAD_LETTERED, RELEASED -> false;
        };
    }
}
