package com.ryuqq.moderation.core.model;

/**
 * 모더레이션 Task의 전역 고유 식별자.
 *
 * <p>TaskId는 Result Store 레코드의 기본 키이자, 모든 하위 처리의 멱등성 키입니다.
 * 동일한 TaskId를 가진 메시지가 여러 번 배달되어도 종료 상태로의 전이는 한 번만 일어납니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong> 양수만 허용</p>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public final class TaskId {

    private final long value;

    private TaskId(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("TaskId must be positive (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * TaskId 생성.
     *
     * @param value TaskId 값
     * @return TaskId 인스턴스
     * @throws IllegalArgumentException 값이 양수가 아닌 경우
     */
    public static TaskId of(long value) {
        return new TaskId(value);
    }

    /**
     * TaskId 값 조회.
     *
     * @return TaskId 값
     */
    public long getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskId taskId = (TaskId) o;
        return value == taskId.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "TaskId{" + value + '}';
    }
}
