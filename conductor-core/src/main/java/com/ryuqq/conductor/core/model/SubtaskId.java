package com.ryuqq.conductor.core.model;

/**
 * Subtask 식별자.
 *
 * <p>그래프 빌드 시 {@code <taskId>-<n>} 형식으로 발급되며,
 * Reset으로 분할된 나머지 Subtask도 같은 규칙으로 다음 번호를 받습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SubtaskId {

    private final String value;

    private SubtaskId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("SubtaskId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("SubtaskId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("SubtaskId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * SubtaskId 생성.
     *
     * @param value SubtaskId 값
     * @return SubtaskId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static SubtaskId of(String value) {
        return new SubtaskId(value);
    }

    /**
     * Task 내 순번으로 SubtaskId 생성.
     *
     * @param taskId 상위 Task ID
     * @param sequence 1부터 시작하는 순번
     * @return {@code <taskId>-<sequence>} 형식의 SubtaskId
     * @throws IllegalArgumentException taskId가 null이거나 sequence가 양수가 아닌 경우
     */
    public static SubtaskId of(TaskId taskId, int sequence) {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (sequence <= 0) {
            throw new IllegalArgumentException("sequence must be positive (current: " + sequence + ")");
        }
        return new SubtaskId(taskId.getValue() + "-" + sequence);
    }

    /**
     * SubtaskId 값 조회.
     *
     * @return SubtaskId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SubtaskId that = (SubtaskId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "SubtaskId{" + value + '}';
    }
}
