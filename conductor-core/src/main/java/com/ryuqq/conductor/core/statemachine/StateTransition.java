package com.ryuqq.conductor.core.statemachine;

/**
 * 상태 전이 검증 및 실행.
 *
 * <p>Task와 Subtask의 상태 전이가 허용된 규칙을 따르는지 검증합니다.
 * Ledger 재생(replay) 시에도 같은 검증을 거치므로, 잘못된 레코드 순서는
 * 즉시 {@link IllegalStateException}으로 드러납니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태에서는 어떤 상태로도 전이 불가</li>
 *   <li>Task 상태는 역방향 전이 불가</li>
 *   <li>Subtask의 DISPATCHED/COMPACTING → READY는 크래시 재큐잉에만 사용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Task 상태 전이 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(TaskStatus from, TaskStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case PLANNED -> to == TaskStatus.IN_PROGRESS || to == TaskStatus.CANCELLED || to == TaskStatus.FAILED;
            case IN_PROGRESS -> to.isTerminal();
            case COMPLETED, FAILED, CANCELLED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid task transition: %s → %s", from, to)
            );
        }
    }

    /**
     * Subtask 상태 전이 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(SubtaskStatus from, SubtaskStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case PENDING -> to == SubtaskStatus.READY || to == SubtaskStatus.CANCELLED;
            case READY -> to == SubtaskStatus.DISPATCHED || to == SubtaskStatus.CANCELLED;
            case DISPATCHED -> to == SubtaskStatus.COMPACTING || to == SubtaskStatus.READY || to.isTerminal();
            case COMPACTING -> to == SubtaskStatus.DISPATCHED || to == SubtaskStatus.READY || to.isTerminal();
            case COMPLETED, FAILED, CANCELLED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid subtask transition: %s → %s", from, to)
            );
        }
    }

    /**
     * Task 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     */
    public static TaskStatus transition(TaskStatus current, TaskStatus next) {
        validate(current, next);
        return next;
    }

    /**
     * Subtask 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     */
    public static SubtaskStatus transition(SubtaskStatus current, SubtaskStatus next) {
        validate(current, next);
        return next;
    }
}
