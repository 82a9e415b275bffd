package com.ryuqq.conductor.application.orchestrator;

import com.ryuqq.conductor.core.model.SubtaskId;
import com.ryuqq.conductor.core.model.TaskId;

import java.util.List;

/**
 * Task 제출 영수증.
 *
 * <p>제출 시점에 생성된 Task ID와 Subtask ID(생성 순서)를 담습니다.
 * 이후 Reset으로 생기는 나머지 Subtask는 포함되지 않으므로, 최신 상태는
 * {@link Orchestrator#plan(TaskId)}로 조회합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 상태 변경 불가</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PlanReceipt {

    private final TaskId taskId;
    private final List<SubtaskId> subtaskIds;

    /**
     * @param taskId Task ID
     * @param subtaskIds 초기 Subtask ID 목록
     * @throws IllegalArgumentException taskId가 null이거나 subtaskIds가 비어있는 경우
     */
    public PlanReceipt(TaskId taskId, List<SubtaskId> subtaskIds) {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (subtaskIds == null || subtaskIds.isEmpty()) {
            throw new IllegalArgumentException("subtaskIds cannot be null or empty");
        }
        this.taskId = taskId;
        this.subtaskIds = List.copyOf(subtaskIds);
    }

    /**
     * Task ID 조회.
     *
     * @return Task ID (non-null)
     */
    public TaskId getTaskId() {
        return taskId;
    }

    /**
     * 초기 Subtask ID 조회.
     *
     * @return 생성 순서의 Subtask ID (불변 목록)
     */
    public List<SubtaskId> getSubtaskIds() {
        return subtaskIds;
    }

    @Override
    public String toString() {
        return "PlanReceipt{taskId=" + taskId + ", subtasks=" + subtaskIds.size() + "}";
    }
}
