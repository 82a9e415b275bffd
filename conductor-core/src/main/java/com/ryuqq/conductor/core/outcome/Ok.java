package com.ryuqq.conductor.core.outcome;

import com.ryuqq.conductor.core.model.TaskId;

/**
 * 성공 결과.
 *
 * <p>모든 Subtask 결과가 충돌 없이 병합되었고, 검증 Hook이 모두 통과했음을 나타냅니다.</p>
 *
 * @param taskId Task ID
 * @param mergedResources 병합(기록)된 리소스 수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Ok(
    TaskId taskId,
    int mergedResources
) implements TaskOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException taskId가 null이거나 mergedResources가 음수인 경우
     */
    public Ok {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (mergedResources < 0) {
            throw new IllegalArgumentException("mergedResources must be non-negative (current: " + mergedResources + ")");
        }
    }
}
