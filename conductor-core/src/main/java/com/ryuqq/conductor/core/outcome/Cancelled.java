package com.ryuqq.conductor.core.outcome;

import com.ryuqq.conductor.core.model.TaskId;

/**
 * 취소 결과.
 *
 * @param taskId Task ID
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Cancelled(TaskId taskId) implements TaskOutcome {

    public Cancelled {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
    }
}
