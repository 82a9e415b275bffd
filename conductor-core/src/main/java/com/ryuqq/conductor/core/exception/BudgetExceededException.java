package com.ryuqq.conductor.core.exception;

import com.ryuqq.conductor.core.model.ResourceId;

/**
 * 단일 리소스가 새 세션에서도 hardThreshold 안에 들어가지 않는 경우.
 *
 * <p>Compaction과 Reset을 모두 소진한 뒤 발생하며, 해당 리소스가 속한
 * Subtask 가지(branch)에만 치명적입니다. 형제 Subtask는 계속 진행됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BudgetExceededException extends RuntimeException {

    private final ResourceId resource;
    private final long consumedUnits;

    public BudgetExceededException(ResourceId resource, long consumedUnits, long hardThreshold) {
        super("Resource " + resource + " consumed " + consumedUnits
            + " units in a fresh session (hardThreshold: " + hardThreshold + ")");
        this.resource = resource;
        this.consumedUnits = consumedUnits;
    }

    public ResourceId getResource() {
        return resource;
    }

    public long getConsumedUnits() {
        return consumedUnits;
    }
}
