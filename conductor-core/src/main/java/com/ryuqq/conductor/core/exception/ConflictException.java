package com.ryuqq.conductor.core.exception;

import com.ryuqq.conductor.core.model.ResourceId;
import com.ryuqq.conductor.core.model.SubtaskId;

/**
 * 같은 리소스에 대해 서로 다른 결과가 두 개 이상 존재하는 경우.
 *
 * <p>Last-writer-wins로 해소하지 않으며, Task 전체가 실패 처리되고
 * 수동 해결이 필요합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ConflictException extends RuntimeException {

    private final ResourceId resource;

    public ConflictException(ResourceId resource, SubtaskId first, SubtaskId second) {
        super("Conflicting outputs for resource " + resource + " from "
            + first.getValue() + " and " + second.getValue());
        this.resource = resource;
    }

    public ResourceId getResource() {
        return resource;
    }
}
