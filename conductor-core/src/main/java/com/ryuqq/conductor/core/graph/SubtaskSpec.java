package com.ryuqq.conductor.core.graph;

import com.ryuqq.conductor.core.model.ResourceId;
import com.ryuqq.conductor.core.model.SubtaskId;

import java.util.List;

/**
 * 그래프 빌드 결과의 Subtask 정의.
 *
 * @param id Subtask ID ({@code <taskId>-<n>})
 * @param resources 처리 순서대로 정렬된 리소스
 * @param dependencies 먼저 완료되어야 하는 Subtask (생성 순서)
 * @param oversized 단독 처리 여부
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SubtaskSpec(
    SubtaskId id,
    List<ResourceId> resources,
    List<SubtaskId> dependencies,
    boolean oversized
) {

    public SubtaskSpec {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (resources == null || resources.isEmpty()) {
            throw new IllegalArgumentException("resources cannot be null or empty");
        }
        resources = List.copyOf(resources);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }
}
