package com.ryuqq.conductor.core.graph;

import com.ryuqq.conductor.core.model.DependencyEdge;
import com.ryuqq.conductor.core.model.ResourceId;
import com.ryuqq.conductor.core.model.TaskId;

import java.util.List;

/**
 * Task 분해 결과 (Subtask DAG).
 *
 * @param taskId Task ID
 * @param description Task 설명
 * @param resources 전체 리소스 (정렬)
 * @param subtasks Subtask 정의 (생성 순서)
 * @param edges 리소스 간 의존성 (중복 제거, 입력 순서)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TaskGraph(
    TaskId taskId,
    String description,
    List<ResourceId> resources,
    List<SubtaskSpec> subtasks,
    List<DependencyEdge> edges
) {

    public TaskGraph {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        resources = List.copyOf(resources);
        subtasks = List.copyOf(subtasks);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }
}
