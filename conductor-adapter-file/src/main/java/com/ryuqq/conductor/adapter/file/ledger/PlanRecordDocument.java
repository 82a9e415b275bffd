package com.ryuqq.conductor.adapter.file.ledger;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ryuqq.conductor.core.ledger.PlanRecord;
import com.ryuqq.conductor.core.model.DependencyEdge;
import com.ryuqq.conductor.core.model.Diagnostic;
import com.ryuqq.conductor.core.model.ResourceId;
import com.ryuqq.conductor.core.model.SessionId;
import com.ryuqq.conductor.core.model.SubtaskId;
import com.ryuqq.conductor.core.model.TaskId;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON 직렬화용 PlanRecord 표현 (한 줄 = 한 레코드).
 *
 * <p>식별자는 문자열로 저장하고, 읽을 때 값 객체 검증을 다시 거칩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlanRecordDocument(
    String taskId,
    String subtaskId,
    String fromState,
    String toState,
    String workerId,
    long timestamp,
    List<String> resources,
    List<String> dependencies,
    Map<String, String> outputs,
    String splitFrom,
    boolean oversized,
    int attempt,
    String detail,
    DiagnosticDocument diagnostic,
    List<EdgeDocument> edges
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record DiagnosticDocument(String code, String resource, String hook, int retryCount, String message) {
    }

    public record EdgeDocument(String prerequisite, String dependent) {
    }

    public static PlanRecordDocument from(PlanRecord record) {
        List<String> resources = new ArrayList<>();
        for (ResourceId resource : record.resources()) {
            resources.add(resource.getValue());
        }
        List<String> dependencies = new ArrayList<>();
        for (SubtaskId dependency : record.dependencies()) {
            dependencies.add(dependency.getValue());
        }
        Map<String, String> outputs = new LinkedHashMap<>();
        for (Map.Entry<ResourceId, String> output : record.outputs().entrySet()) {
            outputs.put(output.getKey().getValue(), output.getValue());
        }
        List<EdgeDocument> edges = null;
        if (!record.edges().isEmpty()) {
            edges = new ArrayList<>();
            for (DependencyEdge edge : record.edges()) {
                edges.add(new EdgeDocument(edge.prerequisite().getValue(), edge.dependent().getValue()));
            }
        }
        Diagnostic diagnostic = record.diagnostic();
        DiagnosticDocument diagnosticDocument = diagnostic == null ? null : new DiagnosticDocument(
            diagnostic.code(),
            diagnostic.resource() == null ? null : diagnostic.resource().getValue(),
            diagnostic.hook(),
            diagnostic.retryCount(),
            diagnostic.message()
        );
        return new PlanRecordDocument(
            record.taskId().getValue(),
            record.subtaskId() == null ? null : record.subtaskId().getValue(),
            record.fromState(),
            record.toState(),
            record.workerId() == null ? null : record.workerId().getValue(),
            record.timestamp(),
            resources,
            dependencies,
            outputs,
            record.splitFrom() == null ? null : record.splitFrom().getValue(),
            record.oversized(),
            record.attempt(),
            record.detail(),
            diagnosticDocument,
            edges
        );
    }

    public PlanRecord toRecord() {
        List<ResourceId> resourceIds = new ArrayList<>();
        if (resources != null) {
            for (String resource : resources) {
                resourceIds.add(ResourceId.of(resource));
            }
        }
        List<SubtaskId> dependencyIds = new ArrayList<>();
        if (dependencies != null) {
            for (String dependency : dependencies) {
                dependencyIds.add(SubtaskId.of(dependency));
            }
        }
        Map<ResourceId, String> outputMap = new LinkedHashMap<>();
        if (outputs != null) {
            for (Map.Entry<String, String> output : outputs.entrySet()) {
                outputMap.put(ResourceId.of(output.getKey()), output.getValue());
            }
        }
        List<DependencyEdge> edgeList = new ArrayList<>();
        if (edges != null) {
            for (EdgeDocument edge : edges) {
                edgeList.add(DependencyEdge.of(edge.prerequisite(), edge.dependent()));
            }
        }
        Diagnostic failure = diagnostic == null ? null : new Diagnostic(
            diagnostic.code(),
            diagnostic.resource() == null ? null : ResourceId.of(diagnostic.resource()),
            diagnostic.hook(),
            diagnostic.retryCount(),
            diagnostic.message()
        );
        return new PlanRecord(
            TaskId.of(taskId),
            subtaskId == null ? null : SubtaskId.of(subtaskId),
            fromState,
            toState,
            workerId == null ? null : SessionId.of(workerId),
            timestamp,
            resourceIds,
            dependencyIds,
            outputMap,
            splitFrom == null ? null : SubtaskId.of(splitFrom),
            oversized,
            attempt,
            detail,
            failure,
            edgeList
        );
    }
}
