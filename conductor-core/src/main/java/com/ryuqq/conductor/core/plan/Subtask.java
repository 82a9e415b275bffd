package com.ryuqq.conductor.core.plan;

import com.ryuqq.conductor.core.model.Diagnostic;
import com.ryuqq.conductor.core.model.ResourceId;
import com.ryuqq.conductor.core.model.SessionId;
import com.ryuqq.conductor.core.model.SubtaskId;
import com.ryuqq.conductor.core.model.TaskId;
import com.ryuqq.conductor.core.statemachine.SubtaskStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Subtask 스냅샷 (불변).
 *
 * <p>{@link TaskPlan}이 레코드를 적용할 때마다 새 인스턴스로 교체됩니다.</p>
 *
 * @param id Subtask ID
 * @param taskId 상위 Task ID
 * @param resources 처리 순서대로 정렬된 리소스
 * @param dependencies 먼저 완료되어야 하는 Subtask
 * @param sessionId 배정된 Worker Session (배정 전 null)
 * @param status 현재 상태
 * @param oversized 단독 처리 여부
 * @param attempt 크래시 재시도 횟수
 * @param outputs 리소스별 결과물 (COMPLETED 이후)
 * @param splitFrom 분할 원본 (없으면 null)
 * @param diagnostic 실패/취소 진단 (없으면 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Subtask(
    SubtaskId id,
    TaskId taskId,
    List<ResourceId> resources,
    List<SubtaskId> dependencies,
    SessionId sessionId,
    SubtaskStatus status,
    boolean oversized,
    int attempt,
    Map<ResourceId, String> outputs,
    SubtaskId splitFrom,
    Diagnostic diagnostic
) {

    public Subtask {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (resources == null || resources.isEmpty()) {
            throw new IllegalArgumentException("resources cannot be null or empty");
        }
        resources = List.copyOf(resources);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        outputs = outputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }

    Subtask withStatus(SubtaskStatus next) {
        return new Subtask(id, taskId, resources, dependencies, sessionId, next, oversized, attempt, outputs, splitFrom, diagnostic);
    }

    Subtask withSession(SessionId session) {
        return new Subtask(id, taskId, resources, dependencies, session, status, oversized, attempt, outputs, splitFrom, diagnostic);
    }

    Subtask withAttempt(int next) {
        return new Subtask(id, taskId, resources, dependencies, sessionId, status, oversized, next, outputs, splitFrom, diagnostic);
    }

    Subtask withResources(List<ResourceId> shrunk) {
        return new Subtask(id, taskId, shrunk, dependencies, sessionId, status, oversized, attempt, outputs, splitFrom, diagnostic);
    }

    Subtask withOversized() {
        return new Subtask(id, taskId, resources, dependencies, sessionId, status, true, attempt, outputs, splitFrom, diagnostic);
    }

    Subtask withOutputs(Map<ResourceId, String> results) {
        return new Subtask(id, taskId, resources, dependencies, sessionId, status, oversized, attempt, results, splitFrom, diagnostic);
    }

    Subtask withDiagnostic(Diagnostic failure) {
        return new Subtask(id, taskId, resources, dependencies, sessionId, status, oversized, attempt, outputs, splitFrom, failure);
    }

    Subtask withDependency(SubtaskId dependency) {
        if (dependencies.contains(dependency)) {
            return this;
        }
        List<SubtaskId> extended = new ArrayList<>(dependencies);
        extended.add(dependency);
        return new Subtask(id, taskId, resources, extended, sessionId, status, oversized, attempt, outputs, splitFrom, diagnostic);
    }

    /**
     * 의존성 포함 여부.
     */
    public boolean dependsOn(SubtaskId other) {
        return dependencies.contains(other);
    }
}
