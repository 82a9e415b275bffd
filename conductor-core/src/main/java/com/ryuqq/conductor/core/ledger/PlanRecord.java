package com.ryuqq.conductor.core.ledger;

import com.ryuqq.conductor.core.model.DependencyEdge;
import com.ryuqq.conductor.core.model.Diagnostic;
import com.ryuqq.conductor.core.model.ResourceId;
import com.ryuqq.conductor.core.model.SessionId;
import com.ryuqq.conductor.core.model.SubtaskId;
import com.ryuqq.conductor.core.model.TaskId;
import com.ryuqq.conductor.core.statemachine.SubtaskStatus;
import com.ryuqq.conductor.core.statemachine.TaskStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plan Ledger의 불변 레코드.
 *
 * <p>Task 또는 Subtask의 상태 전이 하나를 나타냅니다. 재생(replay)에 필요한
 * payload(리소스, 의존성, 결과물, 분할 원본 등)를 함께 담아, 레코드만으로
 * {@link com.ryuqq.conductor.core.plan.TaskPlan}을 그대로 복원할 수 있습니다.</p>
 *
 * <p><strong>레코드 종류:</strong></p>
 * <ul>
 *   <li>Task 생성: subtaskId = null, fromState = null, toState = PLANNED, detail = 설명</li>
 *   <li>Task 전이: subtaskId = null, fromState/toState = TaskStatus</li>
 *   <li>Subtask 생성: fromState = null, toState = PENDING 또는 READY</li>
 *   <li>Subtask 전이: fromState/toState = SubtaskStatus</li>
 *   <li>Subtask 분리: 실행 중 → READY, resources = 남길 단일 리소스, oversized = true</li>
 * </ul>
 *
 * @param taskId Task ID
 * @param subtaskId Subtask ID (Task 레코드이면 null)
 * @param fromState 이전 상태 이름 (생성 레코드이면 null)
 * @param toState 새 상태 이름
 * @param workerId 전이를 일으킨 Worker Session (선택)
 * @param timestamp 기록 시각 (epoch millis)
 * @param resources 리소스 목록 (생성 시 전체, 분할 완료 시 축소된 목록, 그 외 빈 목록)
 * @param dependencies 의존 Subtask 목록 (Subtask 생성 시)
 * @param outputs 리소스별 결과물 (COMPLETED 전이 시)
 * @param splitFrom 분할 원본 Subtask (나머지 Subtask 생성 시)
 * @param oversized 단독 처리 Subtask 여부
 * @param attempt 크래시 재시도 횟수
 * @param detail 부가 설명 (Task 생성 시 Task 설명)
 * @param diagnostic 실패/취소 진단 (선택)
 * @param edges 리소스 간 의존성 (Task 생성 시)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PlanRecord(
    TaskId taskId,
    SubtaskId subtaskId,
    String fromState,
    String toState,
    SessionId workerId,
    long timestamp,
    List<ResourceId> resources,
    List<SubtaskId> dependencies,
    Map<ResourceId, String> outputs,
    SubtaskId splitFrom,
    boolean oversized,
    int attempt,
    String detail,
    Diagnostic diagnostic,
    List<DependencyEdge> edges
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 누락되었거나 값이 유효하지 않은 경우
     */
    public PlanRecord {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (toState == null || toState.isBlank()) {
            throw new IllegalArgumentException("toState cannot be null or blank");
        }
        if (timestamp < 0) {
            throw new IllegalArgumentException("timestamp must be non-negative (current: " + timestamp + ")");
        }
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be non-negative (current: " + attempt + ")");
        }
        resources = resources == null ? List.of() : List.copyOf(resources);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        outputs = outputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    /**
     * Task 생성 레코드.
     *
     * @param taskId Task ID
     * @param description Task 설명
     * @param resources Task 리소스 집합 (정렬된 목록)
     * @param timestamp 기록 시각
     * @return PLANNED 레코드
     */
    public static PlanRecord taskCreated(TaskId taskId, String description, List<ResourceId> resources, long timestamp) {
        return taskCreated(taskId, description, resources, List.of(), timestamp);
    }

    /**
     * 리소스 의존성을 포함한 Task 생성 레코드.
     *
     * @param edges 리소스 간 의존성 (Subtask 분리 시 하위 리소스 판별에 사용)
     */
    public static PlanRecord taskCreated(TaskId taskId, String description, List<ResourceId> resources,
                                         List<DependencyEdge> edges, long timestamp) {
        return new PlanRecord(
            taskId, null, null, TaskStatus.PLANNED.name(), null, timestamp,
            resources, List.of(), Map.of(), null, false, 0, description, null, edges
        );
    }

    /**
     * Task 상태 전이 레코드.
     *
     * @param taskId Task ID
     * @param from 현재 상태
     * @param to 새 상태
     * @param timestamp 기록 시각
     * @param diagnostic 실패 진단 (선택)
     * @return 전이 레코드
     */
    public static PlanRecord taskTransition(TaskId taskId, TaskStatus from, TaskStatus to,
                                            long timestamp, Diagnostic diagnostic) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        return new PlanRecord(
            taskId, null, from.name(), to.name(), null, timestamp,
            List.of(), List.of(), Map.of(), null, false, 0, null, diagnostic, List.of()
        );
    }

    /**
     * Subtask 생성 레코드.
     *
     * @param taskId Task ID
     * @param subtaskId 새 Subtask ID
     * @param initial 초기 상태 (PENDING 또는 READY)
     * @param resources Subtask 리소스 (처리 순서)
     * @param dependencies 의존 Subtask
     * @param oversized 단독 처리 여부
     * @param splitFrom 분할 원본 (그래프 빌드로 생성된 경우 null)
     * @param attempt 시작 재시도 횟수
     * @param timestamp 기록 시각
     * @return 생성 레코드
     */
    public static PlanRecord subtaskCreated(TaskId taskId, SubtaskId subtaskId, SubtaskStatus initial,
                                            List<ResourceId> resources, List<SubtaskId> dependencies,
                                            boolean oversized, SubtaskId splitFrom, int attempt, long timestamp) {
        if (subtaskId == null) {
            throw new IllegalArgumentException("subtaskId cannot be null");
        }
        if (initial != SubtaskStatus.PENDING && initial != SubtaskStatus.READY) {
            throw new IllegalArgumentException("initial state must be PENDING or READY (current: " + initial + ")");
        }
        return new PlanRecord(
            taskId, subtaskId, null, initial.name(), null, timestamp,
            resources, dependencies, Map.of(), splitFrom, oversized, attempt, null, null, List.of()
        );
    }

    /**
     * 단순 Subtask 상태 전이 레코드.
     */
    public static PlanRecord subtaskTransition(TaskId taskId, SubtaskId subtaskId, SubtaskStatus from,
                                               SubtaskStatus to, SessionId workerId, long timestamp) {
        return subtaskTransition(taskId, subtaskId, from, to, workerId, timestamp, 0, null);
    }

    /**
     * 재시도 횟수/진단을 포함한 Subtask 상태 전이 레코드.
     *
     * @param attempt READY 재큐잉 시 새 재시도 횟수 (그 외 무시)
     * @param diagnostic FAILED/CANCELLED 진단 (선택)
     */
    public static PlanRecord subtaskTransition(TaskId taskId, SubtaskId subtaskId, SubtaskStatus from,
                                               SubtaskStatus to, SessionId workerId, long timestamp,
                                               int attempt, Diagnostic diagnostic) {
        if (subtaskId == null) {
            throw new IllegalArgumentException("subtaskId cannot be null");
        }
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        return new PlanRecord(
            taskId, subtaskId, from.name(), to.name(), workerId, timestamp,
            List.of(), List.of(), Map.of(), null, false, attempt, null, diagnostic, List.of()
        );
    }

    /**
     * Subtask 완료 레코드.
     *
     * @param processed 완료된 리소스 (Reset으로 축소된 경우 처리된 부분만, 아니면 빈 목록)
     * @param outputs 리소스별 결과물
     */
    public static PlanRecord subtaskCompleted(TaskId taskId, SubtaskId subtaskId, SubtaskStatus from,
                                              SessionId workerId, long timestamp,
                                              List<ResourceId> processed, Map<ResourceId, String> outputs) {
        if (subtaskId == null) {
            throw new IllegalArgumentException("subtaskId cannot be null");
        }
        if (from == null) {
            throw new IllegalArgumentException("from cannot be null");
        }
        return new PlanRecord(
            taskId, subtaskId, from.name(), SubtaskStatus.COMPLETED.name(), workerId, timestamp,
            processed, List.of(), outputs, null, false, 0, null, null, List.of()
        );
    }

    /**
     * 첫 리소스가 단독으로도 hardThreshold를 넘은 Subtask를 그 리소스 하나로 축소하는 레코드.
     *
     * <p>나머지 리소스는 별도의 분할 Subtask로 먼저 기록되어야 합니다.</p>
     *
     * @param from 현재 상태 (DISPATCHED 또는 COMPACTING)
     * @param resource Subtask에 남길 리소스
     * @param attempt 유지할 재시도 횟수
     * @return READY 재큐잉 레코드 (oversized)
     */
    public static PlanRecord subtaskIsolated(TaskId taskId, SubtaskId subtaskId, SubtaskStatus from,
                                             ResourceId resource, int attempt, long timestamp) {
        if (subtaskId == null) {
            throw new IllegalArgumentException("subtaskId cannot be null");
        }
        if (from == null) {
            throw new IllegalArgumentException("from cannot be null");
        }
        if (resource == null) {
            throw new IllegalArgumentException("resource cannot be null");
        }
        return new PlanRecord(
            taskId, subtaskId, from.name(), SubtaskStatus.READY.name(), null, timestamp,
            List.of(resource), List.of(), Map.of(), null, true, attempt, null, null, List.of()
        );
    }

    /**
     * Task 레벨 레코드 여부.
     */
    public boolean isTaskRecord() {
        return subtaskId == null;
    }

    /**
     * 생성 레코드 여부.
     */
    public boolean isCreation() {
        return fromState == null;
    }
}
