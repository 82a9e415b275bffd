package com.ryuqq.conductor.core.plan;

import com.ryuqq.conductor.core.ledger.PlanRecord;
import com.ryuqq.conductor.core.model.DependencyEdge;
import com.ryuqq.conductor.core.model.Diagnostic;
import com.ryuqq.conductor.core.model.ResourceId;
import com.ryuqq.conductor.core.model.SubtaskId;
import com.ryuqq.conductor.core.model.TaskId;
import com.ryuqq.conductor.core.statemachine.StateTransition;
import com.ryuqq.conductor.core.statemachine.SubtaskStatus;
import com.ryuqq.conductor.core.statemachine.TaskStatus;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Task 계획 상태 (Event-Sourced Aggregate).
 *
 * <p>TaskPlan은 오직 {@link #apply(PlanRecord)}로만 변경됩니다. 실행 중 상태와
 * Ledger 재생 결과는 같은 레코드를 같은 순서로 적용한 결과이므로 항상 동일합니다.</p>
 *
 * <p><strong>적용 규칙:</strong></p>
 * <ul>
 *   <li>첫 레코드는 반드시 Task 생성 레코드</li>
 *   <li>전이 레코드의 fromState는 현재 상태와 일치해야 함</li>
 *   <li>모든 전이는 {@link StateTransition} 규칙으로 검증</li>
 *   <li>분할(splitFrom) 생성 시 원본에 의존하던 Subtask는 나머지 Subtask에도 의존</li>
 * </ul>
 *
 * <p>Thread-safe하지 않습니다. 호출자(Scheduler)가 잠금으로 보호해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TaskPlan {

    private final TaskId taskId;
    private String description;
    private List<ResourceId> resources = List.of();
    private List<DependencyEdge> edges = List.of();
    private TaskStatus status;
    private Diagnostic diagnostic;
    private long createdAt;
    private long updatedAt;
    private final LinkedHashMap<SubtaskId, Subtask> subtasks = new LinkedHashMap<>();

    private TaskPlan(TaskId taskId) {
        this.taskId = taskId;
    }

    /**
     * Task 생성 레코드로 새 TaskPlan 시작.
     *
     * @param created Task 생성 레코드
     * @return PLANNED 상태의 TaskPlan
     * @throws IllegalArgumentException Task 생성 레코드가 아닌 경우
     */
    public static TaskPlan start(PlanRecord created) {
        if (created == null) {
            throw new IllegalArgumentException("created cannot be null");
        }
        if (!created.isTaskRecord() || !created.isCreation()) {
            throw new IllegalArgumentException("First record must be a task creation record: " + created);
        }
        TaskPlan plan = new TaskPlan(created.taskId());
        plan.apply(created);
        return plan;
    }

    /**
     * 레코드 목록을 순서대로 적용해 TaskPlan 복원.
     *
     * @param records 한 Task의 레코드 (추가 순서)
     * @return 복원된 TaskPlan
     * @throws IllegalArgumentException 레코드가 비어있는 경우
     * @throws IllegalStateException 전이 규칙 위반 시
     */
    public static TaskPlan replay(List<PlanRecord> records) {
        if (records == null || records.isEmpty()) {
            throw new IllegalArgumentException("records cannot be null or empty");
        }
        TaskPlan plan = start(records.get(0));
        for (int i = 1; i < records.size(); i++) {
            plan.apply(records.get(i));
        }
        return plan;
    }

    /**
     * 레코드 적용.
     *
     * @param record 적용할 레코드
     * @throws IllegalArgumentException 다른 Task의 레코드이거나 알 수 없는 Subtask인 경우
     * @throws IllegalStateException 전이 규칙 위반 시
     */
    public void apply(PlanRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (!taskId.equals(record.taskId())) {
            throw new IllegalArgumentException(
                "Record belongs to another task (expected: " + taskId.getValue() + ", got: " + record.taskId().getValue() + ")"
            );
        }
        if (record.isTaskRecord()) {
            applyTaskRecord(record);
        } else {
            if (status == null) {
                throw new IllegalStateException("Task not created yet: " + taskId.getValue());
            }
            applySubtaskRecord(record);
        }
        updatedAt = record.timestamp();
    }

    private void applyTaskRecord(PlanRecord record) {
        TaskStatus to = TaskStatus.valueOf(record.toState());
        if (record.isCreation()) {
            if (status != null) {
                throw new IllegalStateException("Task already created: " + taskId.getValue());
            }
            if (to != TaskStatus.PLANNED) {
                throw new IllegalStateException("Task must be created as PLANNED (current: " + to + ")");
            }
            description = record.detail();
            resources = record.resources();
            edges = record.edges();
            createdAt = record.timestamp();
            status = to;
            return;
        }

        TaskStatus from = TaskStatus.valueOf(record.fromState());
        requireCurrent(from.name(), status == null ? null : status.name(), "task " + taskId.getValue());
        status = StateTransition.transition(from, to);
        if (record.diagnostic() != null) {
            diagnostic = record.diagnostic();
        }
    }

    private void applySubtaskRecord(PlanRecord record) {
        SubtaskId id = record.subtaskId();
        SubtaskStatus to = SubtaskStatus.valueOf(record.toState());

        if (record.isCreation()) {
            if (subtasks.containsKey(id)) {
                throw new IllegalStateException("Subtask already exists: " + id.getValue());
            }
            for (SubtaskId dependency : record.dependencies()) {
                requireKnown(dependency);
            }
            Subtask created = new Subtask(
                id, taskId, record.resources(), record.dependencies(), null, to,
                record.oversized(), record.attempt(), Map.of(), record.splitFrom(), null
            );
            if (record.splitFrom() != null) {
                requireKnown(record.splitFrom());
                rewireDependents(record.splitFrom(), id);
            }
            subtasks.put(id, created);
            return;
        }

        Subtask current = requireKnown(id);
        SubtaskStatus from = SubtaskStatus.valueOf(record.fromState());
        requireCurrent(from.name(), current.status().name(), "subtask " + id.getValue());
        Subtask next = current.withStatus(StateTransition.transition(from, to));

        switch (to) {
            case DISPATCHED -> {
                if (from == SubtaskStatus.READY) {
                    next = next.withSession(record.workerId());
                }
            }
            case READY -> {
                next = next.withSession(null).withAttempt(record.attempt());
                if (!record.resources().isEmpty()) {
                    next = next.withResources(record.resources());
                }
                if (record.oversized()) {
                    next = next.withOversized();
                }
            }
            case COMPLETED -> {
                if (!record.resources().isEmpty()) {
                    next = next.withResources(record.resources());
                }
                next = next.withOutputs(record.outputs());
            }
            case FAILED, CANCELLED -> {
                if (record.diagnostic() != null) {
                    next = next.withDiagnostic(record.diagnostic());
                }
            }
            default -> {
                // COMPACTING: 상태만 변경
            }
        }
        subtasks.put(id, next);
    }

    private void rewireDependents(SubtaskId original, SubtaskId remainder) {
        for (Map.Entry<SubtaskId, Subtask> entry : subtasks.entrySet()) {
            if (entry.getValue().dependsOn(original)) {
                entry.setValue(entry.getValue().withDependency(remainder));
            }
        }
    }

    private Subtask requireKnown(SubtaskId id) {
        Subtask subtask = subtasks.get(id);
        if (subtask == null) {
            throw new IllegalArgumentException("Unknown subtask: " + id.getValue() + " (task: " + taskId.getValue() + ")");
        }
        return subtask;
    }

    private static void requireCurrent(String expected, String actual, String target) {
        if (!expected.equals(actual)) {
            throw new IllegalStateException(
                String.format("Stale record for %s (record from: %s, current: %s)", target, expected, actual)
            );
        }
    }

    // ========== 조회 ==========

    /**
     * 다음에 발급할 Subtask ID.
     *
     * <p>생성된 Subtask 수 + 1 순번이므로 재생 후에도 같은 ID가 발급됩니다.</p>
     */
    public SubtaskId nextSubtaskId() {
        return SubtaskId.of(taskId, subtasks.size() + 1);
    }

    /**
     * 모든 의존성이 COMPLETED인 PENDING Subtask (생성 순서).
     */
    public List<Subtask> promotable() {
        List<Subtask> result = new ArrayList<>();
        for (Subtask subtask : subtasks.values()) {
            if (subtask.status() == SubtaskStatus.PENDING && dependenciesCompleted(subtask)) {
                result.add(subtask);
            }
        }
        return result;
    }

    /**
     * 의존성이 모두 완료되었는지 확인.
     */
    public boolean dependenciesCompleted(Subtask subtask) {
        for (SubtaskId dependency : subtask.dependencies()) {
            if (requireKnown(dependency).status() != SubtaskStatus.COMPLETED) {
                return false;
            }
        }
        return true;
    }

    /**
     * 주어진 Subtask에 직접 또는 간접적으로 의존하는 종료되지 않은 Subtask (생성 순서).
     */
    public List<Subtask> openDownstreamOf(SubtaskId root) {
        List<SubtaskId> reached = new ArrayList<>();
        reached.add(root);
        boolean grown = true;
        while (grown) {
            grown = false;
            for (Subtask subtask : subtasks.values()) {
                if (reached.contains(subtask.id())) {
                    continue;
                }
                for (SubtaskId dependency : subtask.dependencies()) {
                    if (reached.contains(dependency)) {
                        reached.add(subtask.id());
                        grown = true;
                        break;
                    }
                }
            }
        }
        List<Subtask> result = new ArrayList<>();
        for (Subtask subtask : subtasks.values()) {
            if (!subtask.id().equals(root) && reached.contains(subtask.id()) && !subtask.status().isTerminal()) {
                result.add(subtask);
            }
        }
        return result;
    }

    /**
     * 리소스가 다른 리소스에 직접 또는 간접적으로 의존하는지 확인 (Task 생성 시 기록된 의존성 기준).
     */
    public boolean resourceDependsOn(ResourceId dependent, ResourceId prerequisite) {
        Set<ResourceId> reached = new HashSet<>();
        Deque<ResourceId> frontier = new ArrayDeque<>();
        frontier.add(prerequisite);
        while (!frontier.isEmpty()) {
            ResourceId current = frontier.poll();
            for (DependencyEdge edge : edges) {
                if (edge.prerequisite().equals(current) && reached.add(edge.dependent())) {
                    if (edge.dependent().equals(dependent)) {
                        return true;
                    }
                    frontier.add(edge.dependent());
                }
            }
        }
        return false;
    }

    /**
     * 모든 Subtask가 종료 상태인지 확인.
     */
    public boolean allSubtasksTerminal() {
        for (Subtask subtask : subtasks.values()) {
            if (!subtask.status().isTerminal()) {
                return false;
            }
        }
        return true;
    }

    /**
     * 스냅샷 복사본 생성 (Subtask는 불변이므로 얕은 복사).
     */
    public TaskPlan copy() {
        TaskPlan copy = new TaskPlan(taskId);
        copy.description = description;
        copy.resources = resources;
        copy.edges = edges;
        copy.status = status;
        copy.diagnostic = diagnostic;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        copy.subtasks.putAll(subtasks);
        return copy;
    }

    public Subtask subtask(SubtaskId id) {
        return requireKnown(id);
    }

    public List<Subtask> subtasks() {
        return List.copyOf(subtasks.values());
    }

    public TaskId taskId() {
        return taskId;
    }

    public String description() {
        return description;
    }

    public List<ResourceId> resources() {
        return resources;
    }

    public List<DependencyEdge> edges() {
        return edges;
    }

    public TaskStatus status() {
        return status;
    }

    public Diagnostic diagnostic() {
        return diagnostic;
    }

    public long createdAt() {
        return createdAt;
    }

    public long updatedAt() {
        return updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskPlan that = (TaskPlan) o;
        return taskId.equals(that.taskId)
            && Objects.equals(description, that.description)
            && resources.equals(that.resources)
            && edges.equals(that.edges)
            && status == that.status
            && Objects.equals(diagnostic, that.diagnostic)
            && createdAt == that.createdAt
            && updatedAt == that.updatedAt
            && subtasks().equals(that.subtasks());
    }

    @Override
    public int hashCode() {
        return Objects.hash(taskId, status, subtasks.keySet());
    }

    @Override
    public String toString() {
        return "TaskPlan{taskId=" + taskId.getValue() + ", status=" + status + ", subtasks=" + subtasks.size() + '}';
    }
}
