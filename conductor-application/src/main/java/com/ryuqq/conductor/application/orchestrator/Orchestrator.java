package com.ryuqq.conductor.application.orchestrator;

import com.ryuqq.conductor.core.model.DependencyEdge;
import com.ryuqq.conductor.core.model.ResourceId;
import com.ryuqq.conductor.core.model.TaskId;
import com.ryuqq.conductor.core.outcome.TaskOutcome;
import com.ryuqq.conductor.core.plan.TaskPlan;
import com.ryuqq.conductor.core.statemachine.TaskStatus;

import java.util.Collection;

/**
 * Task 실행 조정자.
 *
 * <p>Task를 수락해 Subtask DAG로 분해하고, Worker Session에 의존성 순서대로 배분한 뒤
 * 결과를 병합합니다. 모든 상태 전이는 Plan Ledger에 기록됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * PlanReceipt receipt = orchestrator.submit(
 *     "rename Foo to Bar",
 *     List.of(ResourceId.of("src/a.java"), ResourceId.of("src/b.java")),
 *     List.of(DependencyEdge.of("src/a.java", "src/b.java"))
 * );
 *
 * TaskOutcome outcome = orchestrator.awaitTermination(receipt.getTaskId(), 60_000);
 * if (outcome instanceof Fail fail) {
 *     // fail.diagnostic(): 실패 리소스, Hook, 재시도 횟수
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Orchestrator {

    /**
     * Task 제출.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>TaskGraphBuilder로 Subtask DAG 생성 (실패 시 아무것도 기록하지 않음)</li>
     *   <li>Task(PLANNED)와 각 Subtask(PENDING/READY) 생성 레코드 기록</li>
     *   <li>READY Subtask를 동시성 한도까지 Worker Session에 배분</li>
     * </ol>
     *
     * @param description Task 설명
     * @param resources 리소스 집합
     * @param edges 리소스 간 의존성 (없으면 빈 컬렉션)
     * @return 생성된 Task와 Subtask ID
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws com.ryuqq.conductor.core.exception.GraphException 그래프가 유효하지 않은 경우
     * @throws IllegalStateException Scheduler가 중단(halt)되었거나 종료된 경우
     */
    PlanReceipt submit(String description, Collection<ResourceId> resources, Collection<DependencyEdge> edges);

    /**
     * Task 취소 요청 (fire-and-forget, 멱등).
     *
     * <p>알 수 없거나 이미 종료된 Task는 무시합니다. 실행 중인 Session은 다음
     * 리소스 경계에서 멈추고, 그 Subtask는 CANCELLED로 기록됩니다.</p>
     *
     * @param taskId Task ID
     */
    void cancel(TaskId taskId);

    /**
     * Task 상태 조회.
     *
     * @param taskId Task ID
     * @return 현재 상태
     * @throws IllegalArgumentException 알 수 없는 Task인 경우
     */
    TaskStatus status(TaskId taskId);

    /**
     * Task 계획 스냅샷 조회.
     *
     * @param taskId Task ID
     * @return 호출 시점의 TaskPlan 복사본
     * @throws IllegalArgumentException 알 수 없는 Task인 경우
     */
    TaskPlan plan(TaskId taskId);

    /**
     * Task 종료 대기.
     *
     * @param taskId Task ID
     * @param timeoutMs 최대 대기 시간 (밀리초)
     * @return 최종 결과 (Ok, Fail, Cancelled) 또는 시간 내 종료되지 않으면 null
     * @throws IllegalArgumentException 알 수 없는 Task인 경우
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    TaskOutcome awaitTermination(TaskId taskId, long timeoutMs) throws InterruptedException;
}
