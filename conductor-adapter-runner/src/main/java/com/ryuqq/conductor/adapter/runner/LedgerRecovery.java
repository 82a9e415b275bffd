package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.core.exception.LedgerUnavailableException;
import com.ryuqq.conductor.core.ledger.PlanLedger;
import com.ryuqq.conductor.core.model.TaskId;
import com.ryuqq.conductor.core.plan.TaskPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 재시작 복구.
 *
 * <p>프로세스 재시작 후 Ledger에 남은 비종료 Task를 재생해 Scheduler에서 이어서 실행합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>Ledger의 모든 Task 재생</li>
 *   <li>비종료 Task를 {@link DispatchScheduler#resume(TaskPlan, ReconcileStrategy)}로 등록</li>
 *   <li>Task 하나의 레코드가 손상되어도 다른 Task 복구는 계속 진행</li>
 * </ul>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. ledger.taskIds() → [TaskId1, TaskId2, ...]
 * 2. For each TaskId:
 *    a. ledger.replay(taskId) → TaskPlan
 *    b. 종료 상태면 건너뜀
 *    c. scheduler.resume(plan, strategy):
 *       - DISPATCHED/COMPACTING Subtask: 전략에 따라 재큐잉 또는 실패
 *       - 모든 Subtask가 종료 상태면 바로 병합
 * 3. 복구 건수 로깅
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LedgerRecovery {

    private static final Logger log = LoggerFactory.getLogger(LedgerRecovery.class);

    private final PlanLedger ledger;
    private final DispatchScheduler scheduler;
    private final RecoveryConfig config;

    /**
     * 생성자.
     *
     * @param ledger Plan Ledger
     * @param scheduler 복구한 Task를 이어서 실행할 Scheduler
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public LedgerRecovery(PlanLedger ledger, DispatchScheduler scheduler, RecoveryConfig config) {
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.ledger = ledger;
        this.scheduler = scheduler;
        this.config = config;
    }

    /**
     * 비종료 Task 복구.
     *
     * @return Scheduler에 등록한 Task 수
     * @throws LedgerUnavailableException Ledger를 읽을 수 없는 경우
     */
    public int recover() {
        log.info("Ledger recovery started");

        List<TaskId> taskIds = ledger.taskIds();
        int resumed = 0;
        for (TaskId taskId : taskIds) {
            if (tryResume(taskId)) {
                resumed++;
            }
        }

        log.info("Ledger recovery completed: {} resumed out of {} tasks", resumed, taskIds.size());
        return resumed;
    }

    /**
     * 개별 Task 복구 시도.
     *
     * <p>레코드 손상 등으로 실패해도 다른 Task 복구를 방해하지 않습니다.
     * Ledger 장애는 복구 자체를 중단합니다.</p>
     *
     * @return Scheduler에 등록했으면 true
     */
    private boolean tryResume(TaskId taskId) {
        try {
            TaskPlan plan = ledger.replay(taskId);
            if (plan.status().isTerminal()) {
                log.debug("Task {} already {}, skipping", taskId.getValue(), plan.status());
                return false;
            }
            boolean registered = scheduler.resume(plan, config.runningSubtaskStrategy());
            if (registered) {
                log.info("Recovered task {} ({}) with strategy: {}",
                    taskId.getValue(), plan.status(), config.runningSubtaskStrategy());
            }
            return registered;
        } catch (LedgerUnavailableException e) {
            log.error("Ledger unavailable while recovering {}", taskId.getValue(), e);
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to recover {}, records left untouched", taskId.getValue(), e);
            return false;
        }
    }
}
