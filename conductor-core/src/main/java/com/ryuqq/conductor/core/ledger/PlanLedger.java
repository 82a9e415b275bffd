package com.ryuqq.conductor.core.ledger;

import com.ryuqq.conductor.core.exception.LedgerCorruptedException;
import com.ryuqq.conductor.core.exception.LedgerUnavailableException;
import com.ryuqq.conductor.core.model.TaskId;
import com.ryuqq.conductor.core.plan.TaskPlan;
import com.ryuqq.conductor.core.spi.LedgerBackend;

import java.util.List;

/**
 * Append-only Plan Ledger.
 *
 * <p>{@link LedgerBackend} SPI를 감싸 모든 상태 전이를 기록하고, 기록된 레코드로
 * Task의 계획 상태를 재생합니다. 백엔드가 던지는 예외는
 * {@link LedgerUnavailableException}으로 변환됩니다. 단, 한 Task의 레코드 손상을 뜻하는
 * {@link LedgerCorruptedException}은 그대로 전파됩니다.</p>
 *
 * <p><strong>쓰기 순서:</strong> 호출자는 메모리 상태를 바꾸기 전에 반드시
 * {@link #append(PlanRecord)}를 먼저 호출해야 합니다 (Write-Ahead).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PlanLedger {

    private final LedgerBackend backend;

    public PlanLedger(LedgerBackend backend) {
        if (backend == null) {
            throw new IllegalArgumentException("backend cannot be null");
        }
        this.backend = backend;
    }

    /**
     * 레코드 추가.
     *
     * @param record 추가할 레코드
     * @throws IllegalArgumentException record가 null인 경우
     * @throws LedgerUnavailableException 백엔드 저장 실패 시
     */
    public void append(PlanRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        try {
            backend.append(record);
        } catch (RuntimeException e) {
            throw new LedgerUnavailableException(
                "Failed to append record (taskId: " + record.taskId().getValue() + ", to: " + record.toState() + ")", e
            );
        }
    }

    /**
     * Task의 모든 레코드 조회 (추가 순서).
     *
     * @throws LedgerCorruptedException 레코드가 손상된 경우
     * @throws LedgerUnavailableException 백엔드 조회 실패 시
     */
    public List<PlanRecord> readAll(TaskId taskId) {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        try {
            return List.copyOf(backend.readAll(taskId));
        } catch (LedgerCorruptedException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LedgerUnavailableException("Failed to read records (taskId: " + taskId.getValue() + ")", e);
        }
    }

    /**
     * 레코드가 있는 모든 Task ID 조회.
     *
     * @throws LedgerUnavailableException 백엔드 조회 실패 시
     */
    public List<TaskId> taskIds() {
        try {
            return List.copyOf(backend.taskIds());
        } catch (RuntimeException e) {
            throw new LedgerUnavailableException("Failed to list tasks", e);
        }
    }

    /**
     * 레코드를 순서대로 적용해 Task 계획 상태를 복원.
     *
     * @param taskId Task ID
     * @return 복원된 TaskPlan
     * @throws IllegalArgumentException Task 레코드가 없는 경우
     * @throws IllegalStateException 레코드 순서가 상태 전이 규칙을 위반하는 경우
     * @throws LedgerCorruptedException 레코드가 손상된 경우
     * @throws LedgerUnavailableException 백엔드 조회 실패 시
     */
    public TaskPlan replay(TaskId taskId) {
        List<PlanRecord> records = readAll(taskId);
        if (records.isEmpty()) {
            throw new IllegalArgumentException("No records for task: " + taskId.getValue());
        }
        return TaskPlan.replay(records);
    }
}
