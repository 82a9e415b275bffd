package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.core.exception.LedgerCorruptedException;
import com.ryuqq.conductor.core.exception.LedgerUnavailableException;
import com.ryuqq.conductor.core.ledger.PlanLedger;
import com.ryuqq.conductor.core.ledger.PlanRecord;
import com.ryuqq.conductor.core.model.ResourceId;
import com.ryuqq.conductor.core.model.TaskId;
import com.ryuqq.conductor.core.plan.TaskPlan;
import com.ryuqq.conductor.core.statemachine.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * LedgerRecovery 유닛 테스트.
 *
 * <p>재시작 후 Ledger에 남은 비종료 Task를 Scheduler에 다시 등록하는 동작을 검증합니다:</p>
 * <ul>
 *   <li>비종료 Task만 resume</li>
 *   <li>손상된 Task는 건너뛰고 나머지 계속</li>
 *   <li>Ledger 장애는 복구 중단</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class LedgerRecoveryTest {

    private static final TaskId RUNNING = TaskId.of("running-task");
    private static final TaskId FINISHED = TaskId.of("finished-task");

    @Mock
    private PlanLedger ledger;

    @Mock
    private DispatchScheduler scheduler;

    private LedgerRecovery recovery;

    @BeforeEach
    void setUp() {
        recovery = new LedgerRecovery(ledger, scheduler, new RecoveryConfig());
    }

    @Test
    void recover_비종료_Task만_resume한다() {
        // given
        TaskPlan running = plan(RUNNING, TaskStatus.IN_PROGRESS);
        when(ledger.taskIds()).thenReturn(List.of(RUNNING, FINISHED));
        when(ledger.replay(RUNNING)).thenReturn(running);
        when(ledger.replay(FINISHED)).thenReturn(plan(FINISHED, TaskStatus.COMPLETED));
        when(scheduler.resume(running, ReconcileStrategy.REQUEUE)).thenReturn(true);

        // when
        int resumed = recovery.recover();

        // then
        assertThat(resumed).isEqualTo(1);
        verify(scheduler).resume(running, ReconcileStrategy.REQUEUE);
        verify(scheduler, never()).resume(eq(plan(FINISHED, TaskStatus.COMPLETED)), any());
    }

    @Test
    void recover_FAIL_전략을_Scheduler에_전달한다() {
        // given
        recovery = new LedgerRecovery(ledger, scheduler, new RecoveryConfig(ReconcileStrategy.FAIL));
        TaskPlan running = plan(RUNNING, TaskStatus.PLANNED);
        when(ledger.taskIds()).thenReturn(List.of(RUNNING));
        when(ledger.replay(RUNNING)).thenReturn(running);
        when(scheduler.resume(running, ReconcileStrategy.FAIL)).thenReturn(true);

        // when
        int resumed = recovery.recover();

        // then
        assertThat(resumed).isEqualTo(1);
    }

    @Test
    void recover_손상된_Task는_건너뛰고_나머지는_계속한다() {
        // given
        TaskId corrupt = TaskId.of("corrupt-task");
        TaskPlan running = plan(RUNNING, TaskStatus.IN_PROGRESS);
        when(ledger.taskIds()).thenReturn(List.of(corrupt, RUNNING));
        when(ledger.replay(corrupt)).thenThrow(new IllegalStateException("Stale record"));
        when(ledger.replay(RUNNING)).thenReturn(running);
        when(scheduler.resume(running, ReconcileStrategy.REQUEUE)).thenReturn(true);

        // when
        int resumed = recovery.recover();

        // then
        assertThat(resumed).isEqualTo(1);
    }

    @Test
    void recover_이미_등록된_Task는_세지_않는다() {
        // given
        TaskPlan running = plan(RUNNING, TaskStatus.IN_PROGRESS);
        when(ledger.taskIds()).thenReturn(List.of(RUNNING));
        when(ledger.replay(RUNNING)).thenReturn(running);
        when(scheduler.resume(running, ReconcileStrategy.REQUEUE)).thenReturn(false);

        // when & then
        assertThat(recovery.recover()).isZero();
    }

    @Test
    void recover_레코드_줄이_손상된_Task는_건너뛰고_나머지는_계속한다() {
        // given
        TaskId corrupt = TaskId.of("corrupt-task");
        TaskPlan running = plan(RUNNING, TaskStatus.IN_PROGRESS);
        when(ledger.taskIds()).thenReturn(List.of(RUNNING, corrupt));
        when(ledger.replay(RUNNING)).thenReturn(running);
        when(ledger.replay(corrupt)).thenThrow(
            new LedgerCorruptedException("Corrupted ledger line 2 in corrupt-task.jsonl", new IllegalArgumentException("bad")));
        when(scheduler.resume(running, ReconcileStrategy.REQUEUE)).thenReturn(true);

        // when
        int resumed = recovery.recover();

        // then
        assertThat(resumed).isEqualTo(1);
        verify(scheduler).resume(running, ReconcileStrategy.REQUEUE);
    }

    @Test
    void recover_Ledger_장애시_예외를_전파한다() {
        // given
        when(ledger.taskIds()).thenReturn(List.of(RUNNING));
        when(ledger.replay(RUNNING)).thenThrow(
            new LedgerUnavailableException("Failed to read records", new IllegalStateException("offline")));

        // when & then
        assertThatThrownBy(() -> recovery.recover())
            .isInstanceOf(LedgerUnavailableException.class);
        verify(scheduler, never()).resume(any(), any());
    }

    @Test
    void recover_Task가_없으면_0() {
        // given
        when(ledger.taskIds()).thenReturn(List.of());

        // when & then
        assertThat(recovery.recover()).isZero();
    }

    private static TaskPlan plan(TaskId taskId, TaskStatus status) {
        TaskPlan plan = TaskPlan.start(PlanRecord.taskCreated(taskId, "recover", List.of(ResourceId.of("src/A.java")), 1L));
        if (status == TaskStatus.PLANNED) {
            return plan;
        }
        plan.apply(PlanRecord.taskTransition(taskId, TaskStatus.PLANNED, TaskStatus.IN_PROGRESS, 2L, null));
        if (status != TaskStatus.IN_PROGRESS) {
            plan.apply(PlanRecord.taskTransition(taskId, TaskStatus.IN_PROGRESS, status, 3L, null));
        }
        return plan;
    }
}
