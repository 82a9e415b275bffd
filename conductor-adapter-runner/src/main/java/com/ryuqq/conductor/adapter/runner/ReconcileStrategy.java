package com.ryuqq.conductor.adapter.runner;

/**
 * 재시작 시 실행 중(DISPATCHED/COMPACTING)으로 남은 Subtask의 처리 전략.
 *
 * <p>프로세스가 종료되면 실행 중이던 Session의 결과는 Ledger에 없습니다.
 * LedgerRecovery는 이런 Subtask를 이 전략에 따라 처리합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ReconcileStrategy {

    /**
     * 암묵적 Session 크래시로 보고 재시도 횟수를 올려 재큐잉.
     *
     * <p>재시도 한도를 넘으면 RETRY_EXHAUSTED로 실패 처리됩니다.</p>
     */
    REQUEUE,

    /**
     * 즉시 실패 처리 (SESSION_LOST), 하위 Subtask는 취소.
     *
     * <p>리소스 처리가 멱등하지 않아 재실행이 위험한 경우 사용합니다.</p>
     */
    FAIL
}
