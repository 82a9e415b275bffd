package com.ryuqq.conductor.adapter.runner;

/**
 * LedgerRecovery 설정 (불변 record).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param runningSubtaskStrategy 실행 중으로 남은 Subtask 처리 전략 (기본 REQUEUE)
 */
public record RecoveryConfig(ReconcileStrategy runningSubtaskStrategy) {

    /**
     * 기본 설정 생성자 (REQUEUE).
     */
    public RecoveryConfig() {
        this(ReconcileStrategy.REQUEUE);
    }

    public RecoveryConfig {
        if (runningSubtaskStrategy == null) {
            throw new IllegalArgumentException("runningSubtaskStrategy cannot be null");
        }
    }

    /**
     * runningSubtaskStrategy만 변경한 새 인스턴스 생성.
     */
    public RecoveryConfig withRunningSubtaskStrategy(ReconcileStrategy runningSubtaskStrategy) {
        return new RecoveryConfig(runningSubtaskStrategy);
    }
}
