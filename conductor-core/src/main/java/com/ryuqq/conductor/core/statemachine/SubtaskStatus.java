package com.ryuqq.conductor.core.statemachine;

/**
 * Subtask의 생명주기 상태.
 *
 * <pre>
 * PENDING ──► READY ──► DISPATCHED ◄──► COMPACTING
 *    │          │           │
 *    │          │           ├─► COMPLETED
 *    │          │           ├─► FAILED
 *    │          │           └─► READY (세션 크래시 재큐잉)
 *    └──────────┴───────────┴─► CANCELLED
 * </pre>
 *
 * <p>PENDING은 선행 Subtask가 아직 COMPLETED가 아닌 상태입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum SubtaskStatus {

    /**
     * 선행 Subtask 대기 중.
     */
    PENDING,

    /**
     * 디스패치 가능 (Ready Queue에 있음).
     */
    READY,

    /**
     * Worker Session에서 실행 중.
     */
    DISPATCHED,

    /**
     * 세션이 컨텍스트를 요약(Compaction)하는 중.
     */
    COMPACTING,

    /**
     * 완료.
     */
    COMPLETED,

    /**
     * 실패 (영구).
     */
    FAILED,

    /**
     * 취소됨.
     */
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED, FAILED, CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Worker Session이 붙어 있는 상태인지 확인.
     *
     * @return DISPATCHED 또는 COMPACTING인 경우 true
     */
    public boolean isRunning() {
        return this == DISPATCHED || this == COMPACTING;
    }
}
