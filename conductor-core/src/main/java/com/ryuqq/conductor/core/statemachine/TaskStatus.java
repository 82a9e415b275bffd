package com.ryuqq.conductor.core.statemachine;

/**
 * Task의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>PLANNED → IN_PROGRESS (첫 Subtask 디스패치)</li>
 *   <li>PLANNED → CANCELLED / FAILED</li>
 *   <li>IN_PROGRESS → COMPLETED / FAILED / CANCELLED</li>
 *   <li><strong>역방향 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <pre>
 * PLANNED
 *    │
 *    ▼ (디스패치)
 * IN_PROGRESS
 *    │
 *    ├─► COMPLETED (병합 + 검증 통과)
 *    ├─► FAILED (Subtask 실패, 충돌, 검증 실패)
 *    └─► CANCELLED (cancel 요청)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum TaskStatus {

    /**
     * 그래프 생성 완료, 아직 디스패치 안 됨.
     */
    PLANNED,

    /**
     * 하나 이상의 Subtask가 디스패치됨.
     */
    IN_PROGRESS,

    /**
     * 완료 (병합 및 검증 통과).
     */
    COMPLETED,

    /**
     * 실패 (진단 정보 포함).
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
}
