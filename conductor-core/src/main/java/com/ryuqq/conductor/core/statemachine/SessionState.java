package com.ryuqq.conductor.core.statemachine;

/**
 * Worker Session 상태.
 *
 * <ul>
 *   <li>ACTIVE → COMPACTING → ACTIVE (soft threshold)</li>
 *   <li>ACTIVE → RESET → TERMINATED (hard threshold, 타임아웃)</li>
 *   <li>ACTIVE → TERMINATED (완료, 취소, 크래시)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum SessionState {
    ACTIVE,
    COMPACTING,
    RESET,
    TERMINATED
}
