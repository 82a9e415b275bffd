package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.core.model.Budget;

/**
 * DispatchScheduler 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>budget: Subtask 크기, 컨텍스트 임계값, 동시성 한도 (기본 {@link Budget#Budget()})</li>
 *   <li>retryLimit: Session 크래시 재시도 한도 (기본 3)</li>
 *   <li>sessionTimeoutMs: Session 벽시계 제한 (기본 600000ms = 10분)</li>
 *   <li>shutdownTimeoutMs: 종료 시 진행 중인 Session 대기 시간 (기본 60000ms)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param budget 컨텍스트 Budget (null이 아니어야 함)
 * @param retryLimit 재시도 한도 (0 이상)
 * @param sessionTimeoutMs Session 제한 시간 (밀리초, 양수여야 함)
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 양수여야 함)
 */
public record SchedulerConfig(
    Budget budget,
    int retryLimit,
    long sessionTimeoutMs,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: budget=Budget(), retryLimit=3, sessionTimeoutMs=600000ms,
     * shutdownTimeoutMs=60000ms</p>
     */
    public SchedulerConfig() {
        this(new Budget(), 3, 600000, 60000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SchedulerConfig {
        if (budget == null) {
            throw new IllegalArgumentException("budget cannot be null");
        }
        if (retryLimit < 0) {
            throw new IllegalArgumentException(
                "retryLimit must be non-negative (current: " + retryLimit + ")"
            );
        }
        if (sessionTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "sessionTimeoutMs must be positive (current: " + sessionTimeoutMs + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * budget만 변경한 새 인스턴스 생성.
     */
    public SchedulerConfig withBudget(Budget budget) {
        return new SchedulerConfig(budget, retryLimit, sessionTimeoutMs, shutdownTimeoutMs);
    }

    /**
     * retryLimit만 변경한 새 인스턴스 생성.
     */
    public SchedulerConfig withRetryLimit(int retryLimit) {
        return new SchedulerConfig(budget, retryLimit, sessionTimeoutMs, shutdownTimeoutMs);
    }

    /**
     * sessionTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public SchedulerConfig withSessionTimeoutMs(long sessionTimeoutMs) {
        return new SchedulerConfig(budget, retryLimit, sessionTimeoutMs, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public SchedulerConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new SchedulerConfig(budget, retryLimit, sessionTimeoutMs, shutdownTimeoutMs);
    }
}
