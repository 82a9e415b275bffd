package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.core.model.Budget;

/**
 * Session 하나의 컨텍스트 소비량 추적.
 *
 * <p>리소스 처리마다 {@link #observe(long)}로 소비량을 누적하고, soft/hard 임계값에
 * 따라 다음 행동을 결정합니다.</p>
 *
 * <p><strong>판정 규칙:</strong></p>
 * <ul>
 *   <li>누적 &gt; hardThreshold → RESET (방금 처리한 리소스는 버림)</li>
 *   <li>누적 &gt; softThreshold → COMPACT</li>
 *   <li>그 외 → CONTINUE</li>
 * </ul>
 *
 * <p>Session 스레드 하나에서만 사용되므로 동기화하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class BudgetMonitor {

    /**
     * 관찰 결과.
     */
    public enum Decision {
        CONTINUE,
        COMPACT,
        RESET
    }

    private final Budget budget;
    private long consumed;

    public BudgetMonitor(Budget budget) {
        if (budget == null) {
            throw new IllegalArgumentException("budget cannot be null");
        }
        this.budget = budget;
    }

    /**
     * 소비량 누적 및 판정.
     *
     * @param units 이번 리소스가 소비한 단위 (0 이상)
     * @return 다음 행동
     * @throws IllegalArgumentException units가 음수인 경우
     */
    public Decision observe(long units) {
        if (units < 0) {
            throw new IllegalArgumentException("units must be non-negative (current: " + units + ")");
        }
        consumed += units;
        if (consumed > budget.hardThreshold()) {
            return Decision.RESET;
        }
        if (consumed > budget.softThreshold()) {
            return Decision.COMPACT;
        }
        return Decision.CONTINUE;
    }

    /**
     * Compaction 반영.
     *
     * <p>소비량을 {@code postCompactionBaseline + residualUnits}로 재설정합니다.</p>
     *
     * @param residualUnits 요약본이 차지하는 단위
     * @return 재설정 후 softThreshold 이하이면 true (false면 Session Reset 필요)
     */
    public boolean compacted(long residualUnits) {
        if (residualUnits < 0) {
            throw new IllegalArgumentException("residualUnits must be non-negative (current: " + residualUnits + ")");
        }
        consumed = budget.postCompactionBaseline() + residualUnits;
        return consumed <= budget.softThreshold();
    }

    /**
     * 현재 누적 소비량.
     */
    public long consumed() {
        return consumed;
    }
}
