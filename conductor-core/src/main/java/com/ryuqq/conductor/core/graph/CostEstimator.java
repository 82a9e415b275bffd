package com.ryuqq.conductor.core.graph;

import com.ryuqq.conductor.core.model.ResourceId;

/**
 * 리소스 처리 비용 추정 SPI.
 *
 * <p>추정 비용이 {@code Budget.softThreshold()}를 넘는 리소스는 oversized로 분류되어
 * 단독 Subtask로 분리됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CostEstimator {

    /**
     * 리소스 하나의 예상 컨텍스트 소비량.
     *
     * @param resourceId 리소스
     * @return 예상 단위 (0 이상)
     */
    long estimate(ResourceId resourceId);

    /**
     * 모든 리소스를 0으로 추정하는 기본 구현.
     */
    static CostEstimator zero() {
        return resourceId -> 0L;
    }
}
