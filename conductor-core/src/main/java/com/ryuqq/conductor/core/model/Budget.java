package com.ryuqq.conductor.core.model;

/**
 * 작업 분할 및 Worker 컨텍스트 소비 한도 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxResourcesPerSubtask: Subtask 하나에 배정되는 최대 리소스 수 (기본 8)</li>
 *   <li>softThreshold: 초과 시 Compaction을 수행하는 컨텍스트 단위 (기본 6000)</li>
 *   <li>hardThreshold: 초과 시 세션을 Reset하는 컨텍스트 단위 (기본 8000)</li>
 *   <li>concurrencyLimit: 동시에 Active 상태일 수 있는 최대 세션 수 (기본 4)</li>
 *   <li>postCompactionBaseline: Compaction 직후 소비량의 기준값 (기본 1000)</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> {@code postCompactionBaseline < softThreshold < hardThreshold}</p>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>리소스가 큰 경우 (대형 파일): maxResourcesPerSubtask 감소 (8 → 5)</li>
 *   <li>Reset이 잦은 경우: softThreshold를 낮춰 Compaction을 더 일찍 수행</li>
 *   <li>외부 Worker 비용이 높은 경우: concurrencyLimit 감소</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxResourcesPerSubtask Subtask당 최대 리소스 수 (1 이상)
 * @param softThreshold Compaction 임계값 (양수)
 * @param hardThreshold Reset 임계값 (softThreshold 초과)
 * @param concurrencyLimit 최대 동시 세션 수 (1 이상)
 * @param postCompactionBaseline Compaction 후 기준 소비량 (0 이상, softThreshold 미만)
 */
public record Budget(
    int maxResourcesPerSubtask,
    long softThreshold,
    long hardThreshold,
    int concurrencyLimit,
    long postCompactionBaseline
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxResourcesPerSubtask=8, softThreshold=6000, hardThreshold=8000,
     * concurrencyLimit=4, postCompactionBaseline=1000</p>
     */
    public Budget() {
        this(8, 6000, 8000, 4, 1000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public Budget {
        if (maxResourcesPerSubtask <= 0) {
            throw new IllegalArgumentException(
                "maxResourcesPerSubtask must be positive (current: " + maxResourcesPerSubtask + ")"
            );
        }
        if (softThreshold <= 0) {
            throw new IllegalArgumentException(
                "softThreshold must be positive (current: " + softThreshold + ")"
            );
        }
        if (hardThreshold <= softThreshold) {
            throw new IllegalArgumentException(
                "hardThreshold must be greater than softThreshold (soft: " + softThreshold + ", hard: " + hardThreshold + ")"
            );
        }
        if (concurrencyLimit <= 0) {
            throw new IllegalArgumentException(
                "concurrencyLimit must be positive (current: " + concurrencyLimit + ")"
            );
        }
        if (postCompactionBaseline < 0 || postCompactionBaseline >= softThreshold) {
            throw new IllegalArgumentException(
                "postCompactionBaseline must be in [0, softThreshold) (current: " + postCompactionBaseline + ")"
            );
        }
    }

    /**
     * maxResourcesPerSubtask만 변경한 새 인스턴스 생성.
     */
    public Budget withMaxResourcesPerSubtask(int maxResourcesPerSubtask) {
        return new Budget(maxResourcesPerSubtask, softThreshold, hardThreshold, concurrencyLimit, postCompactionBaseline);
    }

    /**
     * softThreshold와 hardThreshold를 함께 변경한 새 인스턴스 생성.
     *
     * <p>두 값의 불변식 때문에 하나씩 변경하면 중간 상태가 검증에 걸릴 수 있습니다.</p>
     */
    public Budget withThresholds(long softThreshold, long hardThreshold) {
        return new Budget(maxResourcesPerSubtask, softThreshold, hardThreshold, concurrencyLimit, postCompactionBaseline);
    }

    /**
     * concurrencyLimit만 변경한 새 인스턴스 생성.
     */
    public Budget withConcurrencyLimit(int concurrencyLimit) {
        return new Budget(maxResourcesPerSubtask, softThreshold, hardThreshold, concurrencyLimit, postCompactionBaseline);
    }

    /**
     * postCompactionBaseline만 변경한 새 인스턴스 생성.
     */
    public Budget withPostCompactionBaseline(long postCompactionBaseline) {
        return new Budget(maxResourcesPerSubtask, softThreshold, hardThreshold, concurrencyLimit, postCompactionBaseline);
    }
}
