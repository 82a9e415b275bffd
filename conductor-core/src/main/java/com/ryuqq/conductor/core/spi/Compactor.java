package com.ryuqq.conductor.core.spi;

/**
 * 작업 컨텍스트 요약 SPI.
 *
 * <p>soft threshold를 넘은 세션의 누적 컨텍스트를 줄입니다. 요약본은 다음을 반드시 보존해야 합니다:</p>
 * <ul>
 *   <li>이미 처리를 완료한 리소스 목록</li>
 *   <li>남은 리소스를 올바르게 처리하는 데 필요한 교차 리소스 사실</li>
 * </ul>
 *
 * <p>같은 누적 상태에 대해서는 항상 같은 결과를 반환해야 합니다 (재생 멱등성).
 * 예외를 던지거나 요약 후에도 soft threshold를 넘으면 세션은 Reset됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Compactor {

    /**
     * 컨텍스트 요약.
     *
     * @param context 현재 누적 컨텍스트
     * @return 요약 결과
     */
    Compaction compact(WorkingContext context);

    /**
     * 기본 Compactor: 처리 목록과 모든 사실을 그대로 보존하고,
     * 사실 하나당 1 단위를 잔여량으로 계산합니다.
     *
     * @return 결정적인 기본 Compactor
     */
    static Compactor retainingFacts() {
        return context -> new Compaction(context.processed(), context.facts(), context.facts().size());
    }
}
