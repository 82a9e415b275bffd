package com.ryuqq.conductor.core.spi;

import java.util.Map;

/**
 * 리소스 하나의 처리 결과.
 *
 * @param output 리소스의 새 내용
 * @param consumedUnits 이번 처리로 소비한 컨텍스트 단위 (0 이상)
 * @param facts 남은 리소스 처리에 필요한 교차 리소스 사실 (key → value)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ProcessedResource(
    String output,
    long consumedUnits,
    Map<String, String> facts
) {

    public ProcessedResource {
        if (output == null) {
            throw new IllegalArgumentException("output cannot be null");
        }
        if (consumedUnits < 0) {
            throw new IllegalArgumentException("consumedUnits must be non-negative (current: " + consumedUnits + ")");
        }
        facts = facts == null ? Map.of() : Map.copyOf(facts);
    }

    /**
     * facts 없이 처리 결과 생성.
     */
    public static ProcessedResource of(String output, long consumedUnits) {
        return new ProcessedResource(output, consumedUnits, Map.of());
    }
}
