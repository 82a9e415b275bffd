package com.ryuqq.conductor.core.spi;

import com.ryuqq.conductor.core.model.ResourceId;

import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Compaction 결과 (요약된 작업 컨텍스트).
 *
 * @param processed 처리 완료 리소스 목록 (원본과 동일해야 함)
 * @param facts 보존된 교차 리소스 사실
 * @param residualUnits 요약본 자체가 차지하는 컨텍스트 단위 (0 이상)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Compaction(
    List<ResourceId> processed,
    SortedMap<String, String> facts,
    long residualUnits
) {

    public Compaction {
        if (processed == null) {
            throw new IllegalArgumentException("processed cannot be null");
        }
        if (facts == null) {
            throw new IllegalArgumentException("facts cannot be null");
        }
        if (residualUnits < 0) {
            throw new IllegalArgumentException("residualUnits must be non-negative (current: " + residualUnits + ")");
        }
        processed = List.copyOf(processed);
        facts = new TreeMap<>(facts);
    }
}
