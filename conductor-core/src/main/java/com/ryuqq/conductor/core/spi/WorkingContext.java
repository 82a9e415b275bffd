package com.ryuqq.conductor.core.spi;

import com.ryuqq.conductor.core.model.ResourceId;
import com.ryuqq.conductor.core.model.SubtaskId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Worker Session의 누적 작업 컨텍스트.
 *
 * <p>세션이 처리를 완료한 리소스 목록과 처리 중 수집된 교차 리소스 사실(facts)을 담습니다.
 * Compaction은 이 두 가지를 반드시 보존해야 합니다.</p>
 *
 * <p>세션 스레드 하나에서만 변경되며, 외부에는 읽기 전용 뷰를 제공합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkingContext {

    private final SubtaskId subtaskId;
    private final List<ResourceId> processed = new ArrayList<>();
    private final SortedMap<String, String> facts = new TreeMap<>();
    private int compactions;

    public WorkingContext(SubtaskId subtaskId) {
        if (subtaskId == null) {
            throw new IllegalArgumentException("subtaskId cannot be null");
        }
        this.subtaskId = subtaskId;
    }

    /**
     * 처리 완료 리소스와 사실을 누적.
     *
     * @param resourceId 처리 완료 리소스
     * @param newFacts 이번 처리에서 얻은 사실
     */
    public void record(ResourceId resourceId, Map<String, String> newFacts) {
        processed.add(resourceId);
        facts.putAll(newFacts);
    }

    /**
     * Compaction 결과로 컨텍스트를 교체.
     *
     * @param compaction Compactor가 반환한 요약
     * @throws IllegalStateException 처리 완료 목록이 보존되지 않은 경우
     */
    public void replaceWith(Compaction compaction) {
        if (!compaction.processed().equals(processed)) {
            throw new IllegalStateException(
                "Compaction must preserve processed resources (expected: " + processed + ", got: " + compaction.processed() + ")"
            );
        }
        facts.clear();
        facts.putAll(compaction.facts());
        compactions++;
    }

    public SubtaskId subtaskId() {
        return subtaskId;
    }

    public List<ResourceId> processed() {
        return Collections.unmodifiableList(processed);
    }

    public SortedMap<String, String> facts() {
        return Collections.unmodifiableSortedMap(facts);
    }

    public int compactions() {
        return compactions;
    }
}
