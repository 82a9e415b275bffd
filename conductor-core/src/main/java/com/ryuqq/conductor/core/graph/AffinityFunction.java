package com.ryuqq.conductor.core.graph;

import com.ryuqq.conductor.core.model.ResourceId;

/**
 * Affinity 그룹 키 SPI.
 *
 * <p>같은 키를 가진 리소스는 가능한 한 같은 Subtask에 묶입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AffinityFunction {

    /**
     * 리소스의 Affinity 키.
     *
     * @param resourceId 리소스
     * @return 그룹 키 (null 불가)
     */
    String keyOf(ResourceId resourceId);

    /**
     * 디렉토리 기준 그룹핑 (기본값).
     */
    static AffinityFunction byDirectory() {
        return ResourceId::directory;
    }
}
