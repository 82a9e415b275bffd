package com.ryuqq.conductor.core.model;

/**
 * 리소스 간 의존 관계.
 *
 * <p>{@code dependent}는 {@code prerequisite} 처리가 끝난 뒤에만 처리될 수 있습니다.</p>
 *
 * @param prerequisite 먼저 처리되어야 하는 리소스
 * @param dependent 나중에 처리되는 리소스
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DependencyEdge(
    ResourceId prerequisite,
    ResourceId dependent
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 양 끝점 중 하나라도 null인 경우
     */
    public DependencyEdge {
        if (prerequisite == null) {
            throw new IllegalArgumentException("prerequisite cannot be null");
        }
        if (dependent == null) {
            throw new IllegalArgumentException("dependent cannot be null");
        }
    }

    /**
     * 문자열 값으로 의존 관계 생성.
     *
     * @param prerequisite 선행 리소스 값
     * @param dependent 후행 리소스 값
     * @return DependencyEdge 인스턴스
     */
    public static DependencyEdge of(String prerequisite, String dependent) {
        return new DependencyEdge(ResourceId.of(prerequisite), ResourceId.of(dependent));
    }
}
