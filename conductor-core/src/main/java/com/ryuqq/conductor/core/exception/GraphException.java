package com.ryuqq.conductor.core.exception;

/**
 * Task 그래프 생성 실패.
 *
 * <p>제출 시점의 치명적 오류로, 어떤 Subtask도 생성되기 전에 Task가 거부됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class GraphException extends RuntimeException {

    /**
     * 실패 유형.
     */
    public enum Kind {
        /** 의존 관계에 순환이 존재 (자기 자신에 대한 간선 포함). */
        CYCLIC,
        /** 리소스 집합이 비어 있음. */
        EMPTY_RESOURCE_SET,
        /** 의존 관계가 리소스 집합에 없는 리소스를 참조. */
        UNKNOWN_RESOURCE
    }

    private final Kind kind;

    public GraphException(Kind kind, String message) {
        super(message);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
