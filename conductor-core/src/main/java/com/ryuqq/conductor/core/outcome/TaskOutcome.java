package com.ryuqq.conductor.core.outcome;

import com.ryuqq.conductor.core.model.TaskId;

/**
 * Task 집계 결과.
 *
 * <p>TaskOutcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 병합 및 검증 통과</li>
 *   <li>{@link Fail}: Subtask 실패, 결과 충돌, 검증 실패 (진단 포함)</li>
 *   <li>{@link Cancelled}: 집계 전에 취소됨</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface TaskOutcome permits Ok, Fail, Cancelled {

    /**
     * 결과가 속한 Task.
     *
     * @return Task ID
     */
    TaskId taskId();

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
