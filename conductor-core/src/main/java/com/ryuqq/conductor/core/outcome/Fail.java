package com.ryuqq.conductor.core.outcome;

import com.ryuqq.conductor.core.model.Diagnostic;
import com.ryuqq.conductor.core.model.TaskId;

/**
 * 영구적 실패.
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>Subtask가 BudgetExceeded 또는 재시도 한도 초과로 실패</li>
 *   <li>같은 리소스에 서로 다른 결과 (CONFLICT)</li>
 *   <li>검증 Hook 실패 (VERIFICATION_FAILED)</li>
 * </ul>
 *
 * @param taskId Task ID
 * @param diagnostic 구조화된 진단 정보
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Fail(
    TaskId taskId,
    Diagnostic diagnostic
) implements TaskOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException taskId 또는 diagnostic이 null인 경우
     */
    public Fail {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (diagnostic == null) {
            throw new IllegalArgumentException("diagnostic cannot be null");
        }
    }

    /**
     * 진단 코드 조회.
     *
     * @return 진단 코드 (예: CONFLICT)
     */
    public String errorCode() {
        return diagnostic.code();
    }
}
