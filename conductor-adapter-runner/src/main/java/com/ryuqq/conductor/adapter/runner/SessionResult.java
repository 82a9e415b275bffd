package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.core.exception.BudgetExceededException;
import com.ryuqq.conductor.core.model.ResourceId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Worker Session 실행 결과.
 *
 * <p>어떤 종류든 Session이 처리를 완료한 리소스({@code processed})와 그 결과물({@code outputs})을
 * 함께 담습니다. Scheduler는 이를 바탕으로 완료, 분할, 재큐잉, 실패를 결정합니다.</p>
 *
 * @param kind 결과 종류
 * @param processed 처리 완료 리소스 (처리 순서)
 * @param outputs 리소스별 결과물
 * @param resource 예산 초과, 분리 대상 또는 크래시가 발생한 리소스 (해당 없으면 null)
 * @param cause 크래시 원인 또는 {@link BudgetExceededException} (그 외 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SessionResult(
    Kind kind,
    List<ResourceId> processed,
    Map<ResourceId, String> outputs,
    ResourceId resource,
    Throwable cause
) {

    /**
     * 결과 종류.
     */
    public enum Kind {
        /** 모든 리소스 처리 완료 */
        COMPLETED,
        /** Reset: 처리된 부분만 완료, 나머지는 새 Subtask로 */
        RESET,
        /** 첫 리소스가 hardThreshold를 넘음: 그 리소스만 단독 Subtask로 분리하고 나머지는 새 Subtask로 */
        OVERSIZED,
        /** 단일 리소스 Subtask가 새 Session에서도 hardThreshold 안에 들어가지 않음 */
        BUDGET_EXCEEDED,
        /** 처리 중 예외 발생 */
        CRASHED,
        /** 취소 요청을 관찰하고 중단 */
        STOPPED
    }

    public SessionResult {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        processed = processed == null ? List.of() : List.copyOf(processed);
        outputs = outputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }

    public static SessionResult completed(List<ResourceId> processed, Map<ResourceId, String> outputs) {
        return new SessionResult(Kind.COMPLETED, processed, outputs, null, null);
    }

    public static SessionResult reset(List<ResourceId> processed, Map<ResourceId, String> outputs) {
        return new SessionResult(Kind.RESET, processed, outputs, null, null);
    }

    public static SessionResult oversized(ResourceId resource) {
        return new SessionResult(Kind.OVERSIZED, List.of(), Map.of(), resource, null);
    }

    public static SessionResult budgetExceeded(BudgetExceededException cause) {
        return new SessionResult(Kind.BUDGET_EXCEEDED, List.of(), Map.of(), cause.getResource(), cause);
    }

    public static SessionResult crashed(List<ResourceId> processed, Map<ResourceId, String> outputs,
                                        ResourceId resource, Throwable cause) {
        return new SessionResult(Kind.CRASHED, processed, outputs, resource, cause);
    }

    public static SessionResult stopped(List<ResourceId> processed, Map<ResourceId, String> outputs) {
        return new SessionResult(Kind.STOPPED, processed, outputs, null, null);
    }
}
