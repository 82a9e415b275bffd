package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.core.exception.ConflictException;
import com.ryuqq.conductor.core.model.Diagnostic;
import com.ryuqq.conductor.core.model.ResourceId;
import com.ryuqq.conductor.core.model.SubtaskId;
import com.ryuqq.conductor.core.outcome.Fail;
import com.ryuqq.conductor.core.outcome.Ok;
import com.ryuqq.conductor.core.outcome.TaskOutcome;
import com.ryuqq.conductor.core.plan.Subtask;
import com.ryuqq.conductor.core.plan.TaskPlan;
import com.ryuqq.conductor.core.spi.ResourceProvider;
import com.ryuqq.conductor.core.spi.VerificationHook;
import com.ryuqq.conductor.core.spi.VerificationResult;
import com.ryuqq.conductor.core.statemachine.SubtaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Subtask 결과 병합 및 검증.
 *
 * <p><strong>처리 순서:</strong></p>
 * <ol>
 *   <li>FAILED Subtask가 있으면 첫 번째 실패 진단으로 Fail (쓰기/검증 없음)</li>
 *   <li>COMPLETED Subtask 결과물을 리소스별로 병합 (내용이 다르면 CONFLICT)</li>
 *   <li>병합 결과를 ResourceProvider로 기록</li>
 *   <li>검증 Hook을 순서대로 실행, 첫 실패에서 VERIFICATION_FAILED</li>
 * </ol>
 *
 * <p>충돌을 조용히 해결하지 않습니다 (last-writer-wins 없음).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ResultAggregator {

    private static final Logger log = LoggerFactory.getLogger(ResultAggregator.class);

    private final ResourceProvider provider;
    private final List<VerificationHook> hooks;

    /**
     * 생성자.
     *
     * @param provider 병합 결과를 기록할 저장소
     * @param hooks 순서대로 실행할 검증 Hook (빈 목록 가능)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ResultAggregator(ResourceProvider provider, List<VerificationHook> hooks) {
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        if (hooks == null) {
            throw new IllegalArgumentException("hooks cannot be null");
        }
        this.provider = provider;
        this.hooks = List.copyOf(hooks);
    }

    /**
     * Task 결과 병합 및 검증.
     *
     * @param plan 모든 Subtask가 종료된 TaskPlan
     * @return Ok 또는 Fail
     * @throws IllegalArgumentException plan이 null인 경우
     */
    public TaskOutcome aggregate(TaskPlan plan) {
        if (plan == null) {
            throw new IllegalArgumentException("plan cannot be null");
        }

        for (Subtask subtask : plan.subtasks()) {
            if (subtask.status() == SubtaskStatus.FAILED) {
                Diagnostic diagnostic = subtask.diagnostic() != null
                    ? subtask.diagnostic()
                    : Diagnostic.of(Diagnostic.SUBTASK_FAILED, "Subtask failed: " + subtask.id().getValue());
                log.info("Task {} not merged: subtask {} failed ({})",
                    plan.taskId().getValue(), subtask.id().getValue(), diagnostic.code());
                return new Fail(plan.taskId(), diagnostic);
            }
        }

        Map<ResourceId, String> merged;
        try {
            merged = merge(plan);
        } catch (ConflictException e) {
            log.warn("Task {} has conflicting results: {}", plan.taskId().getValue(), e.getMessage());
            return new Fail(plan.taskId(),
                Diagnostic.forResource(Diagnostic.CONFLICT, e.getResource(), 0, e.getMessage()));
        }

        for (Map.Entry<ResourceId, String> entry : merged.entrySet()) {
            provider.write(entry.getKey(), entry.getValue());
        }
        log.info("Task {} merged {} resources", plan.taskId().getValue(), merged.size());

        Set<ResourceId> resources = new LinkedHashSet<>(plan.resources());
        for (VerificationHook hook : hooks) {
            VerificationResult result = hook.run(resources);
            if (!result.pass()) {
                String diagnostics = result.diagnostics().isBlank() ? "verification failed" : result.diagnostics();
                log.warn("Task {} failed verification hook {}: {}", plan.taskId().getValue(), hook.name(), diagnostics);
                return new Fail(plan.taskId(), Diagnostic.forHook(hook.name(), diagnostics));
            }
            log.debug("Task {} passed verification hook {}", plan.taskId().getValue(), hook.name());
        }

        return new Ok(plan.taskId(), merged.size());
    }

    /**
     * COMPLETED Subtask 결과물 병합.
     *
     * <p>같은 리소스에 같은 내용은 하나로 합치고, 다른 내용이면 예외를 던집니다.</p>
     *
     * @param plan TaskPlan
     * @return 리소스별 병합 결과 (Subtask 생성 순서)
     * @throws ConflictException 같은 리소스에 서로 다른 결과가 있는 경우
     */
    public Map<ResourceId, String> merge(TaskPlan plan) {
        Map<ResourceId, String> merged = new LinkedHashMap<>();
        Map<ResourceId, SubtaskId> owners = new HashMap<>();
        for (Subtask subtask : plan.subtasks()) {
            if (subtask.status() != SubtaskStatus.COMPLETED) {
                continue;
            }
            for (Map.Entry<ResourceId, String> output : subtask.outputs().entrySet()) {
                String existing = merged.putIfAbsent(output.getKey(), output.getValue());
                if (existing == null) {
                    owners.put(output.getKey(), subtask.id());
                } else if (!existing.equals(output.getValue())) {
                    throw new ConflictException(output.getKey(), owners.get(output.getKey()), subtask.id());
                }
            }
        }
        return merged;
    }
}
