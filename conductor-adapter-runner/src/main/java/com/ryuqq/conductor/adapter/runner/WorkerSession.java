package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.core.exception.BudgetExceededException;
import com.ryuqq.conductor.core.model.Budget;
import com.ryuqq.conductor.core.model.ResourceId;
import com.ryuqq.conductor.core.model.SessionId;
import com.ryuqq.conductor.core.plan.Subtask;
import com.ryuqq.conductor.core.spi.Compaction;
import com.ryuqq.conductor.core.spi.Compactor;
import com.ryuqq.conductor.core.spi.ProcessedResource;
import com.ryuqq.conductor.core.spi.ResourceProcessor;
import com.ryuqq.conductor.core.spi.ResourceProvider;
import com.ryuqq.conductor.core.spi.WorkingContext;
import com.ryuqq.conductor.core.statemachine.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Worker Session.
 *
 * <p>Subtask 하나의 리소스를 순서대로 처리하면서 {@link BudgetMonitor}로 컨텍스트 소비량을
 * 추적합니다. Session은 Ledger에 직접 쓰지 않고 {@link SessionResult}를 반환하며,
 * 기록은 Scheduler가 담당합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * For each resource:
 *   1. 취소 플래그 확인 → STOPPED
 *   2. 제한 시간 확인 (이미 처리한 리소스가 있을 때) → RESET
 *   3. provider.read → processor.process
 *   4. monitor.observe(units):
 *      - RESET: 현재 리소스 버림
 *        (처리한 것이 없으면 OVERSIZED, 리소스가 하나뿐인 Subtask면 BUDGET_EXCEEDED)
 *      - COMPACT: compactor.compact → 여전히 soft 초과거나 예외면 RESET (현재 리소스 유지)
 *      - CONTINUE
 * </pre>
 *
 * <p>{@link #run()}은 예외를 던지지 않습니다. ResourceProvider/ResourceProcessor의
 * RuntimeException은 CRASHED 결과가 됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkerSession {

    private static final Logger log = LoggerFactory.getLogger(WorkerSession.class);

    private final SessionId sessionId;
    private final Subtask subtask;
    private final ResourceProvider provider;
    private final ResourceProcessor processor;
    private final Compactor compactor;
    private final Budget budget;
    private final long timeoutMs;
    private final Clock clock;
    private final BooleanSupplier stopRequested;
    private final SessionStateListener stateListener;

    private SessionState state = SessionState.ACTIVE;

    /**
     * 생성자.
     *
     * @param sessionId Session ID
     * @param subtask 처리할 Subtask (DISPATCHED 시점 스냅샷)
     * @param provider 리소스 저장소
     * @param processor 리소스 처리기
     * @param compactor 컨텍스트 요약기
     * @param budget 컨텍스트 Budget
     * @param timeoutMs Session 제한 시간 (밀리초)
     * @param clock 시계
     * @param stopRequested 취소 플래그
     * @param stateListener 상태 변경 콜백
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public WorkerSession(SessionId sessionId, Subtask subtask, ResourceProvider provider,
                         ResourceProcessor processor, Compactor compactor, Budget budget,
                         long timeoutMs, Clock clock, BooleanSupplier stopRequested,
                         SessionStateListener stateListener) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        if (subtask == null) {
            throw new IllegalArgumentException("subtask cannot be null");
        }
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        if (processor == null) {
            throw new IllegalArgumentException("processor cannot be null");
        }
        if (compactor == null) {
            throw new IllegalArgumentException("compactor cannot be null");
        }
        if (budget == null) {
            throw new IllegalArgumentException("budget cannot be null");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive (current: " + timeoutMs + ")");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (stopRequested == null) {
            throw new IllegalArgumentException("stopRequested cannot be null");
        }
        if (stateListener == null) {
            throw new IllegalArgumentException("stateListener cannot be null");
        }
        this.sessionId = sessionId;
        this.subtask = subtask;
        this.provider = provider;
        this.processor = processor;
        this.compactor = compactor;
        this.budget = budget;
        this.timeoutMs = timeoutMs;
        this.clock = clock;
        this.stopRequested = stopRequested;
        this.stateListener = stateListener;
    }

    /**
     * Subtask 실행.
     *
     * @return 실행 결과 (예외를 던지지 않음)
     */
    public SessionResult run() {
        WorkingContext context = new WorkingContext(subtask.id());
        BudgetMonitor monitor = new BudgetMonitor(budget);
        Map<ResourceId, String> outputs = new LinkedHashMap<>();
        List<ResourceId> resources = subtask.resources();
        long deadline = clock.millis() + timeoutMs;
        ResourceId current = null;

        log.debug("Session {} started for {} ({} resources)", sessionId.getValue(), subtask.id().getValue(), resources.size());

        try {
            for (ResourceId resource : resources) {
                current = resource;
                if (stopRequested.getAsBoolean()) {
                    log.info("Session {} stopped by cancellation after {} resources",
                        sessionId.getValue(), context.processed().size());
                    return finish(SessionResult.stopped(context.processed(), outputs));
                }
                if (!context.processed().isEmpty() && clock.millis() >= deadline) {
                    log.warn("Session {} exceeded {}ms, resetting after {} resources",
                        sessionId.getValue(), timeoutMs, context.processed().size());
                    return reset(context, outputs);
                }

                String content = provider.read(resource);
                ProcessedResource result = processor.process(resource, content, context);
                BudgetMonitor.Decision decision = monitor.observe(result.consumedUnits());

                if (decision == BudgetMonitor.Decision.RESET) {
                    if (context.processed().isEmpty() && resources.size() > 1) {
                        log.info("Session {}: {} alone consumed {} units (hard threshold {}), isolating it",
                            sessionId.getValue(), resource, monitor.consumed(), budget.hardThreshold());
                        return finish(SessionResult.oversized(resource));
                    }
                    if (context.processed().isEmpty()) {
                        log.warn("Session {}: {} alone consumed {} units (hard threshold {})",
                            sessionId.getValue(), resource, monitor.consumed(), budget.hardThreshold());
                        return finish(SessionResult.budgetExceeded(
                            new BudgetExceededException(resource, monitor.consumed(), budget.hardThreshold())));
                    }
                    log.info("Session {} crossed hard threshold at {} ({} units), discarding it",
                        sessionId.getValue(), resource, monitor.consumed());
                    return reset(context, outputs);
                }

                context.record(resource, result.facts());
                outputs.put(resource, result.output());

                if (decision == BudgetMonitor.Decision.COMPACT && !compact(context, monitor)) {
                    return reset(context, outputs);
                }
            }
            return finish(SessionResult.completed(context.processed(), outputs));
        } catch (RuntimeException e) {
            log.warn("Session {} crashed on {} after {} resources",
                sessionId.getValue(), current, context.processed().size(), e);
            return finish(SessionResult.crashed(context.processed(), outputs, current, e));
        }
    }

    /**
     * Compaction 수행.
     *
     * @return Session을 계속할 수 있으면 true
     */
    private boolean compact(WorkingContext context, BudgetMonitor monitor) {
        long before = monitor.consumed();
        changeState(SessionState.COMPACTING);
        boolean withinSoft;
        try {
            Compaction compaction = compactor.compact(context);
            context.replaceWith(compaction);
            withinSoft = monitor.compacted(compaction.residualUnits());
        } catch (RuntimeException e) {
            log.warn("Session {} compaction failed, resetting", sessionId.getValue(), e);
            return false;
        }
        if (!withinSoft) {
            log.info("Session {} still above soft threshold after compaction ({} units), resetting",
                sessionId.getValue(), monitor.consumed());
            return false;
        }
        log.debug("Session {} compacted {} -> {} units", sessionId.getValue(), before, monitor.consumed());
        changeState(SessionState.ACTIVE);
        return true;
    }

    /**
     * 처리된 부분까지로 Session을 끝냄. 남은 리소스가 없으면 완료로 처리.
     */
    private SessionResult reset(WorkingContext context, Map<ResourceId, String> outputs) {
        if (context.processed().size() == subtask.resources().size()) {
            return finish(SessionResult.completed(context.processed(), outputs));
        }
        changeState(SessionState.RESET);
        return finish(SessionResult.reset(context.processed(), outputs));
    }

    private SessionResult finish(SessionResult result) {
        changeState(SessionState.TERMINATED);
        log.debug("Session {} finished: {}", sessionId.getValue(), result.kind());
        return result;
    }

    private void changeState(SessionState next) {
        SessionState previous = state;
        state = next;
        stateListener.onStateChange(sessionId, subtask.id(), previous, next);
    }

    public SessionId getSessionId() {
        return sessionId;
    }

    public SessionState getState() {
        return state;
    }
}
