package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.application.orchestrator.Orchestrator;
import com.ryuqq.conductor.application.orchestrator.PlanReceipt;
import com.ryuqq.conductor.core.exception.LedgerUnavailableException;
import com.ryuqq.conductor.core.graph.SubtaskSpec;
import com.ryuqq.conductor.core.graph.TaskGraph;
import com.ryuqq.conductor.core.graph.TaskGraphBuilder;
import com.ryuqq.conductor.core.ledger.PlanLedger;
import com.ryuqq.conductor.core.ledger.PlanRecord;
import com.ryuqq.conductor.core.model.DependencyEdge;
import com.ryuqq.conductor.core.model.Diagnostic;
import com.ryuqq.conductor.core.model.ResourceId;
import com.ryuqq.conductor.core.model.SessionId;
import com.ryuqq.conductor.core.model.SubtaskId;
import com.ryuqq.conductor.core.model.TaskId;
import com.ryuqq.conductor.core.outcome.Cancelled;
import com.ryuqq.conductor.core.outcome.Fail;
import com.ryuqq.conductor.core.outcome.TaskOutcome;
import com.ryuqq.conductor.core.plan.Subtask;
import com.ryuqq.conductor.core.plan.TaskPlan;
import com.ryuqq.conductor.core.spi.Compactor;
import com.ryuqq.conductor.core.spi.ProgressListener;
import com.ryuqq.conductor.core.spi.ResourceProcessor;
import com.ryuqq.conductor.core.spi.ResourceProvider;
import com.ryuqq.conductor.core.statemachine.SessionState;
import com.ryuqq.conductor.core.statemachine.SubtaskStatus;
import com.ryuqq.conductor.core.statemachine.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Dispatch Scheduler ({@link Orchestrator} 구현체).
 *
 * <p>READY Subtask를 FIFO 큐에서 꺼내 Worker Session에 배분하고, Session 결과에 따라
 * 완료, 분할, 재큐잉, 실패를 기록합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>Task 제출 시 그래프 빌드 및 생성 레코드 기록</li>
 *   <li>동시성 한도 내에서 READY Subtask 배분 (oversized Subtask는 단독 실행)</li>
 *   <li>Session 결과 처리 (완료, Reset 분할, 초과 리소스 분리, 예산 초과, 크래시 재큐잉, 취소)</li>
 *   <li>모든 Subtask 종료 시 ResultAggregator 실행 (잠금 밖에서)</li>
 *   <li>Ledger 장애 시 중단(halt)</li>
 * </ul>
 *
 * <p><strong>기록 순서:</strong></p>
 * <pre>
 * ledger.append(record)   // 1. Write-Ahead
 *   ↓
 * plan.apply(record)      // 2. 메모리 상태 변경
 *   ↓
 * listener.onTransition   // 3. 진행 상황 통지
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>단일 ReentrantLock이 READY 큐, 실행 중 Session, TaskPlan, Ledger 기록을 보호</li>
 *   <li>Worker Session은 concurrencyLimit 크기의 고정 스레드 풀에서 실행</li>
 *   <li>취소는 협력적: Session이 리소스 경계에서 플래그를 확인</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DispatchScheduler implements Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(DispatchScheduler.class);

    private final PlanLedger ledger;
    private final TaskGraphBuilder graphBuilder;
    private final ResourceProvider provider;
    private final ResourceProcessor processor;
    private final Compactor compactor;
    private final ResultAggregator aggregator;
    private final ProgressListener listener;
    private final SchedulerConfig config;
    private final Clock clock;
    private final ExecutorService workers;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition terminated = lock.newCondition();
    private final Map<TaskId, TaskPlan> plans = new LinkedHashMap<>();
    private final Map<TaskId, TaskOutcome> outcomes = new HashMap<>();
    private final Deque<QueuedSubtask> readyQueue = new ArrayDeque<>();
    private final Map<SubtaskId, RunningSession> running = new HashMap<>();
    private final Set<TaskId> aggregating = new HashSet<>();
    private boolean exclusiveRunning;
    private boolean shutdown;
    private LedgerUnavailableException haltCause;

    /**
     * 생성자 (기본 그래프 빌더, 기본 Compactor, 리스너 없음, 시스템 시계).
     *
     * @param ledger Plan Ledger
     * @param provider 리소스 저장소
     * @param processor 리소스 처리기
     * @param aggregator 결과 병합기
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DispatchScheduler(PlanLedger ledger, ResourceProvider provider, ResourceProcessor processor,
                             ResultAggregator aggregator, SchedulerConfig config) {
        this(ledger, new TaskGraphBuilder(), provider, processor, Compactor.retainingFacts(),
            aggregator, ProgressListener.none(), config, Clock.systemUTC());
    }

    /**
     * 생성자 (모든 협력 객체 주입).
     *
     * @param ledger Plan Ledger
     * @param graphBuilder 그래프 빌더
     * @param provider 리소스 저장소
     * @param processor 리소스 처리기
     * @param compactor 컨텍스트 요약기
     * @param aggregator 결과 병합기
     * @param listener 진행 상황 리스너
     * @param config 설정
     * @param clock 레코드 시각 및 Session 제한 시간용 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DispatchScheduler(PlanLedger ledger, TaskGraphBuilder graphBuilder, ResourceProvider provider,
                             ResourceProcessor processor, Compactor compactor, ResultAggregator aggregator,
                             ProgressListener listener, SchedulerConfig config, Clock clock) {
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        if (graphBuilder == null) {
            throw new IllegalArgumentException("graphBuilder cannot be null");
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
        if (aggregator == null) {
            throw new IllegalArgumentException("aggregator cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }

        this.ledger = ledger;
        this.graphBuilder = graphBuilder;
        this.provider = provider;
        this.processor = processor;
        this.compactor = compactor;
        this.aggregator = aggregator;
        this.listener = listener;
        this.config = config;
        this.clock = clock;
        this.workers = Executors.newFixedThreadPool(config.budget().concurrencyLimit());
    }

    // ========== Orchestrator ==========

    @Override
    public PlanReceipt submit(String description, Collection<ResourceId> resources, Collection<DependencyEdge> edges) {
        requireAcceptingWork();
        TaskGraph graph = graphBuilder.build(description, resources, edges, config.budget());

        lock.lock();
        try {
            requireAcceptingWork();
            TaskId taskId = graph.taskId();
            PlanRecord created = PlanRecord.taskCreated(taskId, graph.description(), graph.resources(),
                graph.edges(), clock.millis());
            ledger.append(created);
            TaskPlan plan = TaskPlan.start(created);
            plans.put(taskId, plan);
            notifyListener(created);

            List<SubtaskId> subtaskIds = new ArrayList<>();
            for (SubtaskSpec spec : graph.subtasks()) {
                SubtaskStatus initial = spec.dependencies().isEmpty() ? SubtaskStatus.READY : SubtaskStatus.PENDING;
                record(plan, PlanRecord.subtaskCreated(taskId, spec.id(), initial, spec.resources(),
                    spec.dependencies(), spec.oversized(), null, 0, clock.millis()));
                if (initial == SubtaskStatus.READY) {
                    enqueue(plan, spec.id());
                }
                subtaskIds.add(spec.id());
            }
            log.info("Task {} planned: {} resources in {} subtasks",
                taskId.getValue(), graph.resources().size(), subtaskIds.size());

            dispatch();
            return new PlanReceipt(taskId, subtaskIds);
        } catch (LedgerUnavailableException e) {
            halt(e);
            throw e;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void cancel(TaskId taskId) {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        lock.lock();
        try {
            TaskPlan plan = plans.get(taskId);
            if (plan == null || plan.status().isTerminal() || haltCause != null) {
                log.debug("Ignoring cancel for {} (unknown, terminal or halted)", taskId.getValue());
                return;
            }
            record(plan, PlanRecord.taskTransition(taskId, plan.status(), TaskStatus.CANCELLED, clock.millis(), null));
            for (Subtask subtask : plan.subtasks()) {
                if (subtask.status() == SubtaskStatus.PENDING || subtask.status() == SubtaskStatus.READY) {
                    record(plan, PlanRecord.subtaskTransition(taskId, subtask.id(), subtask.status(),
                        SubtaskStatus.CANCELLED, null, clock.millis()));
                } else if (subtask.status().isRunning()) {
                    RunningSession session = running.get(subtask.id());
                    if (session != null) {
                        session.stop.set(true);
                    }
                }
            }
            complete(taskId, new Cancelled(taskId));
            log.info("Task {} cancelled", taskId.getValue());
        } catch (LedgerUnavailableException e) {
            halt(e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public TaskStatus status(TaskId taskId) {
        lock.lock();
        try {
            return requirePlan(taskId).status();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public TaskPlan plan(TaskId taskId) {
        lock.lock();
        try {
            return requirePlan(taskId).copy();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public TaskOutcome awaitTermination(TaskId taskId, long timeoutMs) throws InterruptedException {
        lock.lock();
        try {
            requirePlan(taskId);
            long remainingNanos = TimeUnit.MILLISECONDS.toNanos(timeoutMs);
            while (!outcomes.containsKey(taskId)) {
                if (haltCause != null) {
                    throw new IllegalStateException("Scheduler halted: ledger unavailable", haltCause);
                }
                if (remainingNanos <= 0) {
                    return null;
                }
                remainingNanos = terminated.awaitNanos(remainingNanos);
            }
            return outcomes.get(taskId);
        } finally {
            lock.unlock();
        }
    }

    // ========== 재시작 복구 ==========

    /**
     * Ledger에서 재생한 비종료 Task를 이어서 실행.
     *
     * <p>실행 중(DISPATCHED/COMPACTING)으로 남은 Subtask는 전략에 따라 재큐잉하거나
     * 실패 처리합니다. 이미 등록된 Task는 무시합니다.</p>
     *
     * @param replayed Ledger 재생 결과
     * @param strategy 실행 중 Subtask 처리 전략
     * @return 등록했으면 true, 이미 등록된 Task이면 false
     * @throws IllegalArgumentException replayed가 종료 상태인 경우
     * @throws IllegalStateException Scheduler가 중단되었거나 종료된 경우
     */
    public boolean resume(TaskPlan replayed, ReconcileStrategy strategy) {
        if (replayed == null) {
            throw new IllegalArgumentException("replayed cannot be null");
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        if (replayed.status().isTerminal()) {
            throw new IllegalArgumentException("Cannot resume terminal task: " + replayed.taskId().getValue());
        }

        TaskPlan toAggregate = null;
        lock.lock();
        try {
            requireAcceptingWork();
            TaskId taskId = replayed.taskId();
            if (plans.containsKey(taskId)) {
                return false;
            }
            TaskPlan plan = replayed.copy();
            plans.put(taskId, plan);

            for (Subtask snapshot : plan.subtasks()) {
                Subtask subtask = plan.subtask(snapshot.id());
                if (subtask.status().isRunning()) {
                    if (strategy == ReconcileStrategy.REQUEUE) {
                        requeueOrExhaust(plan, subtask, subtask.status(), subtask.resources().get(0));
                    } else {
                        fail(plan, subtask, subtask.status(), Diagnostic.forResource(Diagnostic.SESSION_LOST,
                            subtask.resources().get(0), subtask.attempt(), "Session lost before restart"));
                    }
                } else if (subtask.status() == SubtaskStatus.READY) {
                    enqueue(plan, subtask.id());
                }
            }
            promote(plan);
            log.info("Task {} resumed with {} subtasks ({} ready)",
                taskId.getValue(), plan.subtasks().size(), readyQueue.size());

            toAggregate = claimAggregation(plan);
            dispatch();
        } catch (LedgerUnavailableException e) {
            halt(e);
            throw e;
        } finally {
            lock.unlock();
        }

        if (toAggregate != null) {
            aggregate(toAggregate);
        }
        return true;
    }

    // ========== 종료 ==========

    /**
     * Scheduler 종료 (리소스 정리).
     *
     * <p>새 배분을 멈추고 진행 중인 Session이 끝나길 기다린 뒤, 제한 시간을 넘기면
     * 강제 종료합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        lock.lock();
        try {
            shutdown = true;
        } finally {
            lock.unlock();
        }
        workers.shutdown();
        if (!workers.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            log.warn("Worker sessions did not finish within {}ms, forcing shutdown", config.shutdownTimeoutMs());
            workers.shutdownNow();
        }
    }

    /**
     * Ledger 장애로 중단되었는지 확인.
     */
    public boolean isHalted() {
        lock.lock();
        try {
            return haltCause != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 현재 실행 중인 Session 수.
     */
    public int activeSessions() {
        lock.lock();
        try {
            return running.size();
        } finally {
            lock.unlock();
        }
    }

    // ========== 배분 ==========

    /**
     * 동시성 한도까지 READY Subtask 배분 (잠금 보유 상태에서 호출).
     */
    private void dispatch() {
        if (haltCause != null || shutdown) {
            return;
        }
        while (!exclusiveRunning
            && running.size() < config.budget().concurrencyLimit()
            && !readyQueue.isEmpty()) {

            QueuedSubtask next = readyQueue.peekFirst();
            TaskPlan plan = plans.get(next.taskId());
            Subtask subtask = plan.subtask(next.subtaskId());
            if (subtask.status() != SubtaskStatus.READY || plan.status().isTerminal()) {
                readyQueue.pollFirst();
                continue;
            }
            if (subtask.oversized() && !running.isEmpty()) {
                // 단독 실행: 다른 Session이 모두 끝날 때까지 대기
                break;
            }
            readyQueue.pollFirst();
            start(plan, subtask);
        }
    }

    private void start(TaskPlan plan, Subtask subtask) {
        TaskId taskId = plan.taskId();
        if (plan.status() == TaskStatus.PLANNED) {
            record(plan, PlanRecord.taskTransition(taskId, TaskStatus.PLANNED, TaskStatus.IN_PROGRESS, clock.millis(), null));
        }

        SessionId sessionId = SessionId.random();
        record(plan, PlanRecord.subtaskTransition(taskId, subtask.id(), SubtaskStatus.READY,
            SubtaskStatus.DISPATCHED, sessionId, clock.millis()));

        RunningSession session = new RunningSession(taskId, sessionId, subtask.oversized());
        running.put(subtask.id(), session);
        if (subtask.oversized()) {
            exclusiveRunning = true;
        }

        WorkerSession worker = new WorkerSession(sessionId, plan.subtask(subtask.id()), provider, processor,
            compactor, config.budget(), config.sessionTimeoutMs(), clock, session.stop::get, this::onSessionStateChange);
        log.debug("Dispatching {} to session {} (attempt {})",
            subtask.id().getValue(), sessionId.getValue(), subtask.attempt());
        workers.execute(() -> onSessionFinished(subtask.id(), session, worker.run()));
    }

    // ========== Session 콜백 ==========

    private void onSessionStateChange(SessionId sessionId, SubtaskId subtaskId, SessionState from, SessionState to) {
        lock.lock();
        try {
            RunningSession session = running.get(subtaskId);
            if (haltCause != null || session == null || !session.sessionId.equals(sessionId)) {
                return;
            }
            TaskPlan plan = plans.get(session.taskId);
            SubtaskStatus current = plan.subtask(subtaskId).status();
            if (to == SessionState.COMPACTING && current == SubtaskStatus.DISPATCHED) {
                record(plan, PlanRecord.subtaskTransition(session.taskId, subtaskId, SubtaskStatus.DISPATCHED,
                    SubtaskStatus.COMPACTING, sessionId, clock.millis()));
            } else if (from == SessionState.COMPACTING && to == SessionState.ACTIVE
                && current == SubtaskStatus.COMPACTING) {
                record(plan, PlanRecord.subtaskTransition(session.taskId, subtaskId, SubtaskStatus.COMPACTING,
                    SubtaskStatus.DISPATCHED, sessionId, clock.millis()));
            }
        } catch (LedgerUnavailableException e) {
            halt(e);
        } finally {
            lock.unlock();
        }
    }

    private void onSessionFinished(SubtaskId subtaskId, RunningSession session, SessionResult result) {
        TaskPlan toAggregate = null;
        lock.lock();
        try {
            running.remove(subtaskId);
            if (session.oversized) {
                exclusiveRunning = false;
            }
            if (haltCause != null) {
                log.warn("Discarding result of {} ({}): scheduler halted", subtaskId.getValue(), result.kind());
                return;
            }

            TaskPlan plan = plans.get(session.taskId);
            handleResult(plan, plan.subtask(subtaskId), session, result);
            toAggregate = claimAggregation(plan);
            dispatch();
        } catch (LedgerUnavailableException e) {
            halt(e);
        } finally {
            lock.unlock();
        }

        if (toAggregate != null) {
            aggregate(toAggregate);
        }
    }

    private void handleResult(TaskPlan plan, Subtask subtask, RunningSession session, SessionResult result) {
        TaskId taskId = plan.taskId();
        SubtaskStatus from = subtask.status();

        if (plan.status() == TaskStatus.CANCELLED || result.kind() == SessionResult.Kind.STOPPED) {
            record(plan, PlanRecord.subtaskTransition(taskId, subtask.id(), from, SubtaskStatus.CANCELLED,
                session.sessionId, clock.millis()));
            return;
        }

        switch (result.kind()) {
            case COMPLETED -> {
                record(plan, PlanRecord.subtaskCompleted(taskId, subtask.id(), from, session.sessionId,
                    clock.millis(), List.of(), result.outputs()));
                promote(plan);
            }
            case RESET -> split(plan, subtask, from, session.sessionId, result, subtask.attempt());
            case OVERSIZED -> isolate(plan, subtask, from, result.resource());
            case BUDGET_EXCEEDED -> fail(plan, subtask, from, Diagnostic.forResource(Diagnostic.BUDGET_EXCEEDED,
                result.resource(), subtask.attempt(), result.cause().getMessage()));
            case CRASHED -> {
                if (result.processed().isEmpty()) {
                    requeueOrExhaust(plan, subtask, from, result.resource());
                } else if (subtask.attempt() + 1 > config.retryLimit()) {
                    exhaust(plan, subtask, from, result.resource());
                } else {
                    split(plan, subtask, from, session.sessionId, result, subtask.attempt() + 1);
                }
            }
            default -> throw new IllegalStateException("Unexpected session result: " + result.kind());
        }
    }

    // ========== 상태 전이 ==========

    /**
     * 처리된 부분은 완료로, 나머지는 새 Subtask로 분할.
     *
     * <p>원본에 의존하던 Subtask는 나머지 Subtask에도 의존하게 됩니다
     * ({@link TaskPlan#apply(PlanRecord)}가 splitFrom으로 처리).</p>
     */
    private void split(TaskPlan plan, Subtask subtask, SubtaskStatus from, SessionId sessionId,
                       SessionResult result, int remainderAttempt) {
        TaskId taskId = plan.taskId();
        List<ResourceId> remaining = new ArrayList<>(subtask.resources());
        remaining.removeAll(result.processed());

        if (remaining.isEmpty()) {
            record(plan, PlanRecord.subtaskCompleted(taskId, subtask.id(), from, sessionId,
                clock.millis(), List.of(), result.outputs()));
        } else {
            SubtaskId remainderId = plan.nextSubtaskId();
            record(plan, PlanRecord.subtaskCreated(taskId, remainderId, SubtaskStatus.READY, remaining,
                subtask.dependencies(), subtask.oversized(), subtask.id(), remainderAttempt, clock.millis()));
            record(plan, PlanRecord.subtaskCompleted(taskId, subtask.id(), from, sessionId,
                clock.millis(), result.processed(), result.outputs()));
            enqueue(plan, remainderId);
            log.info("Subtask {} split after {} resources, remainder {} has {} resources",
                subtask.id().getValue(), result.processed().size(), remainderId.getValue(), remaining.size());
        }
        promote(plan);
    }

    /**
     * hardThreshold를 넘은 첫 리소스만 남기고 나머지를 새 Subtask로 분리.
     *
     * <p>원본은 그 리소스 하나짜리 oversized Subtask로 다시 READY가 됩니다. 나머지 Subtask는
     * 분리된 리소스에 의존하는 리소스가 있을 때만 원본을 기다리므로, 원본이 BUDGET_EXCEEDED로
     * 실패해도 독립된 리소스는 계속 처리됩니다.</p>
     */
    private void isolate(TaskPlan plan, Subtask subtask, SubtaskStatus from, ResourceId resource) {
        TaskId taskId = plan.taskId();
        List<ResourceId> remaining = new ArrayList<>(subtask.resources());
        remaining.remove(resource);

        boolean blocked = false;
        for (ResourceId candidate : remaining) {
            if (plan.resourceDependsOn(candidate, resource)) {
                blocked = true;
                break;
            }
        }
        List<SubtaskId> dependencies = new ArrayList<>(subtask.dependencies());
        if (blocked) {
            dependencies.add(subtask.id());
        }

        SubtaskId remainderId = plan.nextSubtaskId();
        record(plan, PlanRecord.subtaskCreated(taskId, remainderId,
            blocked ? SubtaskStatus.PENDING : SubtaskStatus.READY, remaining, dependencies, false,
            subtask.id(), subtask.attempt(), clock.millis()));
        record(plan, PlanRecord.subtaskIsolated(taskId, subtask.id(), from, resource, subtask.attempt(), clock.millis()));
        enqueue(plan, subtask.id());
        if (!blocked) {
            enqueue(plan, remainderId);
        }
        log.info("Subtask {} isolated {} above hard threshold, remainder {} has {} resources{}",
            subtask.id().getValue(), resource, remainderId.getValue(), remaining.size(),
            blocked ? " (waiting on the isolated resource)" : "");
    }

    private void requeueOrExhaust(TaskPlan plan, Subtask subtask, SubtaskStatus from, ResourceId resource) {
        int nextAttempt = subtask.attempt() + 1;
        if (nextAttempt > config.retryLimit()) {
            exhaust(plan, subtask, from, resource);
            return;
        }
        record(plan, PlanRecord.subtaskTransition(plan.taskId(), subtask.id(), from, SubtaskStatus.READY,
            null, clock.millis(), nextAttempt, null));
        enqueue(plan, subtask.id());
        log.info("Subtask {} requeued (attempt {}/{})", subtask.id().getValue(), nextAttempt, config.retryLimit());
    }

    private void exhaust(TaskPlan plan, Subtask subtask, SubtaskStatus from, ResourceId resource) {
        fail(plan, subtask, from, Diagnostic.forResource(Diagnostic.RETRY_EXHAUSTED, resource, subtask.attempt(),
            "Session crashed " + (subtask.attempt() + 1) + " times (retry limit " + config.retryLimit() + ")"));
    }

    /**
     * Subtask 실패 처리 후 하위 Subtask 전부 취소.
     */
    private void fail(TaskPlan plan, Subtask subtask, SubtaskStatus from, Diagnostic diagnostic) {
        TaskId taskId = plan.taskId();
        record(plan, PlanRecord.subtaskTransition(taskId, subtask.id(), from, SubtaskStatus.FAILED,
            null, clock.millis(), subtask.attempt(), diagnostic));
        log.warn("Subtask {} failed: {} - {}", subtask.id().getValue(), diagnostic.code(), diagnostic.message());

        Diagnostic upstream = Diagnostic.of(Diagnostic.UPSTREAM_FAILED, "Upstream subtask failed: " + subtask.id().getValue());
        for (Subtask downstream : plan.openDownstreamOf(subtask.id())) {
            if (downstream.status().isRunning()) {
                RunningSession session = running.get(downstream.id());
                if (session != null) {
                    session.stop.set(true);
                }
                continue;
            }
            record(plan, PlanRecord.subtaskTransition(taskId, downstream.id(), downstream.status(),
                SubtaskStatus.CANCELLED, null, clock.millis(), downstream.attempt(), upstream));
        }
    }

    /**
     * 의존성이 모두 완료된 PENDING Subtask를 READY로 승격.
     */
    private void promote(TaskPlan plan) {
        for (Subtask subtask : plan.promotable()) {
            record(plan, PlanRecord.subtaskTransition(plan.taskId(), subtask.id(), SubtaskStatus.PENDING,
                SubtaskStatus.READY, null, clock.millis()));
            enqueue(plan, subtask.id());
        }
    }

    private void enqueue(TaskPlan plan, SubtaskId subtaskId) {
        readyQueue.addLast(new QueuedSubtask(plan.taskId(), subtaskId));
    }

    private void record(TaskPlan plan, PlanRecord record) {
        ledger.append(record);
        plan.apply(record);
        notifyListener(record);
    }

    private void notifyListener(PlanRecord record) {
        try {
            listener.onTransition(record);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed for {} -> {}", record.taskId().getValue(), record.toState(), e);
        }
    }

    // ========== 병합 ==========

    /**
     * 모든 Subtask가 종료되었으면 병합 대상으로 표시하고 스냅샷 반환 (잠금 보유 상태에서 호출).
     */
    private TaskPlan claimAggregation(TaskPlan plan) {
        if (plan.status().isTerminal() || !plan.allSubtasksTerminal() || !aggregating.add(plan.taskId())) {
            return null;
        }
        return plan.copy();
    }

    /**
     * 병합 및 검증 실행 (잠금 밖에서 호출).
     */
    private void aggregate(TaskPlan snapshot) {
        TaskId taskId = snapshot.taskId();
        TaskOutcome outcome;
        try {
            outcome = aggregator.aggregate(snapshot);
        } catch (RuntimeException e) {
            log.error("Aggregation of task {} failed", taskId.getValue(), e);
            outcome = new Fail(taskId, Diagnostic.of(Diagnostic.AGGREGATION_FAILED,
                "Failed to write merged results: " + e.getMessage()));
        }

        lock.lock();
        try {
            aggregating.remove(taskId);
            TaskPlan plan = plans.get(taskId);
            if (haltCause != null || plan.status().isTerminal()) {
                log.info("Task {} reached {} during aggregation, outcome {} not recorded",
                    taskId.getValue(), plan.status(), outcome);
                return;
            }
            if (plan.status() == TaskStatus.PLANNED) {
                record(plan, PlanRecord.taskTransition(taskId, TaskStatus.PLANNED, TaskStatus.IN_PROGRESS, clock.millis(), null));
            }
            TaskStatus to = outcome.isOk() ? TaskStatus.COMPLETED : TaskStatus.FAILED;
            Diagnostic diagnostic = outcome instanceof Fail fail ? fail.diagnostic() : null;
            record(plan, PlanRecord.taskTransition(taskId, TaskStatus.IN_PROGRESS, to, clock.millis(), diagnostic));
            complete(taskId, outcome);
            log.info("Task {} finished: {}", taskId.getValue(), to);
        } catch (LedgerUnavailableException e) {
            halt(e);
        } finally {
            lock.unlock();
        }
    }

    private void complete(TaskId taskId, TaskOutcome outcome) {
        outcomes.put(taskId, outcome);
        terminated.signalAll();
    }

    // ========== 장애 ==========

    /**
     * Ledger 장애로 중단 (잠금 보유 상태에서 호출).
     */
    private void halt(LedgerUnavailableException cause) {
        if (haltCause == null) {
            haltCause = cause;
            log.error("Ledger unavailable, scheduler halted: no further dispatch or submission", cause);
        }
        for (RunningSession session : running.values()) {
            session.stop.set(true);
        }
        readyQueue.clear();
        terminated.signalAll();
    }

    private void requireAcceptingWork() {
        lock.lock();
        try {
            if (haltCause != null) {
                throw new IllegalStateException("Scheduler halted: ledger unavailable", haltCause);
            }
            if (shutdown) {
                throw new IllegalStateException("Scheduler is shut down");
            }
        } finally {
            lock.unlock();
        }
    }

    private TaskPlan requirePlan(TaskId taskId) {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        TaskPlan plan = plans.get(taskId);
        if (plan == null) {
            throw new IllegalArgumentException("Unknown task: " + taskId.getValue());
        }
        return plan;
    }

    private record QueuedSubtask(TaskId taskId, SubtaskId subtaskId) {
    }

    private static final class RunningSession {
        private final TaskId taskId;
        private final SessionId sessionId;
        private final boolean oversized;
        private final AtomicBoolean stop = new AtomicBoolean();

        private RunningSession(TaskId taskId, SessionId sessionId, boolean oversized) {
            this.taskId = taskId;
            this.sessionId = sessionId;
            this.oversized = oversized;
        }
    }
}
