package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.adapter.inmemory.resource.InMemoryResourceProvider;
import com.ryuqq.conductor.core.exception.BudgetExceededException;
import com.ryuqq.conductor.core.model.Budget;
import com.ryuqq.conductor.core.model.ResourceId;
import com.ryuqq.conductor.core.model.SessionId;
import com.ryuqq.conductor.core.model.SubtaskId;
import com.ryuqq.conductor.core.model.TaskId;
import com.ryuqq.conductor.core.plan.Subtask;
import com.ryuqq.conductor.core.spi.Compactor;
import com.ryuqq.conductor.core.spi.ProcessedResource;
import com.ryuqq.conductor.core.spi.ResourceProcessor;
import com.ryuqq.conductor.core.statemachine.SessionState;
import com.ryuqq.conductor.core.statemachine.SubtaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * WorkerSession 유닛 테스트.
 *
 * <p>Budget(5, soft=600, hard=800, concurrency=2, baseline=100) 기준.</p>
 *
 * <ul>
 *   <li>정상 완료, 초과 리소스 분리, 예산 초과, hard threshold Reset</li>
 *   <li>Compaction 성공/실패</li>
 *   <li>크래시, 취소, 제한 시간</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class WorkerSessionTest {

    private static final Budget BUDGET = new Budget(5, 600, 800, 2, 100);
    private static final long TIMEOUT_MS = 1000;

    private static final ResourceId A = ResourceId.of("src/A.java");
    private static final ResourceId B = ResourceId.of("src/B.java");
    private static final ResourceId C = ResourceId.of("src/C.java");

    private InMemoryResourceProvider provider;
    private MutableClock clock;
    private Map<ResourceId, Long> units;
    private List<SessionState> transitions;

    @BeforeEach
    void setUp() {
        provider = new InMemoryResourceProvider();
        provider.putAll(List.of(A, B, C), "class X {}");
        clock = new MutableClock(1_000L);
        units = new HashMap<>();
        transitions = new ArrayList<>();
    }

    @Test
    void run_예산_안에서_모든_리소스를_처리하면_COMPLETED() {
        // given
        WorkerSession session = session(subtask(A, B, C), unitsProcessor(), Compactor.retainingFacts(), () -> false);

        // when
        SessionResult result = session.run();

        // then
        assertThat(result.kind()).isEqualTo(SessionResult.Kind.COMPLETED);
        assertThat(result.processed()).containsExactly(A, B, C);
        assertThat(result.outputs()).containsEntry(A, "processed:src/A.java");
        assertThat(session.getState()).isEqualTo(SessionState.TERMINATED);
        assertThat(transitions).containsExactly(SessionState.TERMINATED);
    }

    @Test
    void run_첫_리소스가_hard_초과하면_나머지를_남기고_OVERSIZED() {
        // given
        units.put(A, 900L);
        WorkerSession session = session(subtask(A, B, C), unitsProcessor(), Compactor.retainingFacts(), () -> false);

        // when
        SessionResult result = session.run();

        // then
        assertThat(result.kind()).isEqualTo(SessionResult.Kind.OVERSIZED);
        assertThat(result.resource()).isEqualTo(A);
        assertThat(result.processed()).isEmpty();
        assertThat(result.outputs()).isEmpty();
        assertThat(transitions).containsExactly(SessionState.TERMINATED);
    }

    @Test
    void run_단일_리소스_Subtask가_hard_초과하면_BUDGET_EXCEEDED() {
        // given
        units.put(A, 900L);
        WorkerSession session = session(subtask(A), unitsProcessor(), Compactor.retainingFacts(), () -> false);

        // when
        SessionResult result = session.run();

        // then
        assertThat(result.kind()).isEqualTo(SessionResult.Kind.BUDGET_EXCEEDED);
        assertThat(result.resource()).isEqualTo(A);
        assertThat(result.processed()).isEmpty();
        assertThat(result.cause())
            .isInstanceOf(BudgetExceededException.class)
            .hasMessageContaining("consumed 900 units");
    }

    @Test
    void run_처리_후_hard_초과하면_현재_리소스를_버리고_RESET() {
        // given
        units.put(A, 300L);
        units.put(B, 300L);
        units.put(C, 300L);
        WorkerSession session = session(subtask(A, B, C), unitsProcessor(), Compactor.retainingFacts(), () -> false);

        // when
        SessionResult result = session.run();

        // then
        assertThat(result.kind()).isEqualTo(SessionResult.Kind.RESET);
        assertThat(result.processed()).containsExactly(A, B);
        assertThat(result.outputs()).containsOnlyKeys(A, B);
        assertThat(transitions).containsExactly(SessionState.RESET, SessionState.TERMINATED);
    }

    @Test
    void run_soft_초과하면_Compaction_후_계속() {
        // given
        units.put(A, 400L);
        units.put(B, 300L);
        units.put(C, 400L);
        WorkerSession session = session(subtask(A, B, C), unitsProcessor(), Compactor.retainingFacts(), () -> false);

        // when
        SessionResult result = session.run();

        // then
        assertThat(result.kind()).isEqualTo(SessionResult.Kind.COMPLETED);
        assertThat(result.processed()).containsExactly(A, B, C);
        assertThat(transitions).containsExactly(
            SessionState.COMPACTING, SessionState.ACTIVE, SessionState.TERMINATED);
    }

    @Test
    void run_Compaction_실패하면_현재_리소스까지_유지하고_RESET() {
        // given
        units.put(A, 400L);
        units.put(B, 300L);
        Compactor failing = context -> {
            throw new IllegalStateException("summarizer unavailable");
        };
        WorkerSession session = session(subtask(A, B, C), unitsProcessor(), failing, () -> false);

        // when
        SessionResult result = session.run();

        // then
        assertThat(result.kind()).isEqualTo(SessionResult.Kind.RESET);
        assertThat(result.processed()).containsExactly(A, B);
    }

    @Test
    void run_마지막_리소스에서_Reset되면_COMPLETED() {
        // given
        units.put(A, 400L);
        units.put(B, 300L);
        Compactor failing = context -> {
            throw new IllegalStateException("summarizer unavailable");
        };
        WorkerSession session = session(subtask(A, B), unitsProcessor(), failing, () -> false);

        // when
        SessionResult result = session.run();

        // then
        assertThat(result.kind()).isEqualTo(SessionResult.Kind.COMPLETED);
        assertThat(result.processed()).containsExactly(A, B);
    }

    @Test
    void run_처리기_예외시_CRASHED() {
        // given
        IllegalStateException failure = new IllegalStateException("model error");
        ResourceProcessor crashing = (resourceId, content, context) -> {
            if (resourceId.equals(B)) {
                throw failure;
            }
            return ProcessedResource.of("ok", 10);
        };
        WorkerSession session = session(subtask(A, B, C), crashing, Compactor.retainingFacts(), () -> false);

        // when
        SessionResult result = session.run();

        // then
        assertThat(result.kind()).isEqualTo(SessionResult.Kind.CRASHED);
        assertThat(result.processed()).containsExactly(A);
        assertThat(result.resource()).isEqualTo(B);
        assertThat(result.cause()).isSameAs(failure);
    }

    @Test
    void run_취소_플래그가_켜지면_STOPPED() {
        // given
        WorkerSession session = session(subtask(A, B), unitsProcessor(), Compactor.retainingFacts(), () -> true);

        // when
        SessionResult result = session.run();

        // then
        assertThat(result.kind()).isEqualTo(SessionResult.Kind.STOPPED);
        assertThat(result.processed()).isEmpty();
    }

    @Test
    void run_제한_시간이_지나면_처리된_부분까지_RESET() {
        // given
        ResourceProcessor slow = (resourceId, content, context) -> {
            clock.advance(TIMEOUT_MS);
            return ProcessedResource.of("slow", 10);
        };
        WorkerSession session = session(subtask(A, B, C), slow, Compactor.retainingFacts(), () -> false);

        // when
        SessionResult result = session.run();

        // then
        assertThat(result.kind()).isEqualTo(SessionResult.Kind.RESET);
        assertThat(result.processed()).containsExactly(A);
    }

    private WorkerSession session(Subtask subtask, ResourceProcessor processor, Compactor compactor,
                                  BooleanSupplier stop) {
        return new WorkerSession(SessionId.of("ws-test"), subtask, provider, processor, compactor, BUDGET,
            TIMEOUT_MS, clock, stop, (sessionId, subtaskId, from, to) -> transitions.add(to));
    }

    private ResourceProcessor unitsProcessor() {
        return (resourceId, content, context) ->
            ProcessedResource.of("processed:" + resourceId.getValue(), units.getOrDefault(resourceId, 10L));
    }

    private static Subtask subtask(ResourceId... resources) {
        TaskId taskId = TaskId.of("session-task");
        return new Subtask(SubtaskId.of(taskId, 1), taskId, List.of(resources), List.of(), null,
            SubtaskStatus.DISPATCHED, false, 0, Map.of(), null, null);
    }

    /**
     * 테스트에서 직접 전진시키는 시계.
     */
    private static final class MutableClock extends Clock {

        private long millis;

        private MutableClock(long millis) {
            this.millis = millis;
        }

        void advance(long delta) {
            millis += delta;
        }

        @Override
        public long millis() {
            return millis;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }
    }
}
