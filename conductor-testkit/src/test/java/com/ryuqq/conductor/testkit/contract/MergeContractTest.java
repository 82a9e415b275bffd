package com.ryuqq.conductor.testkit.contract;

import com.ryuqq.conductor.adapter.runner.DispatchScheduler;
import com.ryuqq.conductor.adapter.runner.ResultAggregator;
import com.ryuqq.conductor.adapter.runner.SchedulerConfig;
import com.ryuqq.conductor.core.ledger.PlanRecord;
import com.ryuqq.conductor.core.model.Diagnostic;
import com.ryuqq.conductor.core.model.ResourceId;
import com.ryuqq.conductor.core.model.SessionId;
import com.ryuqq.conductor.core.model.SubtaskId;
import com.ryuqq.conductor.core.model.TaskId;
import com.ryuqq.conductor.core.outcome.Fail;
import com.ryuqq.conductor.core.outcome.Ok;
import com.ryuqq.conductor.core.outcome.TaskOutcome;
import com.ryuqq.conductor.core.plan.TaskPlan;
import com.ryuqq.conductor.core.spi.ResourceProvider;
import com.ryuqq.conductor.core.statemachine.SubtaskStatus;
import com.ryuqq.conductor.core.statemachine.TaskStatus;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for Scenario 8: Merge and Verification.
 *
 * <p>Results of completed subtasks are merged into the provider only when every subtask
 * completed and no two subtasks disagree about a resource. Verification hooks then run in
 * registration order and the first failure fails the task.</p>
 *
 * <p>The partition guarantees the scheduler never produces overlapping outputs, so conflicts
 * are checked on hand-built plans.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class MergeContractTest extends AbstractContractTest {

    private static final ResourceId SHARED = ResourceId.of("src/Shared.java");
    private static final ResourceId OTHER = ResourceId.of("src/Other.java");

    @Test
    void testConflict_DifferentOutputsForSameResource_FailsWithoutWrites() {
        // Given
        FakeVerificationHook hook = FakeVerificationHook.passing("compile");
        ResultAggregator aggregator = new ResultAggregator(provider, List.of(hook));
        TaskPlan plan = planWithOutputs(
            Map.of(SHARED, "class Shared { int a; }"),
            Map.of(OTHER, "class Other {}", SHARED, "class Shared { long a; }")
        );

        // When
        TaskOutcome outcome = aggregator.aggregate(plan);

        // Then
        assertInstanceOf(Fail.class, outcome);
        Fail fail = (Fail) outcome;
        assertEquals(Diagnostic.CONFLICT, fail.errorCode());
        assertEquals(SHARED, fail.diagnostic().resource());
        assertTrue(provider.writes().isEmpty(), "Conflicting results must not be written");
        assertFalse(hook.wasRun(), "Hooks run only after a successful merge");
    }

    @Test
    void testConflict_IdenticalOutputs_MergedOnce() {
        // Given
        ResultAggregator aggregator = new ResultAggregator(provider, List.of());
        TaskPlan plan = planWithOutputs(
            Map.of(SHARED, "class Shared {}"),
            Map.of(OTHER, "class Other {}", SHARED, "class Shared {}")
        );

        // When
        TaskOutcome outcome = aggregator.aggregate(plan);

        // Then
        assertInstanceOf(Ok.class, outcome);
        assertEquals(2, ((Ok) outcome).mergedResources());
        assertEquals("class Shared {}", provider.contentOf(SHARED));
        assertEquals(1, provider.writes().stream().filter(SHARED::equals).count());
    }

    @Test
    void testVerification_FailingHook_TaskFailsAfterMerge() {
        // Given
        FakeVerificationHook format = FakeVerificationHook.passing("format");
        FakeVerificationHook typecheck = FakeVerificationHook.failing("typecheck", "src/f02: 3 errors");
        FakeVerificationHook tests = FakeVerificationHook.passing("tests");
        hooks.add(format);
        hooks.add(typecheck);
        hooks.add(tests);
        List<ResourceId> resources = seedNumbered("src/f", 3);
        startScheduler(budget());

        // When
        TaskId taskId = submit(resources, List.of()).getTaskId();
        TaskOutcome outcome = awaitOutcome(taskId);

        // Then
        assertInstanceOf(Fail.class, outcome);
        Fail fail = (Fail) outcome;
        assertEquals(Diagnostic.VERIFICATION_FAILED, fail.errorCode());
        assertEquals("typecheck", fail.diagnostic().hook());
        assertEquals("src/f02: 3 errors", fail.diagnostic().message());
        assertTaskStatus(taskId, TaskStatus.FAILED);

        assertTrue(format.wasRun());
        assertTrue(typecheck.wasRun());
        assertFalse(tests.wasRun(), "Hooks after the first failure must not run");
        assertEquals(Set.copyOf(resources), typecheck.runs().get(0));
    }

    @Test
    void testVerification_AllHooksPass_TaskCompletes() {
        // Given
        FakeVerificationHook compile = FakeVerificationHook.passing("compile");
        hooks.add(compile);
        List<ResourceId> resources = seedNumbered("src/f", 4);
        startScheduler(budget());

        // When
        TaskId taskId = submit(resources, List.of()).getTaskId();

        // Then
        assertInstanceOf(Ok.class, awaitOutcome(taskId));
        assertEquals(1, compile.runs().size());
        assertEquals(Set.copyOf(resources), compile.runs().get(0));
    }

    @Test
    void testAggregation_WriteFails_TaskFailsWithAggregationFailed() throws InterruptedException {
        // Given
        List<ResourceId> resources = seedNumbered("src/f", 2);
        ResourceProvider readOnly = new ResourceProvider() {
            @Override
            public String read(ResourceId resourceId) {
                return provider.read(resourceId);
            }

            @Override
            public void write(ResourceId resourceId, String content) {
                throw new IllegalStateException("disk full");
            }
        };
        DispatchScheduler failingWrites = new DispatchScheduler(ledger, readOnly, processor,
            new ResultAggregator(readOnly, hooks), new SchedulerConfig().withBudget(budget()));

        try {
            // When
            TaskId taskId = failingWrites.submit("write fails", resources, List.of()).getTaskId();
            TaskOutcome outcome = failingWrites.awaitTermination(taskId, AWAIT_TIMEOUT_MS);

            // Then
            assertInstanceOf(Fail.class, outcome);
            assertEquals(Diagnostic.AGGREGATION_FAILED, ((Fail) outcome).errorCode());
            assertEquals(TaskStatus.FAILED, failingWrites.status(taskId));
            assertEquals(TaskStatus.FAILED, ledger.replay(taskId).status());
        } finally {
            failingWrites.shutdown();
        }
    }

    /**
     * Builds a plan of two COMPLETED subtasks whose outputs are given directly.
     */
    private TaskPlan planWithOutputs(Map<ResourceId, String> firstOutputs, Map<ResourceId, String> secondOutputs) {
        TaskId taskId = TaskId.of("merge-task");
        SubtaskId first = SubtaskId.of(taskId, 1);
        SubtaskId second = SubtaskId.of(taskId, 2);
        SessionId session = SessionId.random();
        TaskPlan plan = TaskPlan.start(PlanRecord.taskCreated(taskId, "merge", List.of(SHARED, OTHER), 1L));
        plan.apply(PlanRecord.subtaskCreated(taskId, first, SubtaskStatus.READY, List.of(SHARED),
            List.of(), false, null, 0, 2L));
        plan.apply(PlanRecord.subtaskCreated(taskId, second, SubtaskStatus.READY, List.of(OTHER),
            List.of(), false, null, 0, 3L));
        plan.apply(PlanRecord.taskTransition(taskId, TaskStatus.PLANNED, TaskStatus.IN_PROGRESS, 4L, null));
        for (SubtaskId id : List.of(first, second)) {
            plan.apply(PlanRecord.subtaskTransition(taskId, id, SubtaskStatus.READY, SubtaskStatus.DISPATCHED, session, 5L));
        }
        plan.apply(PlanRecord.subtaskCompleted(taskId, first, SubtaskStatus.DISPATCHED, session, 6L, List.of(), firstOutputs));
        plan.apply(PlanRecord.subtaskCompleted(taskId, second, SubtaskStatus.DISPATCHED, session, 7L, List.of(), secondOutputs));
        return plan;
    }
}
