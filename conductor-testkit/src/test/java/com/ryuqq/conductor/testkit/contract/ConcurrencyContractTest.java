package com.ryuqq.conductor.testkit.contract;

import com.ryuqq.conductor.core.graph.AffinityFunction;
import com.ryuqq.conductor.core.graph.TaskGraphBuilder;
import com.ryuqq.conductor.core.model.Budget;
import com.ryuqq.conductor.core.model.ResourceId;
import com.ryuqq.conductor.core.model.TaskId;
import com.ryuqq.conductor.core.outcome.Ok;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for Scenario 3: Concurrency.
 *
 * <p>No more than concurrencyLimit worker sessions run at the same time, and an oversized
 * subtask always runs alone.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ConcurrencyContractTest extends AbstractContractTest {

    @Test
    void testConcurrencyLimit_ManySubtasks_NeverExceeded() {
        // Given: 10 subtasks of 2 resources, 3 sessions at most
        List<ResourceId> resources = new ArrayList<>();
        for (String directory : List.of("d1/f", "d2/f", "d3/f", "d4/f")) {
            resources.addAll(seedNumbered(directory, 5));
        }
        processor.delayMs(20);
        startScheduler(new Budget(2, 600, 800, 3, 100));

        // When
        TaskId taskId = submit(resources, List.of()).getTaskId();

        // Then
        assertInstanceOf(Ok.class, awaitOutcome(taskId));
        assertTrue(processor.maxConcurrent() <= 3,
                "At most 3 sessions may process at once, saw " + processor.maxConcurrent());
        assertTrue(processor.maxConcurrent() >= 2, "Independent subtasks should run in parallel");
        assertEquals(0, scheduler.activeSessions());
    }

    @Test
    void testConcurrencyLimit_SeveralTasks_SharedLimit() {
        // Given
        List<ResourceId> first = seedNumbered("one/f", 6);
        List<ResourceId> second = seedNumbered("two/f", 6);
        processor.delayMs(15);
        startScheduler(new Budget(2, 600, 800, 2, 100));

        // When
        TaskId firstTask = submit(first, List.of()).getTaskId();
        TaskId secondTask = submit(second, List.of()).getTaskId();

        // Then
        assertInstanceOf(Ok.class, awaitOutcome(firstTask));
        assertInstanceOf(Ok.class, awaitOutcome(secondTask));
        assertTrue(processor.maxConcurrent() <= 2,
                "The limit applies across tasks, saw " + processor.maxConcurrent());
    }

    @Test
    void testOversizedSubtask_RunsExclusively() {
        // Given
        graphBuilder = new TaskGraphBuilder(
            resource -> resource.getValue().startsWith("gen/") ? 5_000 : 1,
            AffinityFunction.byDirectory()
        );
        List<ResourceId> resources = new ArrayList<>(seed("gen/Generated.java"));
        resources.addAll(seedNumbered("src/f", 6));
        resources.addAll(seedNumbered("test/t", 6));
        processor.delayMs(20);
        startScheduler(new Budget(2, 600, 800, 3, 100));

        // When
        TaskId taskId = submit(resources, List.of()).getTaskId();

        // Then
        assertInstanceOf(Ok.class, awaitOutcome(taskId));
        assertFalse(processor.overlapped(ResourceId.of("gen/Generated.java")),
                "Oversized subtask must not run alongside another session");
        assertTrue(processor.maxConcurrent() <= 3);
        assertPartitioned(scheduler.plan(taskId));
    }
}
