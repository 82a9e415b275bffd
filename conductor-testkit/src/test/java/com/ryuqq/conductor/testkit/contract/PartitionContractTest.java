package com.ryuqq.conductor.testkit.contract;

import com.ryuqq.conductor.application.orchestrator.PlanReceipt;
import com.ryuqq.conductor.core.model.ResourceId;
import com.ryuqq.conductor.core.model.SubtaskId;
import com.ryuqq.conductor.core.model.TaskId;
import com.ryuqq.conductor.core.outcome.Ok;
import com.ryuqq.conductor.core.outcome.TaskOutcome;
import com.ryuqq.conductor.core.plan.Subtask;
import com.ryuqq.conductor.core.plan.TaskPlan;
import com.ryuqq.conductor.core.statemachine.SubtaskStatus;
import com.ryuqq.conductor.core.statemachine.TaskStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for Scenario 1: Partition.
 *
 * <p>Every resource of a successful task ends up in exactly one COMPLETED subtask,
 * and the merged output holds one result per resource.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Independent resources → chunked by maxResourcesPerSubtask, each processed once</li>
 *   <li>Session crash mid-subtask → processed prefix kept, remainder re-run</li>
 *   <li>Several tasks at once → partitions never mix</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class PartitionContractTest extends AbstractContractTest {

    @Test
    void testPartition_IndependentResources_EachProcessedExactlyOnce() {
        // Given
        List<ResourceId> resources = seedNumbered("src/f", 12);
        startScheduler(budget());

        // When
        PlanReceipt receipt = submit(resources, List.of());
        TaskOutcome outcome = awaitOutcome(receipt.getTaskId());

        // Then
        assertInstanceOf(Ok.class, outcome);
        assertEquals(12, ((Ok) outcome).mergedResources());
        assertEquals(3, receipt.getSubtaskIds().size(), "12 resources with max 5 should form 3 subtasks");
        assertTaskStatus(receipt.getTaskId(), TaskStatus.COMPLETED);
        assertPartitioned(scheduler.plan(receipt.getTaskId()));

        for (ResourceId resource : resources) {
            assertEquals(1, processor.callCount(resource), "Resource processed more than once: " + resource);
            assertEquals(expectedOutput(resource), provider.contentOf(resource));
        }
    }

    @Test
    void testPartition_CrashAfterPrefix_RemainderCoversRest() {
        // Given
        List<ResourceId> resources = seedNumbered("src/f", 5);
        processor.crashTimes(resources.get(2), 1);
        startScheduler(budget());

        // When
        PlanReceipt receipt = submit(resources, List.of());
        TaskOutcome outcome = awaitOutcome(receipt.getTaskId());

        // Then
        assertInstanceOf(Ok.class, outcome);
        TaskPlan plan = scheduler.plan(receipt.getTaskId());
        assertPartitioned(plan);
        assertEquals(2, plan.subtasks().size(), "Crash after two resources should split once");

        Subtask original = plan.subtask(SubtaskId.of(receipt.getTaskId(), 1));
        Subtask remainder = plan.subtask(SubtaskId.of(receipt.getTaskId(), 2));
        assertEquals(resources.subList(0, 2), original.resources());
        assertEquals(resources.subList(2, 5), remainder.resources());
        assertEquals(original.id(), remainder.splitFrom());
        assertEquals(1, remainder.attempt(), "Remainder after a crash counts as a retry");

        assertEquals(1, processor.callCount(resources.get(0)));
        assertEquals(2, processor.callCount(resources.get(2)));
        for (ResourceId resource : resources) {
            assertEquals(expectedOutput(resource), provider.contentOf(resource));
        }
    }

    @Test
    void testPartition_ConcurrentTasks_OwnResourcesOnly() {
        // Given
        List<ResourceId> first = seedNumbered("api/a", 6);
        List<ResourceId> second = seedNumbered("web/b", 7);
        startScheduler(budget());

        // When
        TaskId firstTask = submit(first, List.of()).getTaskId();
        TaskId secondTask = submit(second, List.of()).getTaskId();

        // Then
        assertInstanceOf(Ok.class, awaitOutcome(firstTask));
        assertInstanceOf(Ok.class, awaitOutcome(secondTask));

        TaskPlan firstPlan = scheduler.plan(firstTask);
        TaskPlan secondPlan = scheduler.plan(secondTask);
        assertPartitioned(firstPlan);
        assertPartitioned(secondPlan);
        for (Subtask subtask : firstPlan.subtasks()) {
            assertEquals(SubtaskStatus.COMPLETED, subtask.status());
            assertTrue(first.containsAll(subtask.resources()), "Foreign resource in " + subtask.id());
        }
        for (Subtask subtask : secondPlan.subtasks()) {
            assertTrue(second.containsAll(subtask.resources()), "Foreign resource in " + subtask.id());
        }
    }
}
