package com.ryuqq.conductor.testkit.contract;

import com.ryuqq.conductor.core.graph.SubtaskSpec;
import com.ryuqq.conductor.core.graph.TaskGraph;
import com.ryuqq.conductor.core.graph.TaskGraphBuilder;
import com.ryuqq.conductor.core.model.Budget;
import com.ryuqq.conductor.core.model.DependencyEdge;
import com.ryuqq.conductor.core.model.ResourceId;
import com.ryuqq.conductor.core.model.TaskId;
import com.ryuqq.conductor.core.plan.Subtask;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for Scenario 12: Deterministic Split.
 *
 * <p>The same resources, edges and budget always produce the same subtasks, whatever order
 * the caller passes them in, and the same scripted run produces the same splits.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class DeterministicSplitContractTest extends AbstractContractTest {

    @Test
    void testGraphBuild_ShuffledInput_SameSubtasks() {
        // Given
        List<ResourceId> resources = new ArrayList<>();
        for (String directory : List.of("api/", "core/", "web/")) {
            for (int i = 1; i <= 6; i++) {
                resources.add(ResourceId.of(directory + "F" + i + ".java"));
            }
        }
        List<DependencyEdge> edges = List.of(
            DependencyEdge.of("core/F1.java", "api/F1.java"),
            DependencyEdge.of("core/F2.java", "core/F3.java"),
            DependencyEdge.of("api/F2.java", "web/F6.java")
        );
        TaskId taskId = TaskId.of("deterministic");
        TaskGraphBuilder builder = new TaskGraphBuilder();
        Budget budget = budget().withMaxResourcesPerSubtask(4);

        TaskGraph expected = builder.build(taskId, "split", resources, edges, budget);

        // When & Then
        Random random = new Random(42);
        for (int round = 0; round < 5; round++) {
            List<ResourceId> shuffledResources = new ArrayList<>(resources);
            List<DependencyEdge> shuffledEdges = new ArrayList<>(edges);
            Collections.shuffle(shuffledResources, random);
            Collections.shuffle(shuffledEdges, random);

            TaskGraph actual = builder.build(taskId, "split", shuffledResources, shuffledEdges, budget);
            assertEquals(expected, actual, "Graph differs in round " + round);
        }
    }

    @Test
    void testGraphBuild_Subtasks_RespectEdgesAndLimit() {
        // Given
        List<ResourceId> resources = seedNumbered("src/f", 10);
        List<DependencyEdge> edges = List.of(
            new DependencyEdge(resources.get(9), resources.get(0)),
            new DependencyEdge(resources.get(5), resources.get(4))
        );

        // When
        TaskGraph graph = graphBuilder.build(TaskId.of("ordered"), "split", resources, edges, budget());

        // Then
        List<ResourceId> flattened = new ArrayList<>();
        for (SubtaskSpec subtask : graph.subtasks()) {
            assertTrue(subtask.resources().size() <= budget().maxResourcesPerSubtask());
            flattened.addAll(subtask.resources());
        }
        assertEquals(resources.size(), flattened.size());
        assertTrue(flattened.indexOf(resources.get(9)) < flattened.indexOf(resources.get(0)));
        assertTrue(flattened.indexOf(resources.get(5)) < flattened.indexOf(resources.get(4)));
    }

    @Test
    void testScriptedRun_Repeated_SameSplits() {
        // Given
        List<ResourceId> resources = seedNumbered("src/f", 9);
        processor.units(resources.get(1), 500);
        processor.units(resources.get(2), 500);
        startScheduler(new Budget(5, 600, 800, 1, 100));

        // When
        TaskId first = submit(resources, List.of()).getTaskId();
        awaitOutcome(first);
        TaskId second = submit(resources, List.of()).getTaskId();
        awaitOutcome(second);

        // Then
        assertEquals(shape(first), shape(second));
    }

    private List<List<ResourceId>> shape(TaskId taskId) {
        List<List<ResourceId>> shape = new ArrayList<>();
        for (Subtask subtask : scheduler.plan(taskId).subtasks()) {
            shape.add(subtask.resources());
        }
        return shape;
    }
}
