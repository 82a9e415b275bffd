package com.ryuqq.conductor.testkit.contract;

import com.ryuqq.conductor.adapter.inmemory.ledger.InMemoryLedgerBackend;
import com.ryuqq.conductor.adapter.inmemory.progress.RecordingProgressListener;
import com.ryuqq.conductor.adapter.inmemory.resource.InMemoryResourceProvider;
import com.ryuqq.conductor.adapter.runner.DispatchScheduler;
import com.ryuqq.conductor.adapter.runner.ResultAggregator;
import com.ryuqq.conductor.adapter.runner.SchedulerConfig;
import com.ryuqq.conductor.application.orchestrator.PlanReceipt;
import com.ryuqq.conductor.core.graph.TaskGraphBuilder;
import com.ryuqq.conductor.core.ledger.PlanLedger;
import com.ryuqq.conductor.core.model.Budget;
import com.ryuqq.conductor.core.model.DependencyEdge;
import com.ryuqq.conductor.core.model.ResourceId;
import com.ryuqq.conductor.core.model.TaskId;
import com.ryuqq.conductor.core.outcome.TaskOutcome;
import com.ryuqq.conductor.core.plan.Subtask;
import com.ryuqq.conductor.core.plan.TaskPlan;
import com.ryuqq.conductor.core.spi.Compactor;
import com.ryuqq.conductor.core.spi.LedgerBackend;
import com.ryuqq.conductor.core.spi.VerificationHook;
import com.ryuqq.conductor.core.statemachine.SubtaskStatus;
import com.ryuqq.conductor.core.statemachine.TaskStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for Contract Tests.
 *
 * <p>This class provides common test infrastructure including in-memory SPI implementations,
 * a scheduler factory and helper methods for test scenarios.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>InMemoryLedgerBackend: Append-only ledger simulation (with failure simulation)</li>
 *   <li>InMemoryResourceProvider: Resource storage simulation</li>
 *   <li>ScriptedResourceProcessor: Scriptable worker</li>
 *   <li>RecordingProgressListener: Progress stream capture</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * public class MyContractTest extends AbstractContractTest {
 *     {@literal @}Test
 *     void testScenario() {
 *         List&lt;ResourceId&gt; resources = seed("src/a.java", "src/b.java");
 *         DispatchScheduler scheduler = startScheduler(budget().withMaxResourcesPerSubtask(1));
 *
 *         PlanReceipt receipt = scheduler.submit("rename", resources, List.of());
 *
 *         assertInstanceOf(Ok.class, awaitOutcome(receipt.getTaskId()));
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractContractTest {

    protected static final long AWAIT_TIMEOUT_MS = 10_000;

    protected InMemoryLedgerBackend ledgerBackend;
    protected PlanLedger ledger;
    protected InMemoryResourceProvider provider;
    protected ScriptedResourceProcessor processor;
    protected RecordingProgressListener progress;
    protected List<VerificationHook> hooks;
    protected TaskGraphBuilder graphBuilder;
    protected Compactor compactor;
    protected DispatchScheduler scheduler;

    private final List<DispatchScheduler> started = new ArrayList<>();

    /**
     * Sets up test fixtures before each test.
     *
     * <p>Creates fresh instances of all SPI implementations.</p>
     */
    @BeforeEach
    void setUp() {
        ledgerBackend = new InMemoryLedgerBackend();
        ledger = new PlanLedger(ledgerBackend);
        provider = new InMemoryResourceProvider();
        processor = new ScriptedResourceProcessor();
        progress = new RecordingProgressListener();
        hooks = new ArrayList<>();
        graphBuilder = new TaskGraphBuilder();
        compactor = Compactor.retainingFacts();
    }

    /**
     * Stops every scheduler started by the test and clears in-memory state.
     */
    @AfterEach
    void tearDown() throws InterruptedException {
        for (DispatchScheduler each : started) {
            each.shutdown();
        }
        started.clear();
        if (ledgerBackend != null) {
            ledgerBackend.clear();
        }
        if (provider != null) {
            provider.clear();
        }
        if (progress != null) {
            progress.clear();
        }
    }

    /**
     * Budget used by most contract tests: 5 resources per subtask, soft 600, hard 800,
     * 2 concurrent sessions, post-compaction baseline 100.
     */
    protected Budget budget() {
        return new Budget(5, 600, 800, 2, 100);
    }

    protected DispatchScheduler startScheduler(Budget budget) {
        return startScheduler(new SchedulerConfig().withBudget(budget));
    }

    protected DispatchScheduler startScheduler(SchedulerConfig config) {
        return startScheduler(config, ledgerBackend);
    }

    /**
     * Starts a scheduler on the given backend (used to simulate a restart on the same ledger).
     */
    protected DispatchScheduler startScheduler(SchedulerConfig config, LedgerBackend backend) {
        PlanLedger schedulerLedger = backend == ledgerBackend ? ledger : new PlanLedger(backend);
        DispatchScheduler created = new DispatchScheduler(
            schedulerLedger, graphBuilder, provider, processor, compactor,
            new ResultAggregator(provider, hooks), progress, config, Clock.systemUTC()
        );
        started.add(created);
        scheduler = created;
        return created;
    }

    /**
     * Creates resources and seeds each with {@code "content of <id>"}.
     */
    protected List<ResourceId> seed(String... ids) {
        List<ResourceId> resources = new ArrayList<>();
        for (String id : ids) {
            ResourceId resource = ResourceId.of(id);
            provider.put(resource, "content of " + id);
            resources.add(resource);
        }
        return resources;
    }

    /**
     * Seeds {@code count} resources named {@code <prefix><nn>} (two-digit, so lexicographic = numeric order).
     */
    protected List<ResourceId> seedNumbered(String prefix, int count) {
        String[] ids = new String[count];
        for (int i = 0; i < count; i++) {
            ids[i] = String.format("%s%02d", prefix, i + 1);
        }
        return seed(ids);
    }

    protected PlanReceipt submit(List<ResourceId> resources, List<DependencyEdge> edges) {
        return scheduler.submit("contract test task", resources, edges);
    }

    /**
     * Waits for the task to terminate and fails the test if it does not within the timeout.
     */
    protected TaskOutcome awaitOutcome(TaskId taskId) {
        try {
            TaskOutcome outcome = scheduler.awaitTermination(taskId, AWAIT_TIMEOUT_MS);
            assertNotNull(outcome, "Task " + taskId + " did not terminate within " + AWAIT_TIMEOUT_MS + "ms");
            return outcome;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while awaiting " + taskId, e);
        }
    }

    protected String expectedOutput(ResourceId resource) {
        return "content of " + resource.getValue() + ScriptedResourceProcessor.OUTPUT_SUFFIX;
    }

    /**
     * Asserts that the task is in the expected state.
     */
    protected void assertTaskStatus(TaskId taskId, TaskStatus expected) {
        TaskStatus actual = scheduler.status(taskId);
        assertEquals(expected, actual,
                String.format("Expected task state %s but was %s for taskId: %s", expected, actual, taskId));
    }

    /**
     * Asserts that every resource of the task belongs to exactly one COMPLETED subtask
     * and that completed subtasks never share a resource.
     */
    protected void assertPartitioned(TaskPlan plan) {
        Map<ResourceId, Integer> owners = new HashMap<>();
        for (Subtask subtask : plan.subtasks()) {
            if (subtask.status() != SubtaskStatus.COMPLETED) {
                continue;
            }
            for (ResourceId resource : subtask.resources()) {
                owners.merge(resource, 1, Integer::sum);
            }
        }
        for (ResourceId resource : plan.resources()) {
            assertEquals(1, owners.getOrDefault(resource, 0),
                    String.format("Resource %s should be owned by exactly one completed subtask", resource));
        }
        assertEquals(plan.resources().size(), owners.size(), "Completed subtasks reference unknown resources");
    }

    /**
     * Asserts that the live plan equals the plan replayed from the ledger.
     */
    protected void assertReplayMatchesLive(TaskId taskId) {
        TaskPlan live = scheduler.plan(taskId);
        TaskPlan replayed = ledger.replay(taskId);
        assertEquals(live, replayed, "Replayed plan differs from the live plan of " + taskId);
    }
}
