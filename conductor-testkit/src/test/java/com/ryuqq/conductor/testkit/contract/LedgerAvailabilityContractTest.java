package com.ryuqq.conductor.testkit.contract;

import com.ryuqq.conductor.core.exception.LedgerUnavailableException;
import com.ryuqq.conductor.core.model.ResourceId;
import com.ryuqq.conductor.core.model.TaskId;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for Scenario 11: Ledger Unavailable.
 *
 * <p>A transition that cannot be recorded is never applied. The scheduler halts: no further
 * dispatch, submission fails, and waiters are released with an exception instead of an outcome.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class LedgerAvailabilityContractTest extends AbstractContractTest {

    @Test
    void testSubmit_LedgerDown_ThrowsAndHalts() {
        // Given
        List<ResourceId> resources = seedNumbered("src/f", 2);
        ledgerBackend.setAvailable(false);
        startScheduler(budget());

        // When
        assertThrows(LedgerUnavailableException.class, () -> submit(resources, List.of()));

        // Then
        assertTrue(scheduler.isHalted());
        assertTrue(processor.calls().isEmpty());
        ledgerBackend.setAvailable(true);
        assertThrows(IllegalStateException.class, () -> submit(resources, List.of()),
                "Halted scheduler must refuse new work");
    }

    @Test
    void testSessionCompletion_LedgerFailsMidTask_AwaitThrows() {
        // Given: task created, subtask created, task IN_PROGRESS, subtask DISPATCHED, then the ledger dies
        List<ResourceId> resources = seedNumbered("src/f", 3);
        ledgerBackend.failAfter(4);
        startScheduler(budget());

        // When
        TaskId taskId = submit(resources, List.of()).getTaskId();

        // Then
        IllegalStateException exception = assertThrows(IllegalStateException.class,
            () -> scheduler.awaitTermination(taskId, AWAIT_TIMEOUT_MS));
        assertInstanceOf(LedgerUnavailableException.class, exception.getCause());
        assertTrue(scheduler.isHalted());
        assertTrue(provider.writes().isEmpty(), "Nothing is merged once the ledger is gone");

        ledgerBackend.setAvailable(true);
        assertEquals(4, ledgerBackend.readAll(taskId).size(), "Unrecorded transitions must not appear later");
    }

    @Test
    void testHalt_LivePlanMatchesLedger() {
        // Given
        List<ResourceId> resources = seedNumbered("src/f", 3);
        ledgerBackend.failAfter(4);
        startScheduler(budget());
        TaskId taskId = submit(resources, List.of()).getTaskId();
        assertThrows(IllegalStateException.class, () -> scheduler.awaitTermination(taskId, AWAIT_TIMEOUT_MS));

        // When
        ledgerBackend.setAvailable(true);

        // Then
        assertReplayMatchesLive(taskId);
    }
}
