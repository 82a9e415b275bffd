package com.ryuqq.conductor.core.spi;

import com.ryuqq.conductor.core.ledger.PlanRecord;

/**
 * Progress stream SPI.
 *
 * <p>Receives every state transition after it has been durably appended to the ledger.
 * The orchestrator makes no assumption about consumers (CLI, dashboard, tests).</p>
 *
 * <p><strong>Contract:</strong></p>
 * <ul>
 *   <li>Called while the scheduler holds its dispatch lock: implementations must return quickly</li>
 *   <li>Exceptions are logged and ignored; they never affect orchestration</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProgressListener {

    /**
     * Called for each recorded transition.
     *
     * @param record the recorded transition
     */
    void onTransition(PlanRecord record);

    /**
     * Listener that ignores every event.
     *
     * @return no-op listener
     */
    static ProgressListener none() {
        return record -> { };
    }
}
