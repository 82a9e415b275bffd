/**
 * Append-only plan ledger.
 *
 * <p>Every task and subtask state transition is recorded as an immutable
 * {@link com.ryuqq.conductor.core.ledger.PlanRecord} before the in-memory plan changes.
 * Replaying the records of a task through
 * {@link com.ryuqq.conductor.core.plan.TaskPlan#replay(java.util.List)} rebuilds exactly
 * the state the live run had reached.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.core.ledger;
