/**
 * Task, Subtask and worker session state machines.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.core.statemachine.TaskStatus} - Task lifecycle states</li>
 *   <li>{@link com.ryuqq.conductor.core.statemachine.SubtaskStatus} - Subtask lifecycle states</li>
 *   <li>{@link com.ryuqq.conductor.core.statemachine.SessionState} - Worker session states</li>
 *   <li>{@link com.ryuqq.conductor.core.statemachine.StateTransition} - Transition validation</li>
 * </ul>
 *
 * <h2>Task Transition Rules</h2>
 * <pre>
 * PLANNED → IN_PROGRESS | CANCELLED | FAILED
 * IN_PROGRESS → COMPLETED | FAILED | CANCELLED
 *
 * Forbidden:
 * - COMPLETED / FAILED / CANCELLED → * (terminal state)
 * </pre>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Invariants:</strong> Terminal states cannot transition to any other state</li>
 *   <li><strong>Fail-Fast:</strong> Invalid transitions throw IllegalStateException immediately</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.core.statemachine;
