/**
 * Event-sourced task plan.
 *
 * <p>{@link com.ryuqq.conductor.core.plan.TaskPlan} is the task aggregate: the task's
 * status, its subtasks and their dependencies. It is changed only by applying
 * {@link com.ryuqq.conductor.core.ledger.PlanRecord}s.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.core.plan;
