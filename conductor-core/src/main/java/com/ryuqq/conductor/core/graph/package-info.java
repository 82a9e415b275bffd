/**
 * Task decomposition.
 *
 * <p>{@link com.ryuqq.conductor.core.graph.TaskGraphBuilder} turns a resource set and its
 * dependency edges into a DAG of budget-bounded subtasks.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.core.graph;
