/**
 * Task aggregation outcome package.
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.core.outcome.TaskOutcome} - Sealed interface (permits Ok, Fail, Cancelled)</li>
 * </ul>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.core.outcome.Ok} - Merged and verified</li>
 *   <li>{@link com.ryuqq.conductor.core.outcome.Fail} - Permanent failure with a structured diagnostic</li>
 *   <li>{@link com.ryuqq.conductor.core.outcome.Cancelled} - Cancelled before aggregation</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.core.outcome;
