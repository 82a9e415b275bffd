/**
 * Error taxonomy of the orchestrator.
 *
 * <ul>
 *   <li>{@link com.ryuqq.conductor.core.exception.GraphException} - submission rejected (cyclic, empty, unknown resource)</li>
 *   <li>{@link com.ryuqq.conductor.core.exception.BudgetExceededException} - fatal for one subtask branch</li>
 *   <li>{@link com.ryuqq.conductor.core.exception.ConflictException} - fatal for the task</li>
 *   <li>{@link com.ryuqq.conductor.core.exception.LedgerUnavailableException} - fatal for the process</li>
 *   <li>{@link com.ryuqq.conductor.core.exception.LedgerCorruptedException} - fatal for one task's recovery</li>
 * </ul>
 *
 * <p>Session crashes and verification failures are not exceptions at the API surface:
 * they are recorded as subtask transitions and {@link com.ryuqq.conductor.core.model.Diagnostic}s.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.core.exception;
