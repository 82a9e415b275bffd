/**
 * Core domain model package containing identifiers and value objects.
 *
 * <h2>Identifiers</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.core.model.TaskId} - Submitted task identifier</li>
 *   <li>{@link com.ryuqq.conductor.core.model.SubtaskId} - Budget-bounded unit of a task</li>
 *   <li>{@link com.ryuqq.conductor.core.model.SessionId} - Worker session identifier</li>
 *   <li>{@link com.ryuqq.conductor.core.model.ResourceId} - Addressable unit of work (e.g. a file), lexicographically ordered</li>
 * </ul>
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.core.model.DependencyEdge} - prerequisite → dependent resource edge</li>
 *   <li>{@link com.ryuqq.conductor.core.model.Budget} - Resource and context-consumption limits</li>
 *   <li>{@link com.ryuqq.conductor.core.model.Diagnostic} - Structured failure diagnostic</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable (final fields or records)</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.core.model;
