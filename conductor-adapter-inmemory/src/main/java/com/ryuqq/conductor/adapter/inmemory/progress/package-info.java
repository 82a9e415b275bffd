/**
 * In-memory progress stream adapter.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.conductor.adapter.inmemory.progress;
