/**
 * In-memory resource adapter.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.conductor.adapter.inmemory.resource;
