/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the external collaborators of the orchestrator. Adapter
 * modules (e.g. conductor-adapter-inmemory, conductor-adapter-file) provide concrete
 * implementations.</p>
 *
 * <h2>Consumed SPIs</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.core.spi.LedgerBackend} - Durable append-only record store</li>
 *   <li>{@link com.ryuqq.conductor.core.spi.ResourceProvider} - Resource read/write</li>
 *   <li>{@link com.ryuqq.conductor.core.spi.ResourceProcessor} - The work performed on one resource</li>
 *   <li>{@link com.ryuqq.conductor.core.spi.Compactor} - Deterministic context summarization</li>
 *   <li>{@link com.ryuqq.conductor.core.spi.VerificationHook} - Post-merge verification</li>
 * </ul>
 *
 * <h2>Emitted</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.core.spi.ProgressListener} - Transition stream</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.core.spi;
