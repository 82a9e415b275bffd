/**
 * In-memory ledger adapter.
 *
 * <p>{@link com.ryuqq.conductor.adapter.inmemory.ledger.InMemoryLedgerBackend} is a thread-safe
 * {@link com.ryuqq.conductor.core.spi.LedgerBackend} for contract tests, with failure simulation.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.conductor.adapter.inmemory.ledger;
