/**
 * File-based ledger adapter.
 *
 * <p>{@link com.ryuqq.conductor.adapter.file.ledger.JsonLinesLedgerBackend} persists plan records
 * as JSON lines (Jackson Databind), one file per task, so a restarted process can replay them.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.conductor.adapter.file.ledger;
