package com.ryuqq.conductor.core.spi;

import com.ryuqq.conductor.core.ledger.PlanRecord;
import com.ryuqq.conductor.core.model.TaskId;

import java.util.List;

/**
 * Durable append-only storage SPI for plan records.
 *
 * <p>Any durable append-only store (file, database, object store) satisfies this
 * interface. The orchestrator never mutates or deletes records it has appended.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: concurrent appends must be serialized by the backend</li>
 *   <li>Ordered: {@link #readAll(TaskId)} returns records in append order</li>
 *   <li>Durable: a record is durable when {@link #append(PlanRecord)} returns</li>
 *   <li>Fail loudly: any storage failure must surface as an exception, never be ignored</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * backend.append(PlanRecord.taskCreated(taskId, "refactor", resources, now));
 * List&lt;PlanRecord&gt; history = backend.readAll(taskId);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface LedgerBackend {

    /**
     * Appends a record.
     *
     * @param record the record to append
     * @throws IllegalArgumentException if record is null
     * @throws RuntimeException if the record could not be stored durably
     */
    void append(PlanRecord record);

    /**
     * Reads every record of a task in append order.
     *
     * @param taskId the task ID
     * @return records of the task (empty if the task is unknown)
     * @throws IllegalArgumentException if taskId is null
     * @throws com.ryuqq.conductor.core.exception.LedgerCorruptedException if the stored records
     *         of this task cannot be decoded
     */
    List<PlanRecord> readAll(TaskId taskId);

    /**
     * Lists every task that has at least one record, in first-append order.
     *
     * <p>Used by recovery to discover tasks after a restart. A task whose records are
     * corrupted is still listed, so that the failure surfaces when that task is read.</p>
     *
     * @return task IDs (may be empty)
     */
    List<TaskId> taskIds();
}
