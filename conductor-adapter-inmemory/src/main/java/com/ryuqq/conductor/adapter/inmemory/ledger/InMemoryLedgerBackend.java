package com.ryuqq.conductor.adapter.inmemory.ledger;

import com.ryuqq.conductor.core.ledger.PlanRecord;
import com.ryuqq.conductor.core.model.TaskId;
import com.ryuqq.conductor.core.spi.LedgerBackend;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link LedgerBackend} SPI for testing and reference purposes.
 *
 * <p>Records are kept per task in append order. Appends are serialized so that the
 * first-append order of tasks is stable for {@link #taskIds()}.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>records:</strong> ConcurrentHashMap&lt;TaskId, CopyOnWriteArrayList&lt;PlanRecord&gt;&gt; - Records per task (O(1) lookup)</li>
 *   <li><strong>taskOrder:</strong> CopyOnWriteArrayList&lt;TaskId&gt; - Task IDs in first-append order</li>
 * </ul>
 *
 * <p><strong>Failure Simulation:</strong> {@link #setAvailable(boolean)} makes every
 * subsequent call fail, and {@link #failAfter(int)} lets a given number of appends
 * succeed before the backend becomes unavailable. Both are used to test scheduler halting.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryLedgerBackend implements LedgerBackend {

    private final Map<TaskId, CopyOnWriteArrayList<PlanRecord>> records = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<TaskId> taskOrder = new CopyOnWriteArrayList<>();
    private volatile boolean available = true;
    private int appendsBeforeFailure = -1;

    @Override
    public synchronized void append(PlanRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (appendsBeforeFailure == 0) {
            available = false;
        }
        requireAvailable();
        if (appendsBeforeFailure > 0) {
            appendsBeforeFailure--;
        }
        records.computeIfAbsent(record.taskId(), id -> {
            taskOrder.add(id);
            return new CopyOnWriteArrayList<>();
        }).add(record);
    }

    @Override
    public List<PlanRecord> readAll(TaskId taskId) {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        requireAvailable();
        List<PlanRecord> taskRecords = records.get(taskId);
        return taskRecords == null ? List.of() : new ArrayList<>(taskRecords);
    }

    @Override
    public List<TaskId> taskIds() {
        requireAvailable();
        return new ArrayList<>(taskOrder);
    }

    /**
     * Simulates an outage (false) or recovery (true) of the backend.
     *
     * @param available whether subsequent calls succeed
     */
    public synchronized void setAvailable(boolean available) {
        this.available = available;
        this.appendsBeforeFailure = -1;
    }

    /**
     * Lets the given number of appends succeed, then fails every call.
     *
     * @param appends appends that still succeed (0 or more)
     */
    public synchronized void failAfter(int appends) {
        if (appends < 0) {
            throw new IllegalArgumentException("appends must be non-negative (current: " + appends + ")");
        }
        this.appendsBeforeFailure = appends;
    }

    /**
     * Total number of stored records.
     */
    public int size() {
        int total = 0;
        for (List<PlanRecord> taskRecords : records.values()) {
            total += taskRecords.size();
        }
        return total;
    }

    /**
     * Removes all records and restores availability (for tests).
     */
    public synchronized void clear() {
        records.clear();
        taskOrder.clear();
        available = true;
        appendsBeforeFailure = -1;
    }

    private void requireAvailable() {
        if (!available) {
            throw new IllegalStateException("Ledger backend unavailable");
        }
    }
}
