package com.ryuqq.conductor.adapter.inmemory.progress;

import com.ryuqq.conductor.core.ledger.PlanRecord;
import com.ryuqq.conductor.core.model.SubtaskId;
import com.ryuqq.conductor.core.model.TaskId;
import com.ryuqq.conductor.core.spi.ProgressListener;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link ProgressListener} that keeps every received transition in memory.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RecordingProgressListener implements ProgressListener {

    private final CopyOnWriteArrayList<PlanRecord> received = new CopyOnWriteArrayList<>();

    @Override
    public void onTransition(PlanRecord record) {
        received.add(record);
    }

    /**
     * All received transitions in arrival order.
     */
    public List<PlanRecord> records() {
        return List.copyOf(received);
    }

    /**
     * Transitions of one task in arrival order.
     */
    public List<PlanRecord> recordsFor(TaskId taskId) {
        List<PlanRecord> result = new ArrayList<>();
        for (PlanRecord record : received) {
            if (record.taskId().equals(taskId)) {
                result.add(record);
            }
        }
        return result;
    }

    /**
     * Target states a subtask went through, in order (creation included).
     */
    public List<String> statesOf(SubtaskId subtaskId) {
        List<String> states = new ArrayList<>();
        for (PlanRecord record : received) {
            if (subtaskId.equals(record.subtaskId())) {
                states.add(record.toState());
            }
        }
        return states;
    }

    public void clear() {
        received.clear();
    }
}
