package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.core.model.SessionId;
import com.ryuqq.conductor.core.model.SubtaskId;
import com.ryuqq.conductor.core.statemachine.SessionState;

/**
 * Worker Session 상태 변경 콜백.
 *
 * <p>Scheduler는 ACTIVE → COMPACTING → ACTIVE 전이를 Subtask의
 * DISPATCHED → COMPACTING → DISPATCHED 레코드로 기록합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SessionStateListener {

    /**
     * Session 상태 변경 통지 (Session 스레드에서 호출).
     *
     * @param sessionId Session ID
     * @param subtaskId 처리 중인 Subtask
     * @param from 이전 상태
     * @param to 새 상태
     */
    void onStateChange(SessionId sessionId, SubtaskId subtaskId, SessionState from, SessionState to);
}
