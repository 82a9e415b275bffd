package com.ryuqq.conductor.core.exception;

/**
 * Ledger 백엔드를 사용할 수 없는 경우.
 *
 * <p>기록되지 않은 상태로 진행할 수 없으므로 오케스트레이터 프로세스에 치명적입니다.
 * 스케줄러는 이 예외를 받으면 새 디스패치와 제출을 중단합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class LedgerUnavailableException extends RuntimeException {

    public LedgerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
