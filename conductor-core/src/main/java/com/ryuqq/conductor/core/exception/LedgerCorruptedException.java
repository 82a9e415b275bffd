package com.ryuqq.conductor.core.exception;

/**
 * 한 Task의 Ledger 레코드를 해석할 수 없는 경우.
 *
 * <p>해당 Task에만 치명적입니다. 복구는 그 Task를 건너뛰고 나머지를 계속 진행하며,
 * 레코드는 그대로 둡니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class LedgerCorruptedException extends RuntimeException {

    public LedgerCorruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
