/**
 * Runner 어댑터 패키지.
 *
 * <p>Orchestrator의 실행 엔진을 제공합니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.adapter.runner.DispatchScheduler} - READY Subtask 배분 및 결과 기록</li>
 *   <li>{@link com.ryuqq.conductor.adapter.runner.WorkerSession} - Subtask 하나의 리소스 순차 처리</li>
 *   <li>{@link com.ryuqq.conductor.adapter.runner.BudgetMonitor} - 컨텍스트 소비량 판정</li>
 *   <li>{@link com.ryuqq.conductor.adapter.runner.ResultAggregator} - 결과 병합 및 검증</li>
 *   <li>{@link com.ryuqq.conductor.adapter.runner.LedgerRecovery} - 재시작 복구</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.conductor.adapter.runner;
