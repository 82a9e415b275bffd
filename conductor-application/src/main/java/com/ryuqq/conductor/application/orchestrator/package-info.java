/**
 * Orchestrator 진입점.
 *
 * <p>{@link com.ryuqq.conductor.application.orchestrator.Orchestrator}는 Task 제출, 취소,
 * 상태 조회를 제공하는 애플리케이션 계층 인터페이스입니다.
 * 구현체는 conductor-adapter-runner 모듈의 DispatchScheduler입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.conductor.application.orchestrator;
