package com.ryuqq.conductor.core.spi;

import com.ryuqq.conductor.core.model.ResourceId;

/**
 * Worker 실행자 SPI.
 *
 * <p>리소스 하나를 처리하고, 처리 결과와 이번 처리로 소비한 컨텍스트 단위를 반환합니다.
 * 실제 코드 생성/편집은 이 구현체의 책임이며, 오케스트레이터는 언제 얼마나 많은
 * 리소스를 맡길지만 결정합니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>WorkingContext에는 지금까지 처리한 리소스와 교차 리소스 사실(facts)이 담겨 있음</li>
 *   <li>RuntimeException은 세션 크래시로 처리되어 재시도 한도 내에서 재큐잉됨</li>
 *   <li>구현체는 thread-safe해야 함 (세션마다 다른 스레드에서 호출)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ResourceProcessor {

    /**
     * 리소스 하나 처리.
     *
     * @param resourceId 처리할 리소스
     * @param content ResourceProvider에서 읽은 현재 내용
     * @param context 세션의 누적 작업 컨텍스트 (읽기 전용으로 취급)
     * @return 처리 결과
     */
    ProcessedResource process(ResourceId resourceId, String content, WorkingContext context);
}
