package com.ryuqq.conductor.core.model;

/**
 * 실패한 Subtask 또는 Task에 첨부되는 구조화된 진단 정보.
 *
 * <p>어떤 리소스, 어떤 검증 Hook, 몇 번째 재시도에서 실패했는지를 담아
 * 전체 그래프를 다시 만들지 않고도 재개하거나 수동으로 수정할 수 있게 합니다.</p>
 *
 * <p><strong>코드 예시:</strong></p>
 * <ul>
 *   <li>{@value #BUDGET_EXCEEDED}: 단일 리소스가 hardThreshold 안에 들어가지 않음</li>
 *   <li>{@value #RETRY_EXHAUSTED}: 세션 크래시 재시도 한도 초과</li>
 *   <li>{@value #CONFLICT}: 같은 리소스에 서로 다른 결과가 존재</li>
 *   <li>{@value #VERIFICATION_FAILED}: 검증 Hook 실패</li>
 *   <li>{@value #UPSTREAM_FAILED}: 선행 Subtask 실패로 취소됨</li>
 *   <li>{@value #SESSION_LOST}: 재시작 시 실행 중이던 Session을 실패로 처리</li>
 *   <li>{@value #AGGREGATION_FAILED}: 병합 결과 쓰기 실패</li>
 * </ul>
 *
 * @param code 진단 코드
 * @param resource 관련 리소스 (선택, null 가능)
 * @param hook 실패한 검증 Hook 이름 (선택, null 가능)
 * @param retryCount 실패 시점의 재시도 횟수 (0 이상)
 * @param message 사람이 읽을 수 있는 메시지
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Diagnostic(
    String code,
    ResourceId resource,
    String hook,
    int retryCount,
    String message
) {

    public static final String BUDGET_EXCEEDED = "BUDGET_EXCEEDED";
    public static final String RETRY_EXHAUSTED = "RETRY_EXHAUSTED";
    public static final String CONFLICT = "CONFLICT";
    public static final String VERIFICATION_FAILED = "VERIFICATION_FAILED";
    public static final String UPSTREAM_FAILED = "UPSTREAM_FAILED";
    public static final String SUBTASK_FAILED = "SUBTASK_FAILED";
    public static final String SESSION_LOST = "SESSION_LOST";
    public static final String AGGREGATION_FAILED = "AGGREGATION_FAILED";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException code 또는 message가 비어있거나 retryCount가 음수인 경우
     */
    public Diagnostic {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be non-negative (current: " + retryCount + ")");
        }
        // resource, hook은 null 허용
    }

    /**
     * 리소스 관련 진단 생성.
     */
    public static Diagnostic forResource(String code, ResourceId resource, int retryCount, String message) {
        return new Diagnostic(code, resource, null, retryCount, message);
    }

    /**
     * 검증 Hook 실패 진단 생성.
     */
    public static Diagnostic forHook(String hook, String message) {
        return new Diagnostic(VERIFICATION_FAILED, null, hook, 0, message);
    }

    /**
     * 코드와 메시지만으로 진단 생성.
     */
    public static Diagnostic of(String code, String message) {
        return new Diagnostic(code, null, null, 0, message);
    }
}
