package com.ryuqq.conductor.core.spi;

/**
 * 검증 Hook 실행 결과.
 *
 * @param pass 통과 여부
 * @param diagnostics 진단 메시지 (통과 시 빈 문자열 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record VerificationResult(boolean pass, String diagnostics) {

    public VerificationResult {
        diagnostics = diagnostics == null ? "" : diagnostics;
    }

    public static VerificationResult passed() {
        return new VerificationResult(true, "");
    }

    public static VerificationResult failed(String diagnostics) {
        return new VerificationResult(false, diagnostics);
    }
}
