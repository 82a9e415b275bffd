package com.ryuqq.conductor.core.model;

import java.util.UUID;

/**
 * Worker Session 식별자.
 *
 * <p>Ledger의 workerId 필드에 기록됩니다. 세션은 프로세스 수명에 묶여 있으므로
 * 재시작 후에는 같은 SessionId를 가진 세션이 존재하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SessionId {

    private final String value;

    private SessionId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("SessionId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("SessionId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("SessionId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * SessionId 생성.
     *
     * @param value SessionId 값
     * @return SessionId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static SessionId of(String value) {
        return new SessionId(value);
    }

    /**
     * UUID 기반 SessionId 생성.
     *
     * @return 새 SessionId
     */
    public static SessionId random() {
        return new SessionId("ws-" + UUID.randomUUID());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SessionId that = (SessionId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "SessionId{" + value + '}';
    }
}
