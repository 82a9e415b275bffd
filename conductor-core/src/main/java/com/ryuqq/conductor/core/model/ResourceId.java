package com.ryuqq.conductor.core.model;

/**
 * 주소 지정 가능한 작업 단위(예: 파일)의 식별자.
 *
 * <p>파일 경로 형태를 그대로 담을 수 있도록 슬래시(/)와 점(.)을 허용하며,
 * 값의 사전식 순서로 정렬됩니다. 그래프 빌드 시 동률 처리는 이 순서를 따릅니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~1024자</li>
 *   <li>제어 문자 불가</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ResourceId implements Comparable<ResourceId> {

    private final String value;

    private ResourceId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ResourceId cannot be null or blank");
        }
        if (value.length() > 1024) {
            throw new IllegalArgumentException("ResourceId length cannot exceed 1024 characters");
        }
        for (int i = 0; i < value.length(); i++) {
            if (Character.isISOControl(value.charAt(i))) {
                throw new IllegalArgumentException("ResourceId cannot contain control characters");
            }
        }
        this.value = value;
    }

    /**
     * ResourceId 생성.
     *
     * @param value 리소스 식별 값 (예: src/main/App.java)
     * @return ResourceId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ResourceId of(String value) {
        return new ResourceId(value);
    }

    /**
     * 리소스가 속한 디렉터리(모듈) 경로.
     *
     * <p>마지막 슬래시 앞부분을 반환하며, 슬래시가 없으면 빈 문자열입니다.</p>
     *
     * @return 디렉터리 경로 (non-null)
     */
    public String directory() {
        int slash = value.lastIndexOf('/');
        return slash < 0 ? "" : value.substring(0, slash);
    }

    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(ResourceId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResourceId that = (ResourceId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
