package com.ryuqq.metacache.core.model;

/**
 * 캐시 키.
 *
 * <p>Asset의 식별자를 그대로 사용합니다. 메모리 계층에서는 원문 그대로,
 * 디스크 계층에서는 해시된 파일명으로 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong> null 또는 빈 문자열 불가</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CacheKey {

    private final String value;

    private CacheKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CacheKey cannot be null or blank");
        }
        this.value = value;
    }

    /**
     * CacheKey 생성.
     *
     * @param value 키 값 (Asset 식별자)
     * @return CacheKey 인스턴스
     * @throws IllegalArgumentException 값이 null이거나 빈 문자열인 경우
     */
    public static CacheKey of(String value) {
        return new CacheKey(value);
    }

    /**
     * 키 값 조회.
     *
     * @return 키 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CacheKey cacheKey = (CacheKey) o;
        return value.equals(cacheKey.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "CacheKey{" + value + '}';
    }
}
