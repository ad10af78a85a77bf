package com.ryuqq.metacache.core.spi;

import com.ryuqq.metacache.core.model.CacheKey;

/**
 * 메타데이터 조회 대상 (외부 정의).
 *
 * <p>식별자는 비어 있지 않아야 하며 asset의 수명 동안 변하지 않아야 합니다.
 * 동일한 식별자를 가진 asset은 같은 캐시 항목과 같은 LoaderUnit을 공유합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Asset {

    /**
     * 안정적인 문자열 식별자.
     *
     * @return 식별자 (non-blank)
     */
    String identifier();

    /**
     * 식별자로부터 캐시 키 생성.
     *
     * @return 캐시 키
     * @throws IllegalArgumentException 식별자가 비어 있는 경우
     */
    default CacheKey cacheKey() {
        return CacheKey.of(identifier());
    }
}
