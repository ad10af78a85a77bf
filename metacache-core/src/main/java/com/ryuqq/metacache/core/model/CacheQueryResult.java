package com.ryuqq.metacache.core.model;

/**
 * 캐시 조회 결과.
 *
 * @param metadata 조회된 메타데이터 (miss인 경우 null)
 * @param tier 조회된 계층 (miss인 경우 {@link CacheTier#NONE})
 * @param <M> 메타데이터 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CacheQueryResult<M>(M metadata, CacheTier tier) {

    public CacheQueryResult {
        if (tier == null) {
            throw new IllegalArgumentException("tier cannot be null");
        }
        if (metadata == null && tier != CacheTier.NONE) {
            throw new IllegalArgumentException("miss result must have tier NONE (current: " + tier + ")");
        }
    }

    /**
     * Miss 결과 생성.
     */
    public static <M> CacheQueryResult<M> miss() {
        return new CacheQueryResult<>(null, CacheTier.NONE);
    }

    /**
     * Hit 여부 확인.
     *
     * @return 메타데이터가 있으면 true
     */
    public boolean isHit() {
        return metadata != null;
    }
}
