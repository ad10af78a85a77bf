package com.ryuqq.metacache.core.config;

import java.util.EnumSet;
import java.util.Set;

/**
 * 2계층 캐시 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxMemoryCountLimit: 메모리 캐시 최대 항목 수 (기본 500, 초과 시 근사 제거)</li>
 *   <li>shouldCacheInMemory: 메모리 캐시 사용 여부 (기본 true)</li>
 *   <li>defaultQueryOptions: 옵션 없이 조회할 때 적용되는 기본 옵션 (기본 없음)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxMemoryCountLimit 메모리 캐시 최대 항목 수 (1 이상)
 * @param shouldCacheInMemory 메모리 캐시 사용 여부
 * @param defaultQueryOptions 기본 조회 옵션
 */
public record CacheConfig(
    int maxMemoryCountLimit,
    boolean shouldCacheInMemory,
    Set<CacheQueryOption> defaultQueryOptions
) {

    public static final int DEFAULT_MAX_MEMORY_COUNT_LIMIT = 500;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxMemoryCountLimit=500, shouldCacheInMemory=true, defaultQueryOptions=[]</p>
     */
    public CacheConfig() {
        this(DEFAULT_MAX_MEMORY_COUNT_LIMIT, true, EnumSet.noneOf(CacheQueryOption.class));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CacheConfig {
        if (maxMemoryCountLimit <= 0) {
            throw new IllegalArgumentException(
                "maxMemoryCountLimit must be positive (current: " + maxMemoryCountLimit + ")"
            );
        }
        if (defaultQueryOptions == null) {
            throw new IllegalArgumentException("defaultQueryOptions cannot be null");
        }
        defaultQueryOptions = defaultQueryOptions.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(defaultQueryOptions));
    }

    /**
     * maxMemoryCountLimit만 변경한 새 인스턴스 생성.
     */
    public CacheConfig withMaxMemoryCountLimit(int maxMemoryCountLimit) {
        return new CacheConfig(maxMemoryCountLimit, shouldCacheInMemory, defaultQueryOptions);
    }

    /**
     * shouldCacheInMemory만 변경한 새 인스턴스 생성.
     */
    public CacheConfig withShouldCacheInMemory(boolean shouldCacheInMemory) {
        return new CacheConfig(maxMemoryCountLimit, shouldCacheInMemory, defaultQueryOptions);
    }

    /**
     * defaultQueryOptions만 변경한 새 인스턴스 생성.
     */
    public CacheConfig withDefaultQueryOptions(Set<CacheQueryOption> defaultQueryOptions) {
        return new CacheConfig(maxMemoryCountLimit, shouldCacheInMemory, defaultQueryOptions);
    }
}
