package com.ryuqq.metacache.application.manager;

import com.ryuqq.metacache.core.config.CacheQueryOption;
import com.ryuqq.metacache.core.config.LoadOptions;

import java.util.EnumSet;
import java.util.Set;

/**
 * 요청 단위 옵션 (불변 record).
 *
 * @param queryOptions 캐시 조회 옵션 (null이면 CacheStore 기본 옵션)
 * @param loadOptions 캐시 miss 시 로드 옵션
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record MetadataRequestOptions(Set<CacheQueryOption> queryOptions, LoadOptions loadOptions) {

    private static final MetadataRequestOptions DEFAULTS = new MetadataRequestOptions(null, LoadOptions.defaults());

    public MetadataRequestOptions {
        if (loadOptions == null) {
            throw new IllegalArgumentException("loadOptions cannot be null");
        }
        if (queryOptions != null) {
            queryOptions = queryOptions.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(queryOptions));
        }
    }

    public static MetadataRequestOptions defaults() {
        return DEFAULTS;
    }

    /**
     * queryOptions만 변경한 새 인스턴스 생성.
     */
    public MetadataRequestOptions withQueryOptions(Set<CacheQueryOption> queryOptions) {
        return new MetadataRequestOptions(queryOptions, loadOptions);
    }

    /**
     * loadOptions만 변경한 새 인스턴스 생성.
     */
    public MetadataRequestOptions withLoadOptions(LoadOptions loadOptions) {
        return new MetadataRequestOptions(queryOptions, loadOptions);
    }
}
