package com.ryuqq.metacache.core.model;

/**
 * 메타데이터를 찾은 캐시 계층.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CacheTier {

    /**
     * 캐시에 없었음 (새로 로드된 결과 포함).
     */
    NONE,

    /**
     * 메모리 캐시에서 조회됨.
     */
    MEMORY,

    /**
     * 디스크 캐시에서 조회됨.
     */
    DISK
}
