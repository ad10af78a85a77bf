package com.ryuqq.metacache.core.config;

/**
 * 캐시 조회 옵션.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CacheQueryOption {

    /**
     * 메모리 hit이어도 디스크 단계를 거치도록 강제.
     *
     * <p>기본 동작은 메모리 hit 시 디스크 확인 없이 즉시 반환합니다.</p>
     */
    QUERY_DATA_WHEN_IN_MEMORY,

    /**
     * 디스크 단계를 호출자 스레드에서 동기로 실행.
     *
     * <p>기본 동작은 백그라운드 I/O 스레드에서 비동기로 실행합니다.</p>
     */
    QUERY_DISK_SYNC
}
