package com.ryuqq.metacache.core.config;

/**
 * LoadCoordinator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxConcurrentLoads: 동시에 실행되는 LoaderUnit 최대 수 (기본 6)</li>
 *   <li>executionOrder: 대기 unit 실행 순서 (기본 FIFO)</li>
 *   <li>loadTimeoutMs: 로드 타임아웃 (기본 15000ms, LoaderUnit에 전달되는 권고값)</li>
 * </ul>
 *
 * <p>loadTimeoutMs는 coordinator가 직접 강제하지 않습니다.
 * {@link com.ryuqq.metacache.core.spi.LoadContext#timeoutMs()}로 LoaderUnit에 전달되며,
 * 마감 시간 확인은 LoaderUnit이 수행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxConcurrentLoads 최대 동시 로드 수 (1 이상)
 * @param executionOrder 실행 순서
 * @param loadTimeoutMs 로드 타임아웃 (밀리초, 양수)
 */
public record LoadConfig(
    int maxConcurrentLoads,
    ExecutionOrder executionOrder,
    long loadTimeoutMs
) {

    public static final int DEFAULT_MAX_CONCURRENT_LOADS = 6;
    public static final long DEFAULT_LOAD_TIMEOUT_MS = 15_000L;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxConcurrentLoads=6, executionOrder=FIFO, loadTimeoutMs=15000ms</p>
     */
    public LoadConfig() {
        this(DEFAULT_MAX_CONCURRENT_LOADS, ExecutionOrder.FIFO, DEFAULT_LOAD_TIMEOUT_MS);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public LoadConfig {
        if (maxConcurrentLoads <= 0) {
            throw new IllegalArgumentException(
                "maxConcurrentLoads must be positive (current: " + maxConcurrentLoads + ")"
            );
        }
        if (executionOrder == null) {
            throw new IllegalArgumentException("executionOrder cannot be null");
        }
        if (loadTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "loadTimeoutMs must be positive (current: " + loadTimeoutMs + ")"
            );
        }
    }

    /**
     * maxConcurrentLoads만 변경한 새 인스턴스 생성.
     */
    public LoadConfig withMaxConcurrentLoads(int maxConcurrentLoads) {
        return new LoadConfig(maxConcurrentLoads, executionOrder, loadTimeoutMs);
    }

    /**
     * executionOrder만 변경한 새 인스턴스 생성.
     */
    public LoadConfig withExecutionOrder(ExecutionOrder executionOrder) {
        return new LoadConfig(maxConcurrentLoads, executionOrder, loadTimeoutMs);
    }

    /**
     * loadTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public LoadConfig withLoadTimeoutMs(long loadTimeoutMs) {
        return new LoadConfig(maxConcurrentLoads, executionOrder, loadTimeoutMs);
    }
}
