package com.ryuqq.metacache.core.config;

/**
 * 대기 중인 LoaderUnit의 실행 순서.
 *
 * <p>이미 시작된 unit에는 영향을 주지 않으며, worker 슬롯을 기다리는 unit 간의
 * 상대 순서만 결정합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ExecutionOrder {

    /**
     * 먼저 제출된 unit이 먼저 시작 (기본값).
     */
    FIFO,

    /**
     * 가장 최근에 제출된 unit이 먼저 시작.
     */
    LIFO
}
