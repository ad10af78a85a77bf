package com.ryuqq.metacache.core.spi;

/**
 * 하나의 asset에 대한 로드 전략 1회 실행.
 *
 * <p>coordinator가 worker 스레드에서 {@link #load(LoadContext)}를 정확히 한 번 호출합니다.
 * 예외를 던지면 모든 구독자에게 실패로 전달되며 재시도하지 않습니다.</p>
 *
 * @param <M> 메타데이터 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface LoaderUnit<M> {

    /**
     * 메타데이터 로드 (블로킹).
     *
     * @param context 실행 컨텍스트
     * @return 로드된 메타데이터 (null이면 실패로 취급)
     * @throws Exception 로드 실패 시
     */
    M load(LoadContext context) throws Exception;
}
