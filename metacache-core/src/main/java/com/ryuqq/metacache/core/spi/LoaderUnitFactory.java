package com.ryuqq.metacache.core.spi;

import com.ryuqq.metacache.core.config.LoadOptions;

/**
 * LoaderUnit 생성 SPI.
 *
 * <p>coordinator는 중복 제거된 키마다 정확히 한 번 이 팩토리를 호출합니다.
 * 같은 키로 동시에 들어온 요청은 이미 생성된 unit에 구독자로 붙습니다.</p>
 *
 * @param <A> asset 타입
 * @param <M> 메타데이터 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface LoaderUnitFactory<A extends Asset, M> {

    /**
     * LoaderUnit 생성.
     *
     * @param asset 로드 대상 asset (non-null)
     * @param options 로드 옵션
     * @return 새 LoaderUnit
     */
    LoaderUnit<M> create(A asset, LoadOptions options);
}
