package com.ryuqq.metacache.adapter.runner;

import com.ryuqq.metacache.core.config.LoadOptions;
import com.ryuqq.metacache.core.spi.Asset;
import com.ryuqq.metacache.core.spi.LoaderUnit;
import com.ryuqq.metacache.core.spi.LoaderUnitFactory;

/**
 * 단순 조회 함수를 LoaderUnitFactory로 감싸는 어댑터.
 *
 * <p>시작 전에 취소된 unit은 조회 함수를 호출하지 않습니다. 진행률은 완료 시 1.0만 보고합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * LoaderUnitFactory&lt;Track, TrackInfo&gt; factory =
 *     new FunctionLoaderUnitFactory&lt;&gt;(track -&gt; client.fetchInfo(track.identifier()));
 * </pre>
 *
 * @param <A> asset 타입
 * @param <M> 메타데이터 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FunctionLoaderUnitFactory<A extends Asset, M> implements LoaderUnitFactory<A, M> {

    /**
     * asset 하나의 메타데이터를 조회하는 함수. null 반환은 실패로 처리됩니다.
     */
    @FunctionalInterface
    public interface Fetcher<A, M> {
        M fetch(A asset) throws Exception;
    }

    private final Fetcher<A, M> fetcher;

    public FunctionLoaderUnitFactory(Fetcher<A, M> fetcher) {
        if (fetcher == null) {
            throw new IllegalArgumentException("fetcher cannot be null");
        }
        this.fetcher = fetcher;
    }

    @Override
    public LoaderUnit<M> create(A asset, LoadOptions options) {
        return context -> {
            if (context.isCancelled()) {
                return null;
            }
            M metadata = fetcher.fetch(asset);
            if (metadata != null) {
                context.reportProgress(1.0);
            }
            return metadata;
        };
    }
}
