package com.ryuqq.metacache.adapter.runner;

import com.ryuqq.metacache.adapter.disk.store.KeyedPersistenceDirectory;
import com.ryuqq.metacache.adapter.disk.store.TieredMetadataCache;
import com.ryuqq.metacache.application.manager.CachingMetadataManager;
import com.ryuqq.metacache.application.manager.MetadataManager;
import com.ryuqq.metacache.core.config.CacheConfig;
import com.ryuqq.metacache.core.config.LoadConfig;
import com.ryuqq.metacache.core.executor.CompletionContext;
import com.ryuqq.metacache.core.spi.Asset;
import com.ryuqq.metacache.core.spi.LoaderUnitFactory;
import com.ryuqq.metacache.core.spi.MetadataCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * 디스크 캐시, 로드 coordinator, 매니저를 한 번에 구성하는 런타임.
 *
 * <p>구성 요소의 스레드(디스크 I/O, 로드 작업자)는 {@link #close()}에서 함께 정리됩니다.
 * completion context는 호출자가 소유하므로 닫지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (MetadataCacheRuntime&lt;Track, TrackInfo&gt; runtime = MetadataCacheRuntime.create(
 *         cacheRoot, "track-info", factory, JacksonMetadataCodec.forType(TrackInfo.class),
 *         new CacheConfig(), new LoadConfig(), completionContext)) {
 *     runtime.manager().loadMetadata(track, result -&gt; show(result.metadata()));
 * }
 * </pre>
 *
 * @param <A> asset 타입
 * @param <M> 메타데이터 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MetadataCacheRuntime<A extends Asset, M> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetadataCacheRuntime.class);

    private final TieredMetadataCache<M> cache;
    private final BoundedLoadCoordinator<A, M> coordinator;
    private final MetadataManager<A, M> manager;

    private MetadataCacheRuntime(
        TieredMetadataCache<M> cache,
        BoundedLoadCoordinator<A, M> coordinator,
        MetadataManager<A, M> manager
    ) {
        this.cache = cache;
        this.coordinator = coordinator;
        this.manager = manager;
    }

    /**
     * 런타임 생성.
     *
     * @param cacheRoot 캐시 루트 디렉토리
     * @param namespace 캐시 네임스페이스
     * @param factory LoaderUnit 생성기
     * @param codec 디스크 계층 코덱
     * @param cacheConfig 캐시 설정
     * @param loadConfig 로드 설정
     * @param completionContext 콜백 전달 컨텍스트
     * @throws com.ryuqq.metacache.core.exception.PersistenceUnavailableException 디렉토리 생성 실패 시
     */
    public static <A extends Asset, M> MetadataCacheRuntime<A, M> create(
        Path cacheRoot,
        String namespace,
        LoaderUnitFactory<A, M> factory,
        MetadataCodec<M> codec,
        CacheConfig cacheConfig,
        LoadConfig loadConfig,
        CompletionContext completionContext
    ) {
        KeyedPersistenceDirectory directory = new KeyedPersistenceDirectory(cacheRoot, namespace);
        TieredMetadataCache<M> cache = new TieredMetadataCache<>(directory, codec, cacheConfig, completionContext);
        BoundedLoadCoordinator<A, M> coordinator =
            new BoundedLoadCoordinator<>(factory, loadConfig, completionContext);
        MetadataManager<A, M> manager = new CachingMetadataManager<>(cache, coordinator, completionContext);
        log.info("Metadata cache runtime started: namespace={}, directory={}, maxConcurrentLoads={}, order={}",
            namespace, directory.directory(), loadConfig.maxConcurrentLoads(), loadConfig.executionOrder());
        return new MetadataCacheRuntime<>(cache, coordinator, manager);
    }

    public MetadataManager<A, M> manager() {
        return manager;
    }

    public TieredMetadataCache<M> cache() {
        return cache;
    }

    public BoundedLoadCoordinator<A, M> coordinator() {
        return coordinator;
    }

    /**
     * 진행 중인 요청을 취소하고 작업자/I-O 스레드를 종료합니다.
     */
    @Override
    public void close() {
        manager.cancelAll();
        coordinator.close();
        cache.close();
        log.info("Metadata cache runtime stopped");
    }
}
