package com.ryuqq.metacache.application.manager;

import com.ryuqq.metacache.core.exception.AssetNotFoundException;
import com.ryuqq.metacache.core.exception.MetadataLoadException;
import com.ryuqq.metacache.core.executor.CompletionContext;
import com.ryuqq.metacache.core.model.CacheKey;
import com.ryuqq.metacache.core.model.CacheQueryResult;
import com.ryuqq.metacache.core.model.LoadResult;
import com.ryuqq.metacache.core.model.LoadToken;
import com.ryuqq.metacache.core.model.MetadataResult;
import com.ryuqq.metacache.core.spi.Asset;
import com.ryuqq.metacache.core.spi.CacheStore;
import com.ryuqq.metacache.core.spi.Cancellable;
import com.ryuqq.metacache.core.spi.LoadCoordinator;
import com.ryuqq.metacache.core.statemachine.RequestState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;

/**
 * CacheStore와 LoadCoordinator를 조합한 {@link MetadataManager} 구현체.
 *
 * <p><strong>Running Set:</strong> 진행 중인 {@link CombinedOperation}을 보관하며 전용 락으로 보호합니다.
 * 각 요청은 캐시 hit, 로드 성공/실패, 취소 중 어느 경로로 끝나든 정확히 1회 제거됩니다.</p>
 *
 * <p><strong>전달 규칙:</strong></p>
 * <ul>
 *   <li>결과 전달은 completion context에서 실행되며, 실행 시점에 종료 상태를 선점한 경우에만 호출</li>
 *   <li>로드 성공 결과는 디스크 기록을 포함해 캐시에 저장한 뒤 계층 NONE으로 전달</li>
 *   <li>로드 오류는 재시도 없이 그대로 전달</li>
 * </ul>
 *
 * <p>락을 잡은 채로 콜백, 캐시 I/O를 호출하지 않습니다.</p>
 *
 * @param <A> asset 타입
 * @param <M> 메타데이터 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CachingMetadataManager<A extends Asset, M> implements MetadataManager<A, M> {

    private static final Logger log = LoggerFactory.getLogger(CachingMetadataManager.class);

    private final CacheStore<M> cacheStore;
    private final LoadCoordinator<A, M> coordinator;
    private final CompletionContext completionContext;

    private final ReentrantLock runningLock = new ReentrantLock();
    private final Set<CombinedOperation> runningOperations = new LinkedHashSet<>();

    /**
     * 생성자.
     *
     * @param cacheStore 2계층 캐시
     * @param coordinator 로드 coordinator
     * @param completionContext 콜백 전달 컨텍스트
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public CachingMetadataManager(
        CacheStore<M> cacheStore,
        LoadCoordinator<A, M> coordinator,
        CompletionContext completionContext
    ) {
        if (cacheStore == null) {
            throw new IllegalArgumentException("cacheStore cannot be null");
        }
        if (coordinator == null) {
            throw new IllegalArgumentException("coordinator cannot be null");
        }
        if (completionContext == null) {
            throw new IllegalArgumentException("completionContext cannot be null");
        }
        this.cacheStore = cacheStore;
        this.coordinator = coordinator;
        this.completionContext = completionContext;
    }

    @Override
    public MetadataOperation loadMetadata(
        A asset,
        MetadataRequestOptions options,
        DoubleConsumer progress,
        Consumer<MetadataResult<A, M>> completion
    ) {
        MetadataRequestOptions effective = options == null ? MetadataRequestOptions.defaults() : options;
        CombinedOperation operation = new CombinedOperation(coordinator, this::unregister);
        register(operation);

        if (asset == null) {
            deliver(operation, RequestState.FAILED,
                MetadataResult.failed(new AssetNotFoundException("asset cannot be null"), null), completion);
            return operation;
        }

        CacheKey key = asset.cacheKey();
        Cancellable cacheQuery = cacheStore.query(key, effective.queryOptions(),
            result -> onCacheResult(operation, asset, key, effective, result, progress, completion));
        operation.attachCacheQuery(cacheQuery);
        return operation;
    }

    private void onCacheResult(
        CombinedOperation operation,
        A asset,
        CacheKey key,
        MetadataRequestOptions options,
        CacheQueryResult<M> cached,
        DoubleConsumer progress,
        Consumer<MetadataResult<A, M>> completion
    ) {
        if (cached.isHit()) {
            log.debug("Cache hit for {} (tier={})", key, cached.tier());
            deliver(operation, RequestState.COMPLETED,
                MetadataResult.cached(cached.metadata(), cached.tier(), asset), completion);
            return;
        }
        if (!operation.beginLoading()) {
            return;
        }

        log.debug("Cache miss for {}, delegating to coordinator", key);
        DoubleConsumer forwardProgress = fraction -> {
            if (progress != null && !operation.isCancelled()) {
                progress.accept(fraction);
            }
        };
        LoadToken token;
        try {
            token = coordinator.load(asset, options.loadOptions(), forwardProgress,
                loaded -> onLoadResult(operation, asset, key, loaded, completion));
        } catch (RuntimeException e) {
            log.warn("Could not schedule load for {}", key, e);
            deliver(operation, RequestState.FAILED,
                MetadataResult.failed(new MetadataLoadException(key, e), asset), completion);
            return;
        }
        operation.attachLoadToken(token);
    }

    private void onLoadResult(
        CombinedOperation operation,
        A asset,
        CacheKey key,
        LoadResult<M> loaded,
        Consumer<MetadataResult<A, M>> completion
    ) {
        if (loaded.isFailure()) {
            deliver(operation, RequestState.FAILED, MetadataResult.failed(loaded.error(), asset), completion);
            return;
        }
        // 중복 제거된 구독자들은 같은 인스턴스를 받으므로 첫 구독자만 저장
        if (loaded.finished() && loaded.metadata() != null && !operation.isCancelled()
            && cacheStore.fromMemory(key) != loaded.metadata()) {
            cacheStore.store(key, loaded.metadata(), true, null);
        }
        deliver(operation, RequestState.COMPLETED,
            MetadataResult.loaded(loaded.metadata(), loaded.finished(), asset), completion);
    }

    private void deliver(
        CombinedOperation operation,
        RequestState terminal,
        MetadataResult<A, M> result,
        Consumer<MetadataResult<A, M>> completion
    ) {
        completionContext.dispatch(() -> {
            if (operation.complete(terminal) && completion != null) {
                completion.accept(result);
            }
        });
    }

    @Override
    public void saveMetadata(A asset, M metadata, Runnable onDone) {
        if (asset == null || metadata == null) {
            log.debug("Ignoring save without asset or metadata");
            return;
        }
        cacheStore.store(asset.cacheKey(), metadata, true, onDone);
    }

    @Override
    public void removeMetadata(A asset, boolean fromDisk, Runnable onDone) {
        if (asset == null) {
            return;
        }
        cacheStore.remove(asset.cacheKey(), fromDisk, onDone);
    }

    @Override
    public void cancelAll() {
        List<CombinedOperation> snapshot;
        runningLock.lock();
        try {
            snapshot = new ArrayList<>(runningOperations);
        } finally {
            runningLock.unlock();
        }
        snapshot.forEach(CombinedOperation::cancel);
        log.debug("Cancelled {} running operations", snapshot.size());
    }

    @Override
    public boolean isRunning() {
        return runningCount() > 0;
    }

    @Override
    public int runningCount() {
        runningLock.lock();
        try {
            return runningOperations.size();
        } finally {
            runningLock.unlock();
        }
    }

    @Override
    public void cachedMetadataExists(A asset, Consumer<Boolean> callback) {
        if (asset == null) {
            respond(callback, false);
            return;
        }
        CacheKey key = asset.cacheKey();
        if (cacheStore.fromMemory(key) != null) {
            respond(callback, true);
            return;
        }
        cacheStore.diskExists(key, callback);
    }

    @Override
    public void diskMetadataExists(A asset, Consumer<Boolean> callback) {
        if (asset == null) {
            respond(callback, false);
            return;
        }
        cacheStore.diskExists(asset.cacheKey(), callback);
    }

    @Override
    public CacheKey cacheKey(A asset) {
        return asset == null ? null : asset.cacheKey();
    }

    private void respond(Consumer<Boolean> callback, boolean value) {
        if (callback != null) {
            completionContext.dispatch(() -> callback.accept(value));
        }
    }

    private void register(CombinedOperation operation) {
        runningLock.lock();
        try {
            runningOperations.add(operation);
        } finally {
            runningLock.unlock();
        }
    }

    private void unregister(CombinedOperation operation) {
        runningLock.lock();
        try {
            runningOperations.remove(operation);
        } finally {
            runningLock.unlock();
        }
    }
}
