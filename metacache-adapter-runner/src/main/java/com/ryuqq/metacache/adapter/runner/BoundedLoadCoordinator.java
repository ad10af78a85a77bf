package com.ryuqq.metacache.adapter.runner;

import com.ryuqq.metacache.core.config.ExecutionOrder;
import com.ryuqq.metacache.core.config.LoadConfig;
import com.ryuqq.metacache.core.config.LoadOptions;
import com.ryuqq.metacache.core.exception.MetadataLoadException;
import com.ryuqq.metacache.core.executor.CompletionContext;
import com.ryuqq.metacache.core.model.CacheKey;
import com.ryuqq.metacache.core.model.LoadResult;
import com.ryuqq.metacache.core.model.LoadToken;
import com.ryuqq.metacache.core.spi.Asset;
import com.ryuqq.metacache.core.spi.LoadContext;
import com.ryuqq.metacache.core.spi.LoadCoordinator;
import com.ryuqq.metacache.core.spi.LoaderUnit;
import com.ryuqq.metacache.core.spi.LoaderUnitFactory;
import com.ryuqq.metacache.core.statemachine.LoadState;
import com.ryuqq.metacache.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;

/**
 * 키당 1회 로드를 보장하는 {@link LoadCoordinator} 구현체.
 *
 * <p><strong>Dedup Registry:</strong> {@code CacheKey → LoadTask} 맵을 전용 락으로 보호합니다.
 * 같은 키의 요청은 진행 중인 LoadTask에 구독자로 붙고, 구독자마다 고유한 {@link LoadToken}을 받습니다.</p>
 *
 * <p><strong>LoadTask 생명주기:</strong></p>
 * <pre>
 * PENDING → RUNNING → COMPLETED | FAILED
 * PENDING | RUNNING → CANCELLED (마지막 구독자 이탈 또는 cancelAll)
 * </pre>
 *
 * <p><strong>보장 사항:</strong></p>
 * <ul>
 *   <li>종료 전이 시 registry 제거는 정확히 1회</li>
 *   <li>종료 시점의 구독자 스냅샷 전체에 같은 LoadResult를 completion context에서 전달</li>
 *   <li>실패는 {@link MetadataLoadException}으로 감싸 전달하며 재시도하지 않음</li>
 *   <li>동시 실행 수는 {@link LoadConfig#maxConcurrentLoads()} 이하</li>
 * </ul>
 *
 * <p><strong>타임아웃:</strong> coordinator가 강제하지 않습니다. 적용 타임아웃은
 * {@link LoadContext#timeoutMs()}로 LoaderUnit에 전달되며 마감 처리는 unit의 책임입니다.</p>
 *
 * <p><strong>LoaderUnitFactory:</strong> registry 락 안에서 호출되므로 unit 생성만 하고
 * 실제 I/O는 {@link LoaderUnit#load(LoadContext)}에서 수행해야 합니다.</p>
 *
 * @param <A> asset 타입
 * @param <M> 메타데이터 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BoundedLoadCoordinator<A extends Asset, M> implements LoadCoordinator<A, M>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BoundedLoadCoordinator.class);

    private final LoaderUnitFactory<A, M> factory;
    private final CompletionContext completionContext;
    private final OrderedWorkerPool pool;

    private final ReentrantLock registryLock = new ReentrantLock();
    private final Map<CacheKey, LoadTask> registry = new HashMap<>();
    private boolean closed;

    private volatile LoadConfig config;

    /**
     * 생성자.
     *
     * @param factory asset별 LoaderUnit 생성기
     * @param config 로드 설정
     * @param completionContext 콜백 전달 컨텍스트
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public BoundedLoadCoordinator(
        LoaderUnitFactory<A, M> factory,
        LoadConfig config,
        CompletionContext completionContext
    ) {
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (completionContext == null) {
            throw new IllegalArgumentException("completionContext cannot be null");
        }
        this.factory = factory;
        this.config = config;
        this.completionContext = completionContext;
        this.pool = new OrderedWorkerPool("metacache-loader", config.maxConcurrentLoads());
    }

    @Override
    public LoadToken load(A asset, LoadOptions options, DoubleConsumer progress, Consumer<LoadResult<M>> completion) {
        if (asset == null) {
            if (completion != null) {
                completion.accept(LoadResult.noop());
            }
            return null;
        }
        LoadOptions effective = options == null ? LoadOptions.defaults() : options;
        CacheKey key = asset.cacheKey();
        Subscriber<M> subscriber = new Subscriber<>(UUID.randomUUID(), progress, completion);

        LoadTask task;
        boolean created = false;
        registryLock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("Load coordinator is closed");
            }
            task = registry.get(key);
            if (task == null) {
                LoaderUnit<M> unit = factory.create(asset, effective);
                if (unit == null) {
                    throw new IllegalStateException("LoaderUnitFactory returned no unit for " + key);
                }
                task = new LoadTask(key, unit, effective.effectiveTimeoutMs(config.loadTimeoutMs()));
                registry.put(key, task);
                created = true;
            }
            task.subscribers.put(subscriber.id, subscriber);
        } finally {
            registryLock.unlock();
        }

        if (created) {
            try {
                pool.submit(task, config.executionOrder());
            } catch (IllegalStateException e) {
                abandon(task);
                throw e;
            }
            log.debug("Scheduled load {} for {} ({})", task.unitId, key, config.executionOrder());
        } else {
            log.debug("Attached subscriber to in-flight load {} for {}", task.unitId, key);
        }
        return new LoadToken(key, task.unitId, subscriber.id);
    }

    @Override
    public boolean cancel(LoadToken token) {
        if (token == null) {
            return false;
        }
        LoadTask abandoned = null;
        registryLock.lock();
        try {
            LoadTask task = registry.get(token.key());
            if (task == null || !task.unitId.equals(token.unitId())) {
                return false;
            }
            if (task.subscribers.remove(token.subscriberId()) == null) {
                return false;
            }
            if (task.subscribers.isEmpty()) {
                task.state = StateTransition.transition(task.state, LoadState.CANCELLED);
                registry.remove(task.key, task);
                abandoned = task;
            }
        } finally {
            registryLock.unlock();
        }

        if (abandoned != null) {
            boolean dequeued = pool.remove(abandoned);
            log.debug("Cancelled load {} for {} (dequeued={})", abandoned.unitId, abandoned.key, dequeued);
        }
        return true;
    }

    @Override
    public void cancelAll() {
        List<LoadTask> cancelled;
        registryLock.lock();
        try {
            cancelled = new ArrayList<>(registry.values());
            for (LoadTask task : cancelled) {
                task.state = StateTransition.transition(task.state, LoadState.CANCELLED);
                task.subscribers.clear();
            }
            registry.clear();
        } finally {
            registryLock.unlock();
        }
        cancelled.forEach(pool::remove);
        log.debug("Cancelled {} loads", cancelled.size());
    }

    /**
     * 제출하지 못한 unit을 registry에서 제거. 붙어 있던 구독자에게는 콜백이 가지 않습니다.
     */
    private void abandon(LoadTask task) {
        registryLock.lock();
        try {
            if (task.state == LoadState.PENDING) {
                task.state = StateTransition.transition(task.state, LoadState.CANCELLED);
            }
            task.subscribers.clear();
            registry.remove(task.key, task);
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * 이후 제출되는 unit의 순서 정책 변경. 이미 대기 중인 unit은 재정렬하지 않습니다.
     */
    public void setExecutionOrder(ExecutionOrder executionOrder) {
        config = config.withExecutionOrder(executionOrder);
    }

    /**
     * 동시 실행 수 변경.
     */
    public void setMaxConcurrentLoads(int maxConcurrentLoads) {
        config = config.withMaxConcurrentLoads(maxConcurrentLoads);
        pool.resize(maxConcurrentLoads);
    }

    /**
     * 일시 중지 중에는 대기 unit이 시작되지 않습니다. 실행 중 unit은 계속 진행됩니다.
     */
    public void setSuspended(boolean suspended) {
        pool.setSuspended(suspended);
    }

    public boolean isSuspended() {
        return pool.isSuspended();
    }

    /**
     * 대기 중 + 실행 중인 unit 수.
     */
    public int currentLoadCount() {
        registryLock.lock();
        try {
            return registry.size();
        } finally {
            registryLock.unlock();
        }
    }

    public LoadConfig config() {
        return config;
    }

    /**
     * 모든 unit을 취소하고 작업자 풀을 종료합니다. 이후의 {@link #load}는 {@link IllegalStateException}을 던집니다.
     */
    @Override
    public void close() {
        registryLock.lock();
        try {
            closed = true;
        } finally {
            registryLock.unlock();
        }
        cancelAll();
        pool.close();
    }

    /**
     * 하나의 LoaderUnit 실행과 그 구독자 목록. 상태와 구독자는 registry 락으로 보호됩니다.
     */
    private final class LoadTask implements Runnable, LoadContext {

        private final UUID unitId = UUID.randomUUID();
        private final CacheKey key;
        private final LoaderUnit<M> unit;
        private final long timeoutMs;
        private final Map<UUID, Subscriber<M>> subscribers = new LinkedHashMap<>();
        private LoadState state = LoadState.PENDING;

        private LoadTask(CacheKey key, LoaderUnit<M> unit, long timeoutMs) {
            this.key = key;
            this.unit = unit;
            this.timeoutMs = timeoutMs;
        }

        @Override
        public void run() {
            registryLock.lock();
            try {
                if (state != LoadState.PENDING) {
                    return;
                }
                state = StateTransition.transition(state, LoadState.RUNNING);
            } finally {
                registryLock.unlock();
            }

            LoadResult<M> result = execute();

            List<Subscriber<M>> snapshot;
            registryLock.lock();
            try {
                if (state == LoadState.CANCELLED) {
                    log.debug("Discarding result of cancelled load {} for {}", unitId, key);
                    return;
                }
                state = StateTransition.transition(state, result.isFailure() ? LoadState.FAILED : LoadState.COMPLETED);
                registry.remove(key, this);
                snapshot = new ArrayList<>(subscribers.values());
                subscribers.clear();
            } finally {
                registryLock.unlock();
            }

            if (!snapshot.isEmpty()) {
                completionContext.dispatch(() -> snapshot.forEach(subscriber -> subscriber.complete(result)));
            }
        }

        private LoadResult<M> execute() {
            try {
                M metadata = unit.load(this);
                if (metadata == null) {
                    return LoadResult.failure(
                        new MetadataLoadException(key, new IllegalStateException("loader returned no metadata")));
                }
                return LoadResult.success(metadata);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return LoadResult.failure(new MetadataLoadException(key, e));
            } catch (Exception e) {
                log.debug("Load {} for {} failed", unitId, key, e);
                return LoadResult.failure(new MetadataLoadException(key, e));
            } catch (Error e) {
                log.error("Load {} for {} aborted by {}", unitId, key, e.getClass().getName(), e);
                return LoadResult.failure(new MetadataLoadException(key, e));
            }
        }

        @Override
        public CacheKey key() {
            return key;
        }

        @Override
        public long timeoutMs() {
            return timeoutMs;
        }

        @Override
        public boolean isCancelled() {
            registryLock.lock();
            try {
                return state == LoadState.CANCELLED;
            } finally {
                registryLock.unlock();
            }
        }

        @Override
        public void reportProgress(double fraction) {
            double clamped = Math.max(0.0, Math.min(1.0, fraction));
            List<Subscriber<M>> snapshot;
            registryLock.lock();
            try {
                if (state != LoadState.RUNNING) {
                    return;
                }
                snapshot = new ArrayList<>(subscribers.values());
            } finally {
                registryLock.unlock();
            }
            if (!snapshot.isEmpty()) {
                completionContext.dispatch(() -> snapshot.forEach(subscriber -> subscriber.progress(clamped)));
            }
        }
    }

    private static final class Subscriber<M> {

        private final UUID id;
        private final DoubleConsumer progress;
        private final Consumer<LoadResult<M>> completion;

        private Subscriber(UUID id, DoubleConsumer progress, Consumer<LoadResult<M>> completion) {
            this.id = id;
            this.progress = progress;
            this.completion = completion;
        }

        void progress(double fraction) {
            if (progress != null) {
                progress.accept(fraction);
            }
        }

        void complete(LoadResult<M> result) {
            if (completion != null) {
                completion.accept(result);
            }
        }
    }
}
