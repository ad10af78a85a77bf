package com.ryuqq.metacache.application.manager;

import com.ryuqq.metacache.core.model.LoadToken;
import com.ryuqq.metacache.core.spi.Cancellable;
import com.ryuqq.metacache.core.spi.LoadCoordinator;
import com.ryuqq.metacache.core.statemachine.RequestState;
import com.ryuqq.metacache.core.statemachine.StateTransition;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * 캐시 조회와 로드를 하나로 묶은 요청 단위 작업.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * QUERYING_CACHE → COMPLETED (cache hit)
 * QUERYING_CACHE → LOADING → COMPLETED | FAILED
 * (비종료 상태) → CANCELLED
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>상태, 캐시 조회 핸들, 로드 토큰은 하나의 락으로 보호</li>
 *   <li>취소와 결과 전달은 같은 락 안에서 종료 상태를 선점하므로 둘 중 하나만 성공</li>
 *   <li>Running Set 제거는 어떤 경로로 종료되든 정확히 1회</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class CombinedOperation implements MetadataOperation {

    private final ReentrantLock lock = new ReentrantLock();
    private final LoadCoordinator<?, ?> coordinator;
    private final Consumer<CombinedOperation> release;
    private final AtomicBoolean released = new AtomicBoolean(false);

    private RequestState state = RequestState.QUERYING_CACHE;
    private Cancellable cacheQuery;
    private LoadToken loadToken;

    /**
     * @param coordinator 로드 토큰 취소에 사용할 coordinator
     * @param release Running Set에서 제거하는 콜백 (정확히 1회 호출)
     */
    CombinedOperation(LoadCoordinator<?, ?> coordinator, Consumer<CombinedOperation> release) {
        this.coordinator = coordinator;
        this.release = release;
    }

    @Override
    public boolean cancel() {
        lock.lock();
        try {
            if (state.isTerminal()) {
                return false;
            }
            state = StateTransition.transition(state, RequestState.CANCELLED);
            if (cacheQuery != null) {
                cacheQuery.cancel();
                cacheQuery = null;
            }
            if (loadToken != null) {
                coordinator.cancel(loadToken);
                loadToken = null;
            }
            releaseOnce();
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isCancelled() {
        return state() == RequestState.CANCELLED;
    }

    @Override
    public RequestState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 캐시 조회 핸들 연결. 이미 취소되었으면 핸들을 바로 취소합니다.
     */
    void attachCacheQuery(Cancellable handle) {
        if (handle == null) {
            return;
        }
        lock.lock();
        try {
            if (state == RequestState.CANCELLED) {
                handle.cancel();
            } else if (!state.isTerminal()) {
                cacheQuery = handle;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 캐시 miss 후 로드 단계 진입.
     *
     * @return 진입했으면 true, 이미 종료(취소 포함)되었으면 false
     */
    boolean beginLoading() {
        lock.lock();
        try {
            if (state.isTerminal()) {
                return false;
            }
            state = StateTransition.transition(state, RequestState.LOADING);
            cacheQuery = null;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * coordinator 토큰 연결. 이미 취소되었으면 토큰을 바로 취소합니다.
     */
    void attachLoadToken(LoadToken token) {
        if (token == null) {
            return;
        }
        lock.lock();
        try {
            if (state == RequestState.CANCELLED) {
                coordinator.cancel(token);
            } else if (!state.isTerminal()) {
                loadToken = token;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 종료 상태 선점.
     *
     * @param terminal COMPLETED 또는 FAILED
     * @return 이번 호출로 종료되었으면 true (결과 전달 가능), 이미 종료/취소되었으면 false
     */
    boolean complete(RequestState terminal) {
        lock.lock();
        try {
            if (state.isTerminal()) {
                return false;
            }
            state = StateTransition.transition(state, terminal);
            cacheQuery = null;
            loadToken = null;
            releaseOnce();
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void releaseOnce() {
        if (released.compareAndSet(false, true)) {
            release.accept(this);
        }
    }
}
