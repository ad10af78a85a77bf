package com.ryuqq.metacache.core.spi;

import com.ryuqq.metacache.core.model.CacheKey;

/**
 * LoaderUnit 실행 컨텍스트.
 *
 * <p>LoaderUnit은 이 컨텍스트를 통해 진행률을 보고하고 취소 여부를 확인합니다.
 * 취소는 협조적(cooperative)이며, 실행 중인 작업을 강제로 중단하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface LoadContext {

    /**
     * 로드 대상 키.
     *
     * @return 캐시 키
     */
    CacheKey key();

    /**
     * 이 로드에 적용되는 타임아웃 (권고값).
     *
     * @return 타임아웃 (밀리초)
     */
    long timeoutMs();

    /**
     * 모든 구독자가 떠났거나 전체 취소되었는지 확인.
     *
     * @return 취소된 경우 true
     */
    boolean isCancelled();

    /**
     * 진행률 보고.
     *
     * @param fraction 0.0 ~ 1.0 범위의 진행률 (범위를 벗어나면 잘라냄)
     */
    void reportProgress(double fraction);
}
