package com.ryuqq.metacache.core.spi;

/**
 * 취소 가능한 작업 핸들.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Cancellable {

    /**
     * 작업 취소.
     *
     * <p>멱등입니다. 두 번째 호출부터는 아무것도 하지 않고 false를 반환합니다.</p>
     *
     * @return 이번 호출로 취소된 경우 true
     */
    boolean cancel();

    /**
     * 취소 여부 확인.
     *
     * @return 취소된 경우 true
     */
    boolean isCancelled();
}
