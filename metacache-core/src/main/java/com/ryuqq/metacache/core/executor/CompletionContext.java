package com.ryuqq.metacache.core.executor;

/**
 * 콜백 전달 컨텍스트.
 *
 * <p>캐시, coordinator, manager의 모든 completion 콜백은 하나의 지정된 컨텍스트에서
 * 실행됩니다. 콜백 간 순서는 제출 순서가 아니라 전달 순서를 따릅니다.</p>
 *
 * <p><strong>구현체:</strong></p>
 * <ul>
 *   <li>{@link SerialCompletionContext} - 전용 단일 스레드 (UI 메인 스레드에 해당)</li>
 *   <li>{@link #direct()} - 호출한 스레드에서 즉시 실행 (테스트용)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CompletionContext {

    /**
     * 콜백 전달.
     *
     * <p>이미 이 컨텍스트 위에서 호출된 경우 즉시 실행하고, 아니면 비동기로 넘깁니다.</p>
     *
     * @param callback 실행할 콜백
     * @throws IllegalArgumentException callback이 null인 경우
     */
    void dispatch(Runnable callback);

    /**
     * 현재 스레드가 이 컨텍스트인지 확인.
     *
     * @return 현재 스레드에서 실행 중이면 true
     */
    boolean isCurrent();

    /**
     * 호출한 스레드에서 즉시 실행하는 컨텍스트.
     *
     * @return inline 컨텍스트
     */
    static CompletionContext direct() {
        return DirectCompletionContext.INSTANCE;
    }
}
