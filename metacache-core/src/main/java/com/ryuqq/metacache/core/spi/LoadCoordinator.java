package com.ryuqq.metacache.core.spi;

import com.ryuqq.metacache.core.config.LoadOptions;
import com.ryuqq.metacache.core.model.LoadResult;
import com.ryuqq.metacache.core.model.LoadToken;

import java.util.function.Consumer;
import java.util.function.DoubleConsumer;

/**
 * 로드 중복 제거 및 스케줄링 SPI.
 *
 * <p><strong>중복 제거 보장:</strong></p>
 * <ul>
 *   <li>키당 진행 중인 LoaderUnit은 최대 1개</li>
 *   <li>구독자 수와 무관하게 키당 물리적 로드는 1회</li>
 *   <li>같은 unit의 모든 구독자는 같은 결과를 받음</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * LoadToken token = coordinator.load(asset, LoadOptions.defaults(),
 *     progress -&gt; {},
 *     result -&gt; render(result.metadata()));
 *
 * // 더 이상 필요 없으면
 * coordinator.cancel(token);
 * </pre>
 *
 * @param <A> asset 타입
 * @param <M> 메타데이터 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface LoadCoordinator<A extends Asset, M> {

    /**
     * asset 로드 요청 (구독).
     *
     * <p>asset이 null이면 completion을 {@link LoadResult#noop()}으로 동기 호출하고 null을 반환합니다.</p>
     *
     * @param asset 로드 대상 (nullable)
     * @param options 로드 옵션 (null이면 기본값)
     * @param progress 진행률 콜백 (nullable)
     * @param completion 결과 콜백 (nullable)
     * @return 구독 토큰, asset이 null이면 null
     * @throws IllegalStateException unit을 만들거나 예약할 수 없는 경우 (종료된 coordinator 등)
     */
    LoadToken load(A asset, LoadOptions options, DoubleConsumer progress, Consumer<LoadResult<M>> completion);

    /**
     * 구독 취소.
     *
     * <p>해당 구독자만 제거합니다. 다른 구독자가 남아 있으면 unit은 계속 실행됩니다.</p>
     *
     * @param token 구독 토큰 (nullable)
     * @return 이번 호출로 구독자가 제거된 경우 true, 이미 제거되었거나 알 수 없는 토큰이면 false
     */
    boolean cancel(LoadToken token);

    /**
     * 대기 중이거나 실행 중인 모든 unit 취소.
     */
    void cancelAll();
}
