package com.ryuqq.metacache.application.manager;

import com.ryuqq.metacache.core.model.CacheKey;
import com.ryuqq.metacache.core.model.MetadataResult;
import com.ryuqq.metacache.core.spi.Asset;

import java.util.function.Consumer;
import java.util.function.DoubleConsumer;

/**
 * 메타데이터 조회 진입점.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <ol>
 *   <li>2계층 캐시 조회</li>
 *   <li>hit이면 해당 계층(MEMORY/DISK)과 함께 전달</li>
 *   <li>miss이면 LoadCoordinator로 로드 (키당 1회로 중복 제거)</li>
 *   <li>로드 성공 시 메모리/디스크에 저장 후 계층 NONE으로 전달</li>
 * </ol>
 *
 * <p><strong>콜백 규칙:</strong></p>
 * <ul>
 *   <li>모든 콜백은 지정된 completion context에서 호출</li>
 *   <li>요청당 completion은 최대 1회</li>
 *   <li>취소된 요청의 completion은 호출되지 않음</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * MetadataOperation operation = manager.loadMetadata(asset, MetadataRequestOptions.defaults(),
 *     progress -&gt; updateBar(progress),
 *     result -&gt; {
 *         if (result.isSuccess()) {
 *             render(result.metadata(), result.tier());
 *         }
 *     });
 *
 * // 화면을 벗어나면
 * operation.cancel();
 * </pre>
 *
 * @param <A> asset 타입
 * @param <M> 메타데이터 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface MetadataManager<A extends Asset, M> {

    /**
     * 메타데이터 조회 (캐시 우선, 없으면 로드).
     *
     * <p>asset이 null이면 {@link com.ryuqq.metacache.core.exception.AssetNotFoundException}을
     * 오류로 전달하고 종료합니다.</p>
     *
     * @param asset 조회 대상 (nullable)
     * @param options 요청 옵션 (null이면 기본값)
     * @param progress 로드 진행률 콜백 (nullable)
     * @param completion 결과 콜백 (nullable)
     * @return 취소 핸들
     */
    MetadataOperation loadMetadata(
        A asset,
        MetadataRequestOptions options,
        DoubleConsumer progress,
        Consumer<MetadataResult<A, M>> completion
    );

    /**
     * 기본 옵션, 진행률 콜백 없이 조회.
     */
    default MetadataOperation loadMetadata(A asset, Consumer<MetadataResult<A, M>> completion) {
        return loadMetadata(asset, MetadataRequestOptions.defaults(), null, completion);
    }

    /**
     * 로드 없이 캐시에 직접 저장 (메모리 + 디스크).
     *
     * <p>asset 또는 metadata가 null이면 아무 것도 하지 않습니다.</p>
     *
     * @param asset 대상 asset
     * @param metadata 저장할 메타데이터
     * @param onDone 디스크 기록 완료 콜백 (nullable)
     */
    void saveMetadata(A asset, M metadata, Runnable onDone);

    default void saveMetadata(A asset, M metadata) {
        saveMetadata(asset, metadata, null);
    }

    /**
     * 캐시에서 제거.
     *
     * @param asset 대상 asset (null이면 무시)
     * @param fromDisk 디스크에서도 제거할지 여부
     * @param onDone 완료 콜백 (nullable)
     */
    void removeMetadata(A asset, boolean fromDisk, Runnable onDone);

    /**
     * 실행 중인 모든 요청 취소.
     */
    void cancelAll();

    /**
     * 실행 중인 요청이 1건 이상인지 확인.
     */
    boolean isRunning();

    /**
     * 실행 중인 요청 수.
     */
    int runningCount();

    /**
     * 메모리 또는 디스크 캐시 존재 여부 비동기 확인.
     *
     * <p>메모리 hit이면 디스크를 확인하지 않습니다.</p>
     *
     * @param asset 대상 asset (null이면 false)
     * @param callback 결과 콜백
     */
    void cachedMetadataExists(A asset, Consumer<Boolean> callback);

    /**
     * 디스크 캐시 존재 여부 비동기 확인.
     *
     * @param asset 대상 asset (null이면 false)
     * @param callback 결과 콜백
     */
    void diskMetadataExists(A asset, Consumer<Boolean> callback);

    /**
     * asset의 캐시 키.
     *
     * @param asset 대상 asset
     * @return 캐시 키, asset이 null이면 null
     */
    CacheKey cacheKey(A asset);
}
