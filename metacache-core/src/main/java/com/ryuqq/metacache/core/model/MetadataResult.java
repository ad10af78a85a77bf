package com.ryuqq.metacache.core.model;

/**
 * 메타데이터 요청 최종 결과.
 *
 * <p>MetadataManager가 completion handler로 전달하는 값입니다.</p>
 *
 * @param metadata 메타데이터 (없으면 null)
 * @param error 오류 (없으면 null)
 * @param tier 결과 출처 계층 (새로 로드된 경우 {@link CacheTier#NONE})
 * @param finished 최종 결과 여부 (진행 중 틱이면 false)
 * @param asset 요청한 asset (asset이 없던 요청이면 null)
 * @param <A> asset 타입
 * @param <M> 메타데이터 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record MetadataResult<A, M>(M metadata, Throwable error, CacheTier tier, boolean finished, A asset) {

    public MetadataResult {
        if (tier == null) {
            throw new IllegalArgumentException("tier cannot be null");
        }
    }

    public static <A, M> MetadataResult<A, M> cached(M metadata, CacheTier tier, A asset) {
        return new MetadataResult<>(metadata, null, tier, true, asset);
    }

    public static <A, M> MetadataResult<A, M> loaded(M metadata, boolean finished, A asset) {
        return new MetadataResult<>(metadata, null, CacheTier.NONE, finished, asset);
    }

    public static <A, M> MetadataResult<A, M> failed(Throwable error, A asset) {
        return new MetadataResult<>(null, error, CacheTier.NONE, true, asset);
    }

    /**
     * 성공 여부 확인.
     *
     * @return 오류가 없고 메타데이터가 있으면 true
     */
    public boolean isSuccess() {
        return error == null && metadata != null;
    }
}
