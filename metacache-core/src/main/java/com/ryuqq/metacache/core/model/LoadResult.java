package com.ryuqq.metacache.core.model;

/**
 * 로드 결과 튜플.
 *
 * <p>동일한 LoaderUnit에 붙은 모든 구독자는 같은 LoadResult 인스턴스를 받습니다.</p>
 *
 * <ul>
 *   <li>성공: metadata != null, error == null, finished == true</li>
 *   <li>실패: metadata == null, error != null, finished == true</li>
 *   <li>No-op (asset 없음): 모든 값이 비어 있고 finished == false</li>
 * </ul>
 *
 * @param metadata 로드된 메타데이터 (없으면 null)
 * @param error 로드 오류 (없으면 null)
 * @param finished 최종 결과 여부
 * @param <M> 메타데이터 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record LoadResult<M>(M metadata, Throwable error, boolean finished) {

    /**
     * 성공 결과 생성.
     *
     * @param metadata 로드된 메타데이터
     * @param <M> 메타데이터 타입
     * @return finished=true인 성공 결과
     */
    public static <M> LoadResult<M> success(M metadata) {
        return new LoadResult<>(metadata, null, true);
    }

    /**
     * 실패 결과 생성.
     *
     * @param error 로드 오류
     * @param <M> 메타데이터 타입
     * @return finished=true인 실패 결과
     * @throws IllegalArgumentException error가 null인 경우
     */
    public static <M> LoadResult<M> failure(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return new LoadResult<>(null, error, true);
    }

    /**
     * asset이 없을 때 즉시 전달되는 No-op 결과.
     *
     * @param <M> 메타데이터 타입
     * @return 빈 결과
     */
    public static <M> LoadResult<M> noop() {
        return new LoadResult<>(null, null, false);
    }

    /**
     * 오류 여부 확인.
     *
     * @return error가 있으면 true
     */
    public boolean isFailure() {
        return error != null;
    }
}
