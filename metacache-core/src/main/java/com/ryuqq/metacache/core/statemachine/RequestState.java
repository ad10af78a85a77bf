package com.ryuqq.metacache.core.statemachine;

/**
 * 메타데이터 요청(CombinedOperation) 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * QUERYING_CACHE ──(hit)──► COMPLETED
 *       │
 *       ├──(miss)──► LOADING ──► COMPLETED
 *       │               └──────► FAILED
 *       └──(asset 없음)─────────► FAILED
 *
 * 비종료 상태 어디서든 ──► CANCELLED
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum RequestState {

    /**
     * 캐시 조회 중.
     */
    QUERYING_CACHE,

    /**
     * 캐시 miss 후 로드 중.
     */
    LOADING,

    /**
     * 결과 전달 완료.
     */
    COMPLETED,

    /**
     * 오류 전달 완료.
     */
    FAILED,

    /**
     * 취소됨 (결과 전달 없음).
     */
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED, FAILED, CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
