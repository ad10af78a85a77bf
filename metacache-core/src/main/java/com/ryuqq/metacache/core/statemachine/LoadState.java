package com.ryuqq.metacache.core.statemachine;

/**
 * LoaderUnit 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING ──► RUNNING ──► COMPLETED
 *    │           ├──────► FAILED
 *    │           └──────► CANCELLED
 *    └──────────────────► CANCELLED
 * </pre>
 *
 * <p>CANCELLED는 결과가 만들어지기 전에 모든 구독자가 떠난 경우에만 도달합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum LoadState {

    /**
     * worker 슬롯 대기 중.
     */
    PENDING,

    /**
     * 실행 중.
     */
    RUNNING,

    /**
     * 메타데이터 로드 성공.
     */
    COMPLETED,

    /**
     * 로드 실패.
     */
    FAILED,

    /**
     * 결과 생성 전에 전부 취소됨.
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
