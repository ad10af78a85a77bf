package com.ryuqq.metacache.core.statemachine;

/**
 * 상태 전이 검증 및 실행.
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태에서는 어떤 상태로도 전이 불가</li>
 *   <li>역방향 전이 불가 (예: RUNNING → PENDING, LOADING → QUERYING_CACHE)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * LoaderUnit 상태 전이 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(LoadState from, LoadState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case PENDING -> to == LoadState.RUNNING || to == LoadState.CANCELLED;
            case RUNNING -> to == LoadState.COMPLETED || to == LoadState.FAILED || to == LoadState.CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 요청 상태 전이 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(RequestState from, RequestState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case QUERYING_CACHE -> to != RequestState.QUERYING_CACHE;
            case LOADING -> to == RequestState.COMPLETED || to == RequestState.FAILED || to == RequestState.CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * LoaderUnit 상태 전이 실행 (검증 후).
     *
     * @return 전이된 상태 (next)
     */
    public static LoadState transition(LoadState current, LoadState next) {
        validate(current, next);
        return next;
    }

    /**
     * 요청 상태 전이 실행 (검증 후).
     *
     * @return 전이된 상태 (next)
     */
    public static RequestState transition(RequestState current, RequestState next) {
        validate(current, next);
        return next;
    }
}
