package com.ryuqq.metacache.core.exception;

/**
 * 메타데이터 캐시 예외 최상위 타입.
 *
 * <p>모든 하위 예외는 {@link ErrorCode}를 가지며 unchecked입니다.
 * 취소는 예외로 표현하지 않습니다 (콜백 자체가 호출되지 않음).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class MetadataCacheException extends RuntimeException {

    private final ErrorCode errorCode;

    protected MetadataCacheException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        this.errorCode = errorCode;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드
     */
    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
