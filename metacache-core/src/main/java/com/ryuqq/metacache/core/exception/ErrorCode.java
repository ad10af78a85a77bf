package com.ryuqq.metacache.core.exception;

/**
 * 메타데이터 캐시 오류 코드.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ErrorCode {

    /**
     * 요청한 asset이 없음.
     */
    NOT_FOUND("META-404"),

    /**
     * LoaderUnit이 오류를 보고함.
     */
    LOAD_FAILURE("META-500"),

    /**
     * 메타데이터 인코딩/디코딩 실패.
     */
    SERIALIZATION_FAILURE("META-422"),

    /**
     * 디스크 캐시 디렉토리를 사용할 수 없음.
     */
    PERSISTENCE_UNAVAILABLE("META-503");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
