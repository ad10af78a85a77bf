package com.ryuqq.metacache.core.exception;

/**
 * 디스크 캐시 디렉토리 생성 실패.
 *
 * <p>캐시 생성 시점에 발생하며 복구할 수 없는 오류로 취급합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class PersistenceUnavailableException extends MetadataCacheException {

    public PersistenceUnavailableException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE_UNAVAILABLE, message, cause);
    }
}
