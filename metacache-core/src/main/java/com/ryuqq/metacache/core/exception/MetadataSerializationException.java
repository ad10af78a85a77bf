package com.ryuqq.metacache.core.exception;

/**
 * 메타데이터 인코딩/디코딩 실패.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class MetadataSerializationException extends MetadataCacheException {

    public MetadataSerializationException(String message) {
        super(ErrorCode.SERIALIZATION_FAILURE, message, null);
    }

    public MetadataSerializationException(String message, Throwable cause) {
        super(ErrorCode.SERIALIZATION_FAILURE, message, cause);
    }
}
