package com.ryuqq.metacache.core.exception;

/**
 * asset 없이 메타데이터를 요청한 경우.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class AssetNotFoundException extends MetadataCacheException {

    public AssetNotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message, null);
    }
}
