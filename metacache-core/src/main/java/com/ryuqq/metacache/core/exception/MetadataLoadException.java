package com.ryuqq.metacache.core.exception;

import com.ryuqq.metacache.core.model.CacheKey;

/**
 * LoaderUnit 실패를 감싸는 예외.
 *
 * <p>coordinator는 재시도하지 않습니다. 재시도 정책은 호출자 책임입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class MetadataLoadException extends MetadataCacheException {

    private final CacheKey key;

    public MetadataLoadException(CacheKey key, Throwable cause) {
        super(ErrorCode.LOAD_FAILURE, "Failed to load metadata for " + key + ": " + describe(cause), cause);
        this.key = key;
    }

    public CacheKey getKey() {
        return key;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown cause";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
