/**
 * 메타데이터 캐시 예외 계층.
 *
 * <p>{@link com.ryuqq.metacache.core.exception.MetadataCacheException}을 최상위로 하는
 * unchecked 예외입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.metacache.core.exception;
