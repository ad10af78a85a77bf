/**
 * 메타데이터 캐시 도메인 모델.
 *
 * <p>캐시 키, 계층, 로드/조회 결과 등 불변 값 객체를 포함합니다.</p>
 *
 * <h2>주요 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.metacache.core.model.CacheKey} - Asset 식별자 기반 캐시 키</li>
 *   <li>{@link com.ryuqq.metacache.core.model.CacheTier} - 결과 출처 계층 (NONE, MEMORY, DISK)</li>
 *   <li>{@link com.ryuqq.metacache.core.model.LoadResult} - LoaderUnit 결과 튜플</li>
 *   <li>{@link com.ryuqq.metacache.core.model.LoadToken} - 구독자 취소 핸들</li>
 *   <li>{@link com.ryuqq.metacache.core.model.MetadataResult} - 요청 최종 결과</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.metacache.core.model;
