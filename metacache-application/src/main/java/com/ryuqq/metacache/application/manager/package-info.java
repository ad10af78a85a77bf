/**
 * 메타데이터 조회 오케스트레이션.
 *
 * <h2>주요 구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.metacache.application.manager.MetadataManager} - 조회 API</li>
 *   <li>{@link com.ryuqq.metacache.application.manager.CachingMetadataManager} - 캐시 우선, miss 시 로드</li>
 *   <li>{@link com.ryuqq.metacache.application.manager.MetadataOperation} - 요청별 취소 핸들</li>
 * </ul>
 *
 * <h2>협력 관계</h2>
 * <pre>
 * CachingMetadataManager
 *   ├─ CacheStore (core.spi)       → 메모리/디스크 조회, 로드 결과 저장
 *   └─ LoadCoordinator (core.spi)  → 키당 1회 로드, 구독 취소
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.metacache.application.manager;
