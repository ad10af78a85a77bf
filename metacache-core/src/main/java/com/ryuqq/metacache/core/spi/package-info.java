/**
 * 메타데이터 캐시 SPI (Service Provider Interface).
 *
 * <h2>외부 제공 capability</h2>
 * <ul>
 *   <li>{@link com.ryuqq.metacache.core.spi.Asset} - 안정적인 식별자</li>
 *   <li>{@link com.ryuqq.metacache.core.spi.MetadataCodec} - 메타데이터 인코딩/디코딩</li>
 *   <li>{@link com.ryuqq.metacache.core.spi.LoaderUnitFactory} - asset별 로드 전략</li>
 * </ul>
 *
 * <h2>어댑터 구현 대상</h2>
 * <ul>
 *   <li>{@link com.ryuqq.metacache.core.spi.CacheStore} - 2계층 캐시</li>
 *   <li>{@link com.ryuqq.metacache.core.spi.LoadCoordinator} - 로드 중복 제거/스케줄링</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.metacache.core.spi;
