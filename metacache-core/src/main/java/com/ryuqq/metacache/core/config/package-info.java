/**
 * 캐시 및 로더 설정.
 *
 * <p>모든 설정은 불변 record이며 compact constructor에서 검증합니다.
 * 값 변경은 {@code withXxx()}로 새 인스턴스를 만들어 수행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.metacache.core.config;
