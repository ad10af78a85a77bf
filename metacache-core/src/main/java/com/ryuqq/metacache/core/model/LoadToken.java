package com.ryuqq.metacache.core.model;

import java.util.UUID;

/**
 * 로드 요청 핸들.
 *
 * <p>LoaderUnit에 대한 참조를 들고 있지 않습니다. 취소 시 coordinator가
 * {@code key}로 Dedup Registry를 조회하고 {@code unitId}로 동일 unit인지 확인한 뒤
 * {@code subscriberId}에 해당하는 구독자만 제거합니다. unit이 이미 사라졌다면
 * 취소는 실패(false)로 끝납니다.</p>
 *
 * @param key 캐시 키
 * @param unitId 등록 시점의 LoaderUnit 식별자
 * @param subscriberId 구독자 식별자
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record LoadToken(CacheKey key, UUID unitId, UUID subscriberId) {

    public LoadToken {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (unitId == null) {
            throw new IllegalArgumentException("unitId cannot be null");
        }
        if (subscriberId == null) {
            throw new IllegalArgumentException("subscriberId cannot be null");
        }
    }
}
