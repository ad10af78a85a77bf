package com.ryuqq.metacache.application.manager;

import com.ryuqq.metacache.core.spi.Cancellable;
import com.ryuqq.metacache.core.statemachine.RequestState;

/**
 * 메타데이터 요청 1건에 대한 취소 가능한 핸들.
 *
 * <p>취소 이후에는 캐시 조회나 로드가 나중에 끝나더라도 completion 콜백이 호출되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface MetadataOperation extends Cancellable {

    /**
     * 현재 요청 상태.
     *
     * @return 요청 상태
     */
    RequestState state();
}
