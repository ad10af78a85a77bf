package com.ryuqq.metacache.core.config;

/**
 * 요청 단위 로드 옵션.
 *
 * @param timeoutMs 이 요청에 적용할 타임아웃 (밀리초, 0이면 coordinator 기본값 사용)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record LoadOptions(long timeoutMs) {

    private static final LoadOptions DEFAULTS = new LoadOptions(0);

    public LoadOptions {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs cannot be negative (current: " + timeoutMs + ")");
        }
    }

    /**
     * 기본 옵션 (coordinator 설정을 그대로 따름).
     */
    public static LoadOptions defaults() {
        return DEFAULTS;
    }

    /**
     * 실제 적용할 타임아웃 계산.
     *
     * @param fallbackMs 옵션에 값이 없을 때 사용할 기본값
     * @return 적용 타임아웃 (밀리초)
     */
    public long effectiveTimeoutMs(long fallbackMs) {
        return timeoutMs > 0 ? timeoutMs : fallbackMs;
    }
}
