package com.ryuqq.metacache.core.executor;

/**
 * 호출 스레드에서 콜백을 즉시 실행.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class DirectCompletionContext implements CompletionContext {

    static final DirectCompletionContext INSTANCE = new DirectCompletionContext();

    private DirectCompletionContext() {
    }

    @Override
    public void dispatch(Runnable callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        callback.run();
    }

    @Override
    public boolean isCurrent() {
        return true;
    }

    @Override
    public String toString() {
        return "CompletionContext{direct}";
    }
}
