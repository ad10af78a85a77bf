package com.ryuqq.metacache.core.executor;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * 전용 단일 스레드에서 콜백을 순차 실행하는 컨텍스트.
 *
 * <p>스레드는 daemon이며 이름은 생성 시 지정한 값을 사용합니다.
 * 콜백이 예외를 던지면 스레드가 교체되고 이후 콜백은 새 스레드에서 계속 실행됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SerialCompletionContext implements CompletionContext, AutoCloseable {

    private static final String DEFAULT_THREAD_NAME = "metacache-completion";

    private final ExecutorService executor;
    private volatile Thread thread;

    /**
     * 기본 스레드 이름(metacache-completion)으로 생성.
     */
    public SerialCompletionContext() {
        this(DEFAULT_THREAD_NAME);
    }

    /**
     * 스레드 이름 지정 생성자.
     *
     * @param threadName 스레드 이름
     * @throws IllegalArgumentException threadName이 null이거나 빈 문자열인 경우
     */
    public SerialCompletionContext(String threadName) {
        if (threadName == null || threadName.isBlank()) {
            throw new IllegalArgumentException("threadName cannot be null or blank");
        }
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread t = new Thread(runnable, threadName);
            t.setDaemon(true);
            this.thread = t;
            return t;
        });
    }

    @Override
    public void dispatch(Runnable callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        if (isCurrent()) {
            callback.run();
            return;
        }
        executor.execute(callback);
    }

    @Override
    public boolean isCurrent() {
        return Thread.currentThread() == thread;
    }

    /**
     * 컨텍스트 종료.
     *
     * <p>이미 전달된 콜백은 최대 5초까지 실행을 기다립니다.</p>
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
