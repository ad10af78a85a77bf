package com.ryuqq.metacache.testkit.fixture;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import static org.awaitility.Awaitility.await;

/**
 * Consumer that records every value it receives and the thread it ran on.
 *
 * @param <T> value type
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RecordingCallback<T> implements Consumer<T> {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final List<T> values = new CopyOnWriteArrayList<>();
    private final List<String> threadNames = new CopyOnWriteArrayList<>();

    @Override
    public void accept(T value) {
        threadNames.add(Thread.currentThread().getName());
        values.add(value);
    }

    /**
     * Waits until at least {@code count} values arrived and returns a snapshot.
     */
    public List<T> awaitCount(int count) {
        await().atMost(DEFAULT_TIMEOUT).until(() -> values.size() >= count);
        return new ArrayList<>(values);
    }

    /**
     * Waits for the first value.
     */
    public T awaitFirst() {
        return awaitCount(1).get(0);
    }

    public List<T> values() {
        return new ArrayList<>(values);
    }

    public List<String> threadNames() {
        return new ArrayList<>(threadNames);
    }

    public int count() {
        return values.size();
    }
}
