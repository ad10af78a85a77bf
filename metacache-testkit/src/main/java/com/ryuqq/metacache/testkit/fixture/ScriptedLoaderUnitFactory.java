package com.ryuqq.metacache.testkit.fixture;

import com.ryuqq.metacache.core.config.LoadOptions;
import com.ryuqq.metacache.core.spi.LoadContext;
import com.ryuqq.metacache.core.spi.LoaderUnit;
import com.ryuqq.metacache.core.spi.LoaderUnitFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.awaitility.Awaitility.await;

/**
 * Scriptable {@link LoaderUnitFactory} for coordinator and manager tests.
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Counts factory invocations per key</li>
 *   <li>Tracks concurrently running units and the observed peak</li>
 *   <li>Records start and completion order</li>
 *   <li>Holds selected keys on a gate until released</li>
 *   <li>Fails selected keys with a scripted exception</li>
 *   <li>Optionally reports a progress tick before finishing</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ScriptedLoaderUnitFactory factory = new ScriptedLoaderUnitFactory();
 * factory.hold("z");
 * coordinator.load(TestAsset.of("z"), null, null, callback);
 * factory.awaitStarted("z");
 * // ... queue more work while the only worker is busy ...
 * factory.release("z");
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScriptedLoaderUnitFactory implements LoaderUnitFactory<TestAsset, TestMetadata> {

    private static final Duration AWAIT_TIMEOUT = Duration.ofSeconds(5);
    private static final long GATE_TIMEOUT_SECONDS = 10;

    private final Function<TestAsset, TestMetadata> resultFunction;
    private final Map<String, AtomicInteger> createCounts = new ConcurrentHashMap<>();
    private final Map<String, CountDownLatch> gates = new ConcurrentHashMap<>();
    private final Map<String, Exception> failures = new ConcurrentHashMap<>();
    private final List<String> startOrder = new CopyOnWriteArrayList<>();
    private final List<String> completionOrder = new CopyOnWriteArrayList<>();
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger peakRunning = new AtomicInteger();
    private final AtomicInteger totalCreated = new AtomicInteger();
    private final List<Long> observedTimeouts = new CopyOnWriteArrayList<>();
    private volatile long workDurationMs;
    private volatile boolean reportProgress;

    /**
     * Creates a factory whose units return {@code TestMetadata(identifier, 1)}.
     */
    public ScriptedLoaderUnitFactory() {
        this(asset -> new TestMetadata(asset.identifier(), 1));
    }

    public ScriptedLoaderUnitFactory(Function<TestAsset, TestMetadata> resultFunction) {
        if (resultFunction == null) {
            throw new IllegalArgumentException("resultFunction cannot be null");
        }
        this.resultFunction = resultFunction;
    }

    @Override
    public LoaderUnit<TestMetadata> create(TestAsset asset, LoadOptions options) {
        String key = asset.identifier();
        totalCreated.incrementAndGet();
        createCounts.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
        return context -> execute(asset, context);
    }

    private TestMetadata execute(TestAsset asset, LoadContext context) throws Exception {
        String key = asset.identifier();
        int now = running.incrementAndGet();
        peakRunning.accumulateAndGet(now, Math::max);
        startOrder.add(key);
        observedTimeouts.add(context.timeoutMs());
        try {
            CountDownLatch gate = gates.get(key);
            if (gate != null && !gate.await(GATE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                throw new IllegalStateException("gate for " + key + " was never released");
            }
            if (workDurationMs > 0) {
                Thread.sleep(workDurationMs);
            }
            if (reportProgress) {
                context.reportProgress(0.5);
            }
            Exception failure = failures.get(key);
            if (failure != null) {
                throw failure;
            }
            return resultFunction.apply(asset);
        } finally {
            running.decrementAndGet();
            completionOrder.add(key);
        }
    }

    /**
     * Makes units for {@code key} block until {@link #release(String)} is called.
     */
    public ScriptedLoaderUnitFactory hold(String key) {
        gates.put(key, new CountDownLatch(1));
        return this;
    }

    public void release(String key) {
        CountDownLatch gate = gates.get(key);
        if (gate != null) {
            gate.countDown();
        }
    }

    public void releaseAll() {
        gates.values().forEach(CountDownLatch::countDown);
    }

    public ScriptedLoaderUnitFactory failWith(String key, Exception failure) {
        failures.put(key, failure);
        return this;
    }

    public ScriptedLoaderUnitFactory withWorkDuration(long millis) {
        this.workDurationMs = millis;
        return this;
    }

    public ScriptedLoaderUnitFactory withProgressTick() {
        this.reportProgress = true;
        return this;
    }

    public void awaitStarted(String key) {
        await().atMost(AWAIT_TIMEOUT).until(() -> startOrder.contains(key));
    }

    public void awaitCompleted(int count) {
        await().atMost(AWAIT_TIMEOUT).until(() -> completionOrder.size() >= count);
    }

    public int createCount(String key) {
        AtomicInteger count = createCounts.get(key);
        return count == null ? 0 : count.get();
    }

    public int totalCreated() {
        return totalCreated.get();
    }

    public int runningNow() {
        return running.get();
    }

    public int peakRunning() {
        return peakRunning.get();
    }

    public List<String> startOrder() {
        return new ArrayList<>(startOrder);
    }

    public List<String> completionOrder() {
        return new ArrayList<>(completionOrder);
    }

    public List<Long> observedTimeouts() {
        return new ArrayList<>(observedTimeouts);
    }
}
