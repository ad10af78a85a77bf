package com.ryuqq.metacache.testkit.contract;

import com.ryuqq.metacache.core.config.ExecutionOrder;
import com.ryuqq.metacache.core.config.LoadConfig;
import com.ryuqq.metacache.core.config.LoadOptions;
import com.ryuqq.metacache.core.exception.MetadataLoadException;
import com.ryuqq.metacache.core.model.LoadResult;
import com.ryuqq.metacache.core.model.LoadToken;
import com.ryuqq.metacache.core.spi.LoadCoordinator;
import com.ryuqq.metacache.testkit.fixture.RecordingCallback;
import com.ryuqq.metacache.testkit.fixture.ScriptedLoaderUnitFactory;
import com.ryuqq.metacache.testkit.fixture.TestAsset;
import com.ryuqq.metacache.testkit.fixture.TestMetadata;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for {@link LoadCoordinator} implementations.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Deduplication: one physical load per key, same result for every subscriber</li>
 *   <li>Concurrency bound and FIFO/LIFO start order</li>
 *   <li>Per-subscriber cancellation and cancelAll</li>
 *   <li>Failures delivered once, never retried</li>
 *   <li>Null asset, timeout hand-off, progress fan-out</li>
 * </ul>
 *
 * <p>Coordinators implementing {@link AutoCloseable} are closed after each test.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractLoadCoordinatorContractTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    protected ScriptedLoaderUnitFactory factory;
    private final List<LoadCoordinator<TestAsset, TestMetadata>> created = new ArrayList<>();

    /**
     * Creates a coordinator that builds its units with the given factory.
     */
    protected abstract LoadCoordinator<TestAsset, TestMetadata> createCoordinator(
        ScriptedLoaderUnitFactory factory,
        LoadConfig config
    );

    @BeforeEach
    void setUpFactory() {
        factory = new ScriptedLoaderUnitFactory();
    }

    @AfterEach
    void tearDownCoordinators() throws Exception {
        factory.releaseAll();
        for (LoadCoordinator<TestAsset, TestMetadata> coordinator : created) {
            if (coordinator instanceof AutoCloseable) {
                ((AutoCloseable) coordinator).close();
            }
        }
        created.clear();
    }

    protected LoadCoordinator<TestAsset, TestMetadata> coordinator(LoadConfig config) {
        LoadCoordinator<TestAsset, TestMetadata> coordinator = createCoordinator(factory, config);
        created.add(coordinator);
        return coordinator;
    }

    @Test
    void testDedup_ConcurrentRequestsSameKey_LoadsOnce() {
        // Given
        LoadCoordinator<TestAsset, TestMetadata> coordinator = coordinator(new LoadConfig());
        factory.hold("x");
        List<RecordingCallback<LoadResult<TestMetadata>>> callbacks = new ArrayList<>();

        // When
        for (int i = 0; i < 5; i++) {
            RecordingCallback<LoadResult<TestMetadata>> callback = new RecordingCallback<>();
            callbacks.add(callback);
            assertNotNull(coordinator.load(TestAsset.of("x"), LoadOptions.defaults(), null, callback));
        }
        factory.awaitStarted("x");
        factory.release("x");

        // Then
        LoadResult<TestMetadata> first = callbacks.get(0).awaitFirst();
        for (RecordingCallback<LoadResult<TestMetadata>> callback : callbacks) {
            assertEquals(first, callback.awaitFirst());
        }
        assertEquals(1, factory.createCount("x"));
        assertEquals(new TestMetadata("x", 1), first.metadata());
        assertNull(first.error());
        assertTrue(first.finished());
    }

    @Test
    void testDedup_TokensShareUnitButNotSubscriber() {
        // Given
        LoadCoordinator<TestAsset, TestMetadata> coordinator = coordinator(new LoadConfig());
        factory.hold("x");

        // When
        LoadToken first = coordinator.load(TestAsset.of("x"), null, null, null);
        LoadToken second = coordinator.load(TestAsset.of("x"), null, null, null);

        // Then
        assertEquals(first.unitId(), second.unitId());
        assertNotEquals(first.subscriberId(), second.subscriberId());
    }

    @Test
    void testRegistry_CompletedKeyLoadsAgain() {
        // Given
        LoadCoordinator<TestAsset, TestMetadata> coordinator = coordinator(new LoadConfig());
        RecordingCallback<LoadResult<TestMetadata>> firstCallback = new RecordingCallback<>();
        coordinator.load(TestAsset.of("x"), null, null, firstCallback);
        firstCallback.awaitFirst();

        // When
        RecordingCallback<LoadResult<TestMetadata>> secondCallback = new RecordingCallback<>();
        coordinator.load(TestAsset.of("x"), null, null, secondCallback);

        // Then
        secondCallback.awaitFirst();
        assertEquals(2, factory.createCount("x"));
    }

    @Test
    void testConcurrency_NeverExceedsMaxConcurrentLoads() {
        // Given
        int limit = 2;
        LoadCoordinator<TestAsset, TestMetadata> coordinator =
            coordinator(new LoadConfig().withMaxConcurrentLoads(limit));
        factory.withWorkDuration(30);
        RecordingCallback<LoadResult<TestMetadata>> callback = new RecordingCallback<>();

        // When
        for (int i = 0; i < 8; i++) {
            coordinator.load(TestAsset.of("k" + i), null, null, callback);
        }

        // Then
        callback.awaitCount(8);
        assertTrue(factory.peakRunning() <= limit, "peak was " + factory.peakRunning());
        assertEquals(8, factory.totalCreated());
    }

    @Test
    void testOrdering_Lifo_StartsMostRecentFirst() {
        // Given
        LoadCoordinator<TestAsset, TestMetadata> coordinator = coordinator(
            new LoadConfig().withMaxConcurrentLoads(1).withExecutionOrder(ExecutionOrder.LIFO));
        factory.hold("z");
        coordinator.load(TestAsset.of("z"), null, null, null);
        factory.awaitStarted("z");

        // When
        coordinator.load(TestAsset.of("a"), null, null, null);
        coordinator.load(TestAsset.of("b"), null, null, null);
        coordinator.load(TestAsset.of("c"), null, null, null);
        factory.release("z");

        // Then
        factory.awaitCompleted(4);
        assertEquals(List.of("z", "c", "b", "a"), factory.startOrder());
    }

    @Test
    void testOrdering_Fifo_StartsInSubmissionOrder() {
        // Given
        LoadCoordinator<TestAsset, TestMetadata> coordinator =
            coordinator(new LoadConfig().withMaxConcurrentLoads(1));
        factory.hold("z");
        coordinator.load(TestAsset.of("z"), null, null, null);
        factory.awaitStarted("z");

        // When
        coordinator.load(TestAsset.of("a"), null, null, null);
        coordinator.load(TestAsset.of("b"), null, null, null);
        coordinator.load(TestAsset.of("c"), null, null, null);
        factory.release("z");

        // Then
        factory.awaitCompleted(4);
        assertEquals(List.of("z", "a", "b", "c"), factory.startOrder());
    }

    @Test
    void testCancel_SecondCancelReturnsFalse() {
        // Given
        LoadCoordinator<TestAsset, TestMetadata> coordinator = coordinator(new LoadConfig());
        factory.hold("x");
        LoadToken token = coordinator.load(TestAsset.of("x"), null, null, null);

        // When
        boolean first = coordinator.cancel(token);
        boolean second = coordinator.cancel(token);

        // Then
        assertTrue(first);
        assertFalse(second);
        assertFalse(coordinator.cancel(null));
    }

    @Test
    void testCancel_QueuedSoleSubscriber_UnitNeverStartsAndNoCallback() {
        // Given
        LoadCoordinator<TestAsset, TestMetadata> coordinator =
            coordinator(new LoadConfig().withMaxConcurrentLoads(1));
        factory.hold("blocker");
        coordinator.load(TestAsset.of("blocker"), null, null, null);
        factory.awaitStarted("blocker");
        RecordingCallback<LoadResult<TestMetadata>> cancelled = new RecordingCallback<>();
        LoadToken token = coordinator.load(TestAsset.of("x"), null, null, cancelled);

        // When
        assertTrue(coordinator.cancel(token));
        factory.release("blocker");
        RecordingCallback<LoadResult<TestMetadata>> after = new RecordingCallback<>();
        coordinator.load(TestAsset.of("after"), null, null, after);

        // Then
        after.awaitFirst();
        assertFalse(factory.startOrder().contains("x"));
        assertEquals(0, cancelled.count());
    }

    @Test
    void testCancel_OneOfManySubscribers_OthersStillReceiveResult() {
        // Given
        LoadCoordinator<TestAsset, TestMetadata> coordinator = coordinator(new LoadConfig());
        factory.hold("x");
        RecordingCallback<LoadResult<TestMetadata>> leaving = new RecordingCallback<>();
        RecordingCallback<LoadResult<TestMetadata>> staying = new RecordingCallback<>();
        LoadToken leavingToken = coordinator.load(TestAsset.of("x"), null, null, leaving);
        coordinator.load(TestAsset.of("x"), null, null, staying);

        // When
        assertTrue(coordinator.cancel(leavingToken));
        factory.release("x");

        // Then
        assertEquals(new TestMetadata("x", 1), staying.awaitFirst().metadata());
        assertEquals(0, leaving.count());
        assertEquals(1, factory.createCount("x"));
    }

    @Test
    void testCancelAll_QueuedUnitsNeverStart() {
        // Given
        LoadCoordinator<TestAsset, TestMetadata> coordinator =
            coordinator(new LoadConfig().withMaxConcurrentLoads(1));
        factory.hold("blocker");
        RecordingCallback<LoadResult<TestMetadata>> cancelled = new RecordingCallback<>();
        coordinator.load(TestAsset.of("blocker"), null, null, cancelled);
        factory.awaitStarted("blocker");
        coordinator.load(TestAsset.of("a"), null, null, cancelled);
        coordinator.load(TestAsset.of("b"), null, null, cancelled);

        // When
        coordinator.cancelAll();
        factory.release("blocker");
        RecordingCallback<LoadResult<TestMetadata>> after = new RecordingCallback<>();
        coordinator.load(TestAsset.of("c"), null, null, after);

        // Then
        after.awaitFirst();
        assertEquals(List.of("blocker", "c"), factory.startOrder());
        assertEquals(0, cancelled.count());
    }

    @Test
    void testFailure_DeliveredOnceAndNotRetried() {
        // Given
        LoadCoordinator<TestAsset, TestMetadata> coordinator = coordinator(new LoadConfig());
        factory.failWith("bad", new IOException("boom"));
        RecordingCallback<LoadResult<TestMetadata>> callback = new RecordingCallback<>();

        // When
        coordinator.load(TestAsset.of("bad"), null, null, callback);

        // Then
        LoadResult<TestMetadata> result = callback.awaitFirst();
        assertNull(result.metadata());
        assertTrue(result.finished());
        assertInstanceOf(MetadataLoadException.class, result.error());
        assertInstanceOf(IOException.class, result.error().getCause());
        factory.awaitCompleted(1);
        assertEquals(1, factory.createCount("bad"));
        assertEquals(1, callback.count());
    }

    @Test
    void testFailure_LoaderReturningNull_DeliveredAsError() {
        // Given
        factory = new ScriptedLoaderUnitFactory(asset -> null);
        LoadCoordinator<TestAsset, TestMetadata> coordinator = coordinator(new LoadConfig());
        RecordingCallback<LoadResult<TestMetadata>> callback = new RecordingCallback<>();

        // When
        coordinator.load(TestAsset.of("empty"), null, null, callback);

        // Then
        LoadResult<TestMetadata> result = callback.awaitFirst();
        assertNull(result.metadata());
        assertInstanceOf(MetadataLoadException.class, result.error());
    }

    @Test
    void testNullAsset_CompletesSynchronouslyWithNoop() {
        // Given
        LoadCoordinator<TestAsset, TestMetadata> coordinator = coordinator(new LoadConfig());
        List<LoadResult<TestMetadata>> results = new ArrayList<>();

        // When
        LoadToken token = coordinator.load(null, null, null, results::add);

        // Then
        assertNull(token);
        assertEquals(List.of(LoadResult.<TestMetadata>noop()), results);
        assertEquals(0, factory.totalCreated());
    }

    @Test
    void testTimeout_HandedToUnit() {
        // Given
        LoadCoordinator<TestAsset, TestMetadata> coordinator =
            coordinator(new LoadConfig().withLoadTimeoutMs(2_000));
        RecordingCallback<LoadResult<TestMetadata>> callback = new RecordingCallback<>();

        // When
        coordinator.load(TestAsset.of("default"), LoadOptions.defaults(), null, callback);
        coordinator.load(TestAsset.of("override"), new LoadOptions(500), null, callback);

        // Then
        callback.awaitCount(2);
        assertTrue(factory.observedTimeouts().contains(2_000L));
        assertTrue(factory.observedTimeouts().contains(500L));
    }

    @Test
    void testProgress_FannedOutToEverySubscriber() {
        // Given
        LoadCoordinator<TestAsset, TestMetadata> coordinator = coordinator(new LoadConfig());
        factory.withProgressTick().hold("x");
        List<Double> firstTicks = new CopyOnWriteArrayList<>();
        List<Double> secondTicks = new CopyOnWriteArrayList<>();
        RecordingCallback<LoadResult<TestMetadata>> callback = new RecordingCallback<>();

        // When
        coordinator.load(TestAsset.of("x"), null, firstTicks::add, callback);
        coordinator.load(TestAsset.of("x"), null, secondTicks::add, callback);
        factory.release("x");

        // Then
        callback.awaitCount(2);
        await().atMost(WAIT).until(() -> !firstTicks.isEmpty() && !secondTicks.isEmpty());
        assertEquals(List.of(0.5), firstTicks);
        assertEquals(List.of(0.5), secondTicks);
    }
}
