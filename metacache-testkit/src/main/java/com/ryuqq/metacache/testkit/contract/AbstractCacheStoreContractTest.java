package com.ryuqq.metacache.testkit.contract;

import com.ryuqq.metacache.core.config.CacheConfig;
import com.ryuqq.metacache.core.config.CacheQueryOption;
import com.ryuqq.metacache.core.model.CacheKey;
import com.ryuqq.metacache.core.model.CacheQueryResult;
import com.ryuqq.metacache.core.model.CacheTier;
import com.ryuqq.metacache.core.spi.CacheStore;
import com.ryuqq.metacache.core.spi.Cancellable;
import com.ryuqq.metacache.testkit.fixture.RecordingCallback;
import com.ryuqq.metacache.testkit.fixture.TestMetadata;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for {@link CacheStore} implementations.
 *
 * <p>Adapters extend this class and provide a store built from the given configuration.
 * Every scenario waits for asynchronous callbacks, so implementations may deliver on any
 * completion context.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Tier precedence: memory before disk, disk hit repopulates memory</li>
 *   <li>Query options: forced disk read on memory hit, synchronous disk phase</li>
 *   <li>Removal, clearing and existence checks</li>
 *   <li>Approximate memory bound</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyCacheStoreContractTest extends AbstractCacheStoreContractTest {
 *     {@literal @}Override
 *     protected CacheStore&lt;TestMetadata&gt; createStore(CacheConfig config) {
 *         return new MyCacheStore(config);
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractCacheStoreContractTest {

    private static final long WAIT_SECONDS = 5;

    /**
     * Creates a fresh, empty store for one test.
     */
    protected abstract CacheStore<TestMetadata> createStore(CacheConfig config);

    protected CacheStore<TestMetadata> createStore() {
        return createStore(new CacheConfig());
    }

    @Test
    void testQuery_AfterStore_ReportsMemoryTier() throws InterruptedException {
        // Given
        CacheStore<TestMetadata> store = createStore();
        CacheKey key = CacheKey.of("asset-1");
        storeAndWait(store, key, TestMetadata.of(1), true);

        // When
        CacheQueryResult<TestMetadata> result = queryAndWait(store, key, null);

        // Then
        assertEquals(CacheTier.MEMORY, result.tier());
        assertEquals(TestMetadata.of(1), result.metadata());
    }

    @Test
    void testQuery_AfterClearMemory_ReportsDiskTierAndRepopulatesMemory() throws InterruptedException {
        // Given
        CacheStore<TestMetadata> store = createStore();
        CacheKey key = CacheKey.of("asset-2");
        storeAndWait(store, key, TestMetadata.of(2), true);
        store.clearMemory();
        assertNull(store.fromMemory(key));

        // When
        CacheQueryResult<TestMetadata> first = queryAndWait(store, key, null);
        CacheQueryResult<TestMetadata> second = queryAndWait(store, key, null);

        // Then
        assertEquals(CacheTier.DISK, first.tier());
        assertEquals(TestMetadata.of(2), first.metadata());
        assertEquals(CacheTier.MEMORY, second.tier(), "disk hit must populate the memory tier");
        assertEquals(TestMetadata.of(2), store.fromMemory(key));
    }

    @Test
    void testQuery_UnknownKey_ReportsMiss() throws InterruptedException {
        // Given
        CacheStore<TestMetadata> store = createStore();

        // When
        CacheQueryResult<TestMetadata> result = queryAndWait(store, CacheKey.of("missing"), null);

        // Then
        assertFalse(result.isHit());
        assertNull(result.metadata());
        assertEquals(CacheTier.NONE, result.tier());
    }

    @Test
    void testQuery_MemoryHitWithoutOptions_ReturnsNoHandle() {
        // Given
        CacheStore<TestMetadata> store = createStore();
        CacheKey key = CacheKey.of("asset-3");
        store.store(key, TestMetadata.of(3), false, null);
        RecordingCallback<CacheQueryResult<TestMetadata>> callback = new RecordingCallback<>();

        // When
        Object handle = store.query(key, Set.of(), callback);

        // Then
        assertNull(handle, "memory short-circuit has no disk phase to cancel");
        assertEquals(CacheTier.MEMORY, callback.awaitFirst().tier());
    }

    @Test
    void testQuery_QueryDataWhenInMemory_RunsDiskPhaseAndKeepsMemoryTier() throws InterruptedException {
        // Given
        CacheStore<TestMetadata> store = createStore();
        CacheKey key = CacheKey.of("asset-4");
        storeAndWait(store, key, TestMetadata.of(4), true);

        // When
        CacheQueryResult<TestMetadata> result =
            queryAndWait(store, key, EnumSet.of(CacheQueryOption.QUERY_DATA_WHEN_IN_MEMORY));

        // Then
        assertEquals(CacheTier.MEMORY, result.tier());
        assertEquals(TestMetadata.of(4), result.metadata());
    }

    @Test
    void testQuery_QueryDiskSync_DeliversBeforeReturning() throws InterruptedException {
        // Given
        CacheStore<TestMetadata> store = createStore();
        CacheKey key = CacheKey.of("asset-5");
        storeAndWait(store, key, TestMetadata.of(5), true);
        store.clearMemory();
        RecordingCallback<CacheQueryResult<TestMetadata>> callback = new RecordingCallback<>();

        // When
        Cancellable handle = store.query(key, EnumSet.of(CacheQueryOption.QUERY_DISK_SYNC), callback);

        // Then
        assertNull(handle, "synchronous disk phase leaves nothing to cancel");
        assertEquals(1, callback.count(), "synchronous disk phase delivers on the calling thread");
        CacheQueryResult<TestMetadata> result = callback.values().get(0);
        assertEquals(CacheTier.DISK, result.tier());
        assertEquals(TestMetadata.of(5), result.metadata());
    }

    @Test
    void testStore_MemoryCachingDisabled_ServesFromDisk() throws InterruptedException {
        // Given
        CacheStore<TestMetadata> store = createStore(new CacheConfig().withShouldCacheInMemory(false));
        CacheKey key = CacheKey.of("asset-6");
        storeAndWait(store, key, TestMetadata.of(6), true);

        // When
        CacheQueryResult<TestMetadata> result = queryAndWait(store, key, null);

        // Then
        assertNull(store.fromMemory(key));
        assertEquals(CacheTier.DISK, result.tier());
        assertEquals(TestMetadata.of(6), result.metadata());
    }

    @Test
    void testStore_MemoryOnly_NotVisibleOnDisk() throws InterruptedException {
        // Given
        CacheStore<TestMetadata> store = createStore();
        CacheKey key = CacheKey.of("asset-7");

        // When
        storeAndWait(store, key, TestMetadata.of(7), false);

        // Then
        assertEquals(TestMetadata.of(7), store.fromMemory(key));
        assertFalse(store.diskExists(key));
        assertNull(store.fromDisk(key));
    }

    @Test
    void testFromDisk_PopulatesMemory() throws InterruptedException {
        // Given
        CacheStore<TestMetadata> store = createStore();
        CacheKey key = CacheKey.of("asset-8");
        storeAndWait(store, key, TestMetadata.of(8), true);
        store.clearMemory();

        // When
        TestMetadata fromDisk = store.fromDisk(key);

        // Then
        assertEquals(TestMetadata.of(8), fromDisk);
        assertEquals(TestMetadata.of(8), store.fromMemory(key));
        assertEquals(TestMetadata.of(8), store.fromEither(key));
    }

    @Test
    void testRemove_FromBothTiers() throws InterruptedException {
        // Given
        CacheStore<TestMetadata> store = createStore();
        CacheKey key = CacheKey.of("asset-9");
        storeAndWait(store, key, TestMetadata.of(9), true);

        // When
        CountDownLatch removed = new CountDownLatch(1);
        store.remove(key, true, removed::countDown);
        assertTrue(removed.await(WAIT_SECONDS, TimeUnit.SECONDS));

        // Then
        assertNull(store.fromEither(key));
        assertFalse(store.diskExists(key));
        assertFalse(queryAndWait(store, key, null).isHit());
    }

    @Test
    void testRemove_MemoryOnly_KeepsDiskCopy() throws InterruptedException {
        // Given
        CacheStore<TestMetadata> store = createStore();
        CacheKey key = CacheKey.of("asset-10");
        storeAndWait(store, key, TestMetadata.of(10), true);

        // When
        CountDownLatch removed = new CountDownLatch(1);
        store.remove(key, false, removed::countDown);
        assertTrue(removed.await(WAIT_SECONDS, TimeUnit.SECONDS));

        // Then
        assertNull(store.fromMemory(key));
        assertTrue(store.diskExists(key));
    }

    @Test
    void testClearDisk_RemovesEveryEntry() throws InterruptedException {
        // Given
        CacheStore<TestMetadata> store = createStore();
        storeAndWait(store, CacheKey.of("a"), TestMetadata.of(1), true);
        storeAndWait(store, CacheKey.of("b"), TestMetadata.of(2), true);

        // When
        CountDownLatch cleared = new CountDownLatch(1);
        store.clearDisk(cleared::countDown);
        assertTrue(cleared.await(WAIT_SECONDS, TimeUnit.SECONDS));

        // Then
        assertFalse(store.diskExists(CacheKey.of("a")));
        assertFalse(store.diskExists(CacheKey.of("b")));
    }

    @Test
    void testDiskExists_AsyncMatchesSync() throws InterruptedException {
        // Given
        CacheStore<TestMetadata> store = createStore();
        CacheKey present = CacheKey.of("present");
        storeAndWait(store, present, TestMetadata.of(1), true);
        RecordingCallback<Boolean> presentCallback = new RecordingCallback<>();
        RecordingCallback<Boolean> absentCallback = new RecordingCallback<>();

        // When
        store.diskExists(present, presentCallback);
        store.diskExists(CacheKey.of("absent"), absentCallback);

        // Then
        assertTrue(store.diskExists(present));
        assertTrue(presentCallback.awaitFirst());
        assertFalse(absentCallback.awaitFirst());
    }

    @Test
    void testMemoryTier_StaysNearCountLimit() throws InterruptedException {
        // Given
        int limit = 3;
        CacheStore<TestMetadata> store = createStore(new CacheConfig().withMaxMemoryCountLimit(limit));

        // When
        for (int i = 0; i < 10; i++) {
            storeAndWait(store, CacheKey.of("k" + i), TestMetadata.of(i), false);
        }

        // Then
        int inMemory = 0;
        for (int i = 0; i < 10; i++) {
            if (store.fromMemory(CacheKey.of("k" + i)) != null) {
                inMemory++;
            }
        }
        assertTrue(inMemory <= limit, "memory tier holds " + inMemory + " entries");
        assertEquals(TestMetadata.of(9), store.fromMemory(CacheKey.of("k9")));
    }

    @Test
    void testRoundTrip_EmptyAuthorPreserved() throws InterruptedException {
        // Given
        CacheStore<TestMetadata> store = createStore();
        CacheKey key = CacheKey.of("asset-empty");
        storeAndWait(store, key, new TestMetadata("", 0), true);
        store.clearMemory();

        // When
        CacheQueryResult<TestMetadata> result = queryAndWait(store, key, null);

        // Then
        assertEquals(new TestMetadata("", 0), result.metadata());
    }

    @Test
    void testStore_NullArguments_Rejected() {
        CacheStore<TestMetadata> store = createStore();

        assertThrows(IllegalArgumentException.class, () -> store.store(null, TestMetadata.of(1), true, null));
        assertThrows(IllegalArgumentException.class, () -> store.store(CacheKey.of("k"), null, true, null));
    }

    @Test
    void testPathFor_StablePerKey() {
        CacheStore<TestMetadata> store = createStore();

        assertEquals(store.pathFor(CacheKey.of("same")), store.pathFor(CacheKey.of("same")));
        assertNotEquals(store.pathFor(CacheKey.of("one")), store.pathFor(CacheKey.of("two")));
    }

    /**
     * Stores and waits for the completion callback, so disk writes are visible afterwards.
     */
    protected void storeAndWait(CacheStore<TestMetadata> store, CacheKey key, TestMetadata metadata, boolean toDisk)
        throws InterruptedException {
        CountDownLatch done = new CountDownLatch(1);
        store.store(key, metadata, toDisk, done::countDown);
        assertTrue(done.await(WAIT_SECONDS, TimeUnit.SECONDS), "store did not complete for " + key);
    }

    protected CacheQueryResult<TestMetadata> queryAndWait(
        CacheStore<TestMetadata> store,
        CacheKey key,
        Set<CacheQueryOption> options
    ) {
        RecordingCallback<CacheQueryResult<TestMetadata>> callback = new RecordingCallback<>();
        store.query(key, options, callback);
        return callback.awaitFirst();
    }
}
