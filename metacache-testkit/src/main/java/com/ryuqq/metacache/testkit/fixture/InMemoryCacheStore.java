package com.ryuqq.metacache.testkit.fixture;

import com.ryuqq.metacache.core.config.CacheConfig;
import com.ryuqq.metacache.core.config.CacheQueryOption;
import com.ryuqq.metacache.core.model.CacheKey;
import com.ryuqq.metacache.core.model.CacheQueryResult;
import com.ryuqq.metacache.core.model.CacheTier;
import com.ryuqq.metacache.core.spi.CacheStore;
import com.ryuqq.metacache.core.spi.Cancellable;
import com.ryuqq.metacache.core.spi.MetadataCodec;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.Collections;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * In-memory reference implementation of {@link CacheStore} for tests.
 *
 * <p>The "disk" tier is a second map holding encoded bytes, so tier precedence and
 * codec round trips behave like the real store without touching the file system.
 * Every callback runs on the calling thread.</p>
 *
 * <p><strong>Deferred disk phase:</strong> when {@link #deferDiskPhase(boolean)} is on,
 * {@link #query} parks the disk phase instead of running it. Tests then call
 * {@link #runDeferredQueries()} to resume, which makes "cancel while querying" reproducible.</p>
 *
 * <p>The memory tier honours {@link CacheConfig#maxMemoryCountLimit()} by dropping the
 * eldest entries in access order, and {@link CacheConfig#shouldCacheInMemory()}.
 * Data is lost when the instance is discarded.</p>
 *
 * @param <M> metadata type
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryCacheStore<M> implements CacheStore<M> {

    private final MetadataCodec<M> codec;
    private final CacheConfig config;
    private final Map<CacheKey, M> memory;
    private final Map<CacheKey, byte[]> disk = new ConcurrentHashMap<>();
    private final List<Runnable> deferredQueries = new CopyOnWriteArrayList<>();
    private final AtomicInteger diskReads = new AtomicInteger();
    private final AtomicInteger storeCount = new AtomicInteger();
    private volatile boolean deferDiskPhase;

    public InMemoryCacheStore(MetadataCodec<M> codec) {
        this(codec, new CacheConfig());
    }

    public InMemoryCacheStore(MetadataCodec<M> codec, CacheConfig config) {
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.codec = codec;
        this.config = config;
        int limit = config.maxMemoryCountLimit();
        this.memory = Collections.synchronizedMap(new LinkedHashMap<CacheKey, M>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<CacheKey, M> eldest) {
                return size() > limit;
            }
        });
    }

    @Override
    public void store(CacheKey key, M metadata, boolean toDisk, Runnable onDone) {
        requireKey(key);
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
        storeCount.incrementAndGet();
        putMemory(key, metadata);
        if (toDisk) {
            disk.put(key, codec.encode(metadata));
        }
        runIfPresent(onDone);
    }

    @Override
    public boolean diskExists(CacheKey key) {
        requireKey(key);
        return disk.containsKey(key);
    }

    @Override
    public void diskExists(CacheKey key, Consumer<Boolean> callback) {
        boolean exists = diskExists(key);
        if (callback != null) {
            callback.accept(exists);
        }
    }

    @Override
    public Cancellable query(CacheKey key, Set<CacheQueryOption> options, Consumer<CacheQueryResult<M>> callback) {
        requireKey(key);
        Set<CacheQueryOption> effective = options == null ? config.defaultQueryOptions() : options;
        M inMemory = memory.get(key);
        if (inMemory != null && !effective.contains(CacheQueryOption.QUERY_DATA_WHEN_IN_MEMORY)) {
            deliver(callback, new CacheQueryResult<>(inMemory, CacheTier.MEMORY));
            return null;
        }

        SimpleCancellable handle = new SimpleCancellable();
        Runnable diskPhase = () -> {
            if (handle.isCancelled()) {
                return;
            }
            CacheQueryResult<M> result;
            if (inMemory != null) {
                result = new CacheQueryResult<>(inMemory, CacheTier.MEMORY);
            } else {
                M fromDisk = readDisk(key);
                result = fromDisk == null ? CacheQueryResult.miss() : new CacheQueryResult<>(fromDisk, CacheTier.DISK);
            }
            deliver(callback, result);
        };

        if (effective.contains(CacheQueryOption.QUERY_DISK_SYNC)) {
            diskPhase.run();
            return null;
        }
        if (deferDiskPhase) {
            deferredQueries.add(diskPhase);
        } else {
            diskPhase.run();
        }
        return handle;
    }

    @Override
    public M fromMemory(CacheKey key) {
        requireKey(key);
        return memory.get(key);
    }

    @Override
    public M fromDisk(CacheKey key) {
        requireKey(key);
        return readDisk(key);
    }

    @Override
    public M fromEither(CacheKey key) {
        M inMemory = fromMemory(key);
        return inMemory != null ? inMemory : fromDisk(key);
    }

    @Override
    public void remove(CacheKey key, boolean fromDisk, Runnable onDone) {
        requireKey(key);
        memory.remove(key);
        if (fromDisk) {
            disk.remove(key);
        }
        runIfPresent(onDone);
    }

    @Override
    public void clearMemory() {
        memory.clear();
    }

    @Override
    public void clearDisk(Runnable onDone) {
        disk.clear();
        runIfPresent(onDone);
    }

    @Override
    public Path pathFor(CacheKey key) {
        requireKey(key);
        return Path.of("in-memory", Integer.toHexString(key.getValue().hashCode()));
    }

    /**
     * Parks future disk phases until {@link #runDeferredQueries()}.
     */
    public void deferDiskPhase(boolean defer) {
        this.deferDiskPhase = defer;
    }

    /**
     * Runs every parked disk phase in submission order.
     *
     * @return number of phases resumed
     */
    public int runDeferredQueries() {
        List<Runnable> pending = new ArrayList<>(deferredQueries);
        deferredQueries.removeAll(pending);
        pending.forEach(Runnable::run);
        return pending.size();
    }

    public int diskReads() {
        return diskReads.get();
    }

    public int memoryCount() {
        return memory.size();
    }

    public int storeCount() {
        return storeCount.get();
    }

    /**
     * Clears both tiers and all counters.
     */
    public void clear() {
        memory.clear();
        disk.clear();
        deferredQueries.clear();
        diskReads.set(0);
        storeCount.set(0);
    }

    private M readDisk(CacheKey key) {
        byte[] bytes = disk.get(key);
        if (bytes == null) {
            return null;
        }
        diskReads.incrementAndGet();
        M decoded = codec.decode(bytes);
        putMemory(key, decoded);
        return decoded;
    }

    private void putMemory(CacheKey key, M metadata) {
        if (config.shouldCacheInMemory()) {
            memory.put(key, metadata);
        }
    }

    private void deliver(Consumer<CacheQueryResult<M>> callback, CacheQueryResult<M> result) {
        if (callback != null) {
            callback.accept(result);
        }
    }

    private static void requireKey(CacheKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }

    private static void runIfPresent(Runnable onDone) {
        if (onDone != null) {
            onDone.run();
        }
    }

    private static final class SimpleCancellable implements Cancellable {

        private final AtomicBoolean cancelled = new AtomicBoolean(false);

        @Override
        public boolean cancel() {
            return cancelled.compareAndSet(false, true);
        }

        @Override
        public boolean isCancelled() {
            return cancelled.get();
        }
    }
}
