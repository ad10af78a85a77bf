package com.ryuqq.metacache.adapter.disk.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.ryuqq.metacache.core.config.CacheConfig;
import com.ryuqq.metacache.core.config.CacheQueryOption;
import com.ryuqq.metacache.core.exception.MetadataSerializationException;
import com.ryuqq.metacache.core.executor.CompletionContext;
import com.ryuqq.metacache.core.model.CacheKey;
import com.ryuqq.metacache.core.model.CacheQueryResult;
import com.ryuqq.metacache.core.model.CacheTier;
import com.ryuqq.metacache.core.spi.CacheStore;
import com.ryuqq.metacache.core.spi.Cancellable;
import com.ryuqq.metacache.core.spi.MetadataCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Two-tier {@link CacheStore}: a bounded Caffeine cache over a {@link KeyedPersistenceDirectory}.
 *
 * <p><strong>Memory Tier:</strong></p>
 * <ul>
 *   <li>Caffeine {@link Cache} bounded by {@link CacheConfig#maxMemoryCountLimit()} entries</li>
 *   <li>Eviction is size-based and approximate; maintenance runs on the calling thread</li>
 *   <li>Skipped entirely when {@link CacheConfig#shouldCacheInMemory()} is false</li>
 * </ul>
 *
 * <p><strong>Disk Tier:</strong></p>
 * <ul>
 *   <li>All asynchronous disk work runs on one sequential I/O thread
 *       ({@code metacache-io-<namespace>}), so writes for a key are applied in call order</li>
 *   <li>Encoding, write and decode failures are logged at WARN and never surface to callers</li>
 *   <li>A failed decode is reported as a miss</li>
 * </ul>
 *
 * <p>Every asynchronous callback is dispatched on the injected {@link CompletionContext}.
 * No lock is held while calling back or doing I/O.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * KeyedPersistenceDirectory directory = new KeyedPersistenceDirectory(cacheRoot, "artwork");
 * TieredMetadataCache&lt;Artwork&gt; cache = new TieredMetadataCache&lt;&gt;(
 *     directory, new JacksonMetadataCodec&lt;&gt;(mapper, Artwork.class),
 *     new CacheConfig(), completionContext);
 *
 * cache.store(CacheKey.of("cover.png"), artwork);
 * cache.query(CacheKey.of("cover.png"), null, result -&gt; render(result.metadata()));
 * </pre>
 *
 * @param <M> metadata type
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TieredMetadataCache<M> implements CacheStore<M>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TieredMetadataCache.class);

    private final KeyedPersistenceDirectory directory;
    private final MetadataCodec<M> codec;
    private final CompletionContext completionContext;
    private final ExecutorService ioExecutor;
    private final Cache<CacheKey, M> memory;
    private volatile CacheConfig config;

    public TieredMetadataCache(
        KeyedPersistenceDirectory directory,
        MetadataCodec<M> codec,
        CacheConfig config,
        CompletionContext completionContext
    ) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (completionContext == null) {
            throw new IllegalArgumentException("completionContext cannot be null");
        }
        this.directory = directory;
        this.codec = codec;
        this.config = config;
        this.completionContext = completionContext;
        this.memory = Caffeine.newBuilder()
            .maximumSize(config.maxMemoryCountLimit())
            .executor(Runnable::run)
            .build();
        String threadName = "metacache-io-" + directory.namespace();
        this.ioExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread t = new Thread(runnable, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void store(CacheKey key, M metadata, boolean toDisk, Runnable onDone) {
        requireKey(key);
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
        putMemory(key, metadata);
        if (!toDisk) {
            complete(onDone);
            return;
        }
        ioExecutor.execute(() -> {
            try {
                directory.save(key, codec.encode(metadata));
            } catch (IOException | MetadataSerializationException e) {
                log.warn("Failed to write {} to disk cache", key, e);
            } finally {
                complete(onDone);
            }
        });
    }

    @Override
    public boolean diskExists(CacheKey key) {
        requireKey(key);
        return directory.exists(key);
    }

    @Override
    public void diskExists(CacheKey key, Consumer<Boolean> callback) {
        requireKey(key);
        ioExecutor.execute(() -> {
            boolean exists = directory.exists(key);
            if (callback != null) {
                completionContext.dispatch(() -> callback.accept(exists));
            }
        });
    }

    @Override
    public Cancellable query(CacheKey key, Set<CacheQueryOption> options, Consumer<CacheQueryResult<M>> callback) {
        requireKey(key);
        Set<CacheQueryOption> effective = options == null ? config.defaultQueryOptions() : options;
        M inMemory = fromMemory(key);
        if (inMemory != null && !effective.contains(CacheQueryOption.QUERY_DATA_WHEN_IN_MEMORY)) {
            if (callback != null) {
                completionContext.dispatch(() -> callback.accept(new CacheQueryResult<>(inMemory, CacheTier.MEMORY)));
            }
            return null;
        }

        DiskQuery handle = new DiskQuery();
        if (effective.contains(CacheQueryOption.QUERY_DISK_SYNC)) {
            CacheQueryResult<M> result = diskPhase(key, inMemory, handle);
            if (result != null && callback != null) {
                callback.accept(result);
            }
            return null;
        }

        ioExecutor.execute(() -> {
            CacheQueryResult<M> result = diskPhase(key, inMemory, handle);
            if (result != null && callback != null) {
                completionContext.dispatch(() -> callback.accept(result));
            }
        });
        return handle;
    }

    /**
     * @return the result to deliver, or null when the handle was cancelled first
     */
    private CacheQueryResult<M> diskPhase(CacheKey key, M inMemory, DiskQuery handle) {
        if (handle.isCancelled()) {
            return null;
        }
        CacheQueryResult<M> result;
        if (inMemory != null) {
            result = new CacheQueryResult<>(inMemory, CacheTier.MEMORY);
        } else {
            M fromDisk = readDisk(key);
            result = fromDisk == null ? CacheQueryResult.miss() : new CacheQueryResult<>(fromDisk, CacheTier.DISK);
        }
        return handle.markDone() ? result : null;
    }

    @Override
    public M fromMemory(CacheKey key) {
        requireKey(key);
        return memory.getIfPresent(key);
    }

    @Override
    public M fromDisk(CacheKey key) {
        requireKey(key);
        return readDisk(key);
    }

    @Override
    public M fromEither(CacheKey key) {
        M inMemory = fromMemory(key);
        return inMemory != null ? inMemory : readDisk(key);
    }

    @Override
    public void remove(CacheKey key, boolean fromDisk, Runnable onDone) {
        requireKey(key);
        memory.invalidate(key);
        if (!fromDisk) {
            complete(onDone);
            return;
        }
        ioExecutor.execute(() -> {
            try {
                directory.delete(key);
            } catch (IOException e) {
                log.warn("Failed to delete {} from disk cache", key, e);
            } finally {
                complete(onDone);
            }
        });
    }

    @Override
    public void clearMemory() {
        memory.invalidateAll();
    }

    @Override
    public void clearDisk(Runnable onDone) {
        ioExecutor.execute(() -> {
            try {
                directory.clear();
            } catch (IOException e) {
                log.warn("Failed to clear disk cache {}", directory.directory(), e);
            } finally {
                complete(onDone);
            }
        });
    }

    @Override
    public Path pathFor(CacheKey key) {
        return directory.pathFor(key);
    }

    /**
     * Number of memory entries after pending evictions are applied.
     */
    public int memoryCount() {
        memory.cleanUp();
        return (int) memory.estimatedSize();
    }

    /**
     * Changes the memory count limit and evicts down to it.
     */
    public void setMaxMemoryCountLimit(int maxMemoryCountLimit) {
        config = config.withMaxMemoryCountLimit(maxMemoryCountLimit);
        memory.policy().eviction().ifPresent(eviction -> eviction.setMaximum(maxMemoryCountLimit));
        memory.cleanUp();
    }

    public CacheConfig config() {
        return config;
    }

    /**
     * Stops the I/O thread after pending disk work finishes (5 seconds at most).
     */
    @Override
    public void close() {
        ioExecutor.shutdown();
        try {
            if (!ioExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Disk cache {} did not drain in time", directory.namespace());
                ioExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ioExecutor.shutdownNow();
        }
    }

    private M readDisk(CacheKey key) {
        Optional<byte[]> bytes;
        try {
            bytes = directory.load(key);
        } catch (IOException e) {
            log.warn("Failed to read {} from disk cache", key, e);
            return null;
        }
        if (bytes.isEmpty()) {
            return null;
        }
        M decoded;
        try {
            decoded = codec.decode(bytes.get());
        } catch (MetadataSerializationException e) {
            log.warn("Discarding undecodable disk entry for {}", key, e);
            return null;
        }
        putMemory(key, decoded);
        return decoded;
    }

    private void putMemory(CacheKey key, M metadata) {
        if (!config.shouldCacheInMemory()) {
            return;
        }
        memory.put(key, metadata);
    }

    private void complete(Runnable onDone) {
        if (onDone != null) {
            completionContext.dispatch(onDone);
        }
    }

    private static void requireKey(CacheKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }

    /**
     * Disk-phase handle: pending until the phase produces a result or is cancelled.
     */
    private static final class DiskQuery implements Cancellable {

        private static final int PENDING = 0;
        private static final int CANCELLED = 1;
        private static final int DONE = 2;

        private final AtomicInteger state = new AtomicInteger(PENDING);

        @Override
        public boolean cancel() {
            return state.compareAndSet(PENDING, CANCELLED);
        }

        @Override
        public boolean isCancelled() {
            return state.get() == CANCELLED;
        }

        boolean markDone() {
            return state.compareAndSet(PENDING, DONE);
        }
    }
}
