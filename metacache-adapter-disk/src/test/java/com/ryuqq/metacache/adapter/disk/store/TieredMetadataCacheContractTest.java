package com.ryuqq.metacache.adapter.disk.store;

import com.ryuqq.metacache.core.config.CacheConfig;
import com.ryuqq.metacache.core.executor.CompletionContext;
import com.ryuqq.metacache.core.spi.CacheStore;
import com.ryuqq.metacache.testkit.contract.AbstractCacheStoreContractTest;
import com.ryuqq.metacache.testkit.fixture.TestMetadata;
import com.ryuqq.metacache.testkit.fixture.TestMetadataCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

/**
 * Contract Tests for {@link TieredMetadataCache} on a temporary directory.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TieredMetadataCacheContractTest extends AbstractCacheStoreContractTest {

    @TempDir
    Path root;

    private TieredMetadataCache<TestMetadata> cache;

    @Override
    protected CacheStore<TestMetadata> createStore(CacheConfig config) {
        cache = new TieredMetadataCache<>(
            new KeyedPersistenceDirectory(root, "contract"),
            new TestMetadataCodec(),
            config,
            CompletionContext.direct()
        );
        return cache;
    }

    @AfterEach
    void closeCache() {
        if (cache != null) {
            cache.close();
        }
    }
}
