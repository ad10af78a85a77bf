/**
 * File-system backed cache store package.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.metacache.adapter.disk.store.KeyedPersistenceDirectory}:
 *       MD5-keyed files under one namespace directory, written atomically</li>
 *   <li>{@link com.ryuqq.metacache.adapter.disk.store.TieredMetadataCache}:
 *       memory tier over the directory, implementing {@link com.ryuqq.metacache.core.spi.CacheStore}</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Memory eviction is approximate (Caffeine size bound, count based)</li>
 *   <li>No coordination between processes sharing a directory</li>
 *   <li>No versioning of the stored format</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.metacache.adapter.disk.store;
