package com.ryuqq.metacache.testkit.fixture;

import com.ryuqq.metacache.core.spi.Asset;

/**
 * Test asset identified by a plain string.
 *
 * @param identifier stable identifier
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TestAsset(String identifier) implements Asset {

    public static TestAsset of(String identifier) {
        return new TestAsset(identifier);
    }
}
