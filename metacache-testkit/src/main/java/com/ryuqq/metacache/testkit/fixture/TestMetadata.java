package com.ryuqq.metacache.testkit.fixture;

/**
 * Test metadata value.
 *
 * @param author author field (may be empty)
 * @param v version-like number
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TestMetadata(String author, int v) {

    public TestMetadata {
        if (author == null) {
            throw new IllegalArgumentException("author cannot be null");
        }
    }

    public static TestMetadata of(int v) {
        return new TestMetadata("tester", v);
    }
}
