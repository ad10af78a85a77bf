package com.ryuqq.metacache.testkit.fixture;

import com.ryuqq.metacache.core.exception.MetadataSerializationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TestMetadataCodecTest {

    @Test
    void testDecode_ForeignBytes_Rejected() {
        TestMetadataCodec codec = new TestMetadataCodec();

        assertThrows(MetadataSerializationException.class, () -> codec.decode(new byte[] {1, 2, 3, 4, 5}));
        assertThrows(MetadataSerializationException.class, () -> codec.decode(new byte[0]));
    }

    @Test
    void testDecode_CountsInvocations() {
        TestMetadataCodec codec = new TestMetadataCodec();
        byte[] encoded = codec.encode(new TestMetadata("author", 7));

        assertEquals(new TestMetadata("author", 7), codec.decode(encoded));
        assertEquals(1, codec.decodeCount());
    }
}
