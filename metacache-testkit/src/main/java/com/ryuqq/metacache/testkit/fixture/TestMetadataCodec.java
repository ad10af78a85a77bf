package com.ryuqq.metacache.testkit.fixture;

import com.ryuqq.metacache.core.exception.MetadataSerializationException;
import com.ryuqq.metacache.core.spi.MetadataCodec;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Binary codec for {@link TestMetadata}.
 *
 * <p>Layout: 4-byte magic, UTF author, int v. Counts decode calls so tests can
 * assert whether the disk tier was read.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TestMetadataCodec implements MetadataCodec<TestMetadata> {

    private static final int MAGIC = 0x4D455441;

    private final AtomicInteger decodeCount = new AtomicInteger();

    @Override
    public byte[] encode(TestMetadata metadata) {
        if (metadata == null) {
            throw new MetadataSerializationException("metadata cannot be null");
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeInt(MAGIC);
            out.writeUTF(metadata.author());
            out.writeInt(metadata.v());
        } catch (IOException e) {
            throw new MetadataSerializationException("Failed to encode " + metadata, e);
        }
        return bytes.toByteArray();
    }

    @Override
    public TestMetadata decode(byte[] bytes) {
        decodeCount.incrementAndGet();
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(bytes))) {
            if (in.readInt() != MAGIC) {
                throw new MetadataSerializationException("Unexpected header");
            }
            return new TestMetadata(in.readUTF(), in.readInt());
        } catch (IOException e) {
            throw new MetadataSerializationException("Failed to decode " + bytes.length + " bytes", e);
        }
    }

    public int decodeCount() {
        return decodeCount.get();
    }
}
