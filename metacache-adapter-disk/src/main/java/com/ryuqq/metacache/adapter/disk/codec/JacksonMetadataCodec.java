package com.ryuqq.metacache.adapter.disk.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.metacache.core.exception.MetadataSerializationException;
import com.ryuqq.metacache.core.spi.MetadataCodec;

import java.io.IOException;

/**
 * JSON {@link MetadataCodec} backed by a Jackson {@link ObjectMapper}.
 *
 * <p>The mapper is shared and must be configured before the codec is used.
 * Jackson failures are rethrown as {@link MetadataSerializationException}.</p>
 *
 * @param <M> metadata type
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class JacksonMetadataCodec<M> implements MetadataCodec<M> {

    private final ObjectMapper objectMapper;
    private final Class<M> type;

    public JacksonMetadataCodec(ObjectMapper objectMapper, Class<M> type) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        this.objectMapper = objectMapper;
        this.type = type;
    }

    /**
     * Codec with a default {@link ObjectMapper}.
     */
    public static <M> JacksonMetadataCodec<M> forType(Class<M> type) {
        return new JacksonMetadataCodec<>(new ObjectMapper(), type);
    }

    @Override
    public byte[] encode(M metadata) {
        if (metadata == null) {
            throw new MetadataSerializationException("metadata cannot be null");
        }
        try {
            return objectMapper.writeValueAsBytes(metadata);
        } catch (JsonProcessingException e) {
            throw new MetadataSerializationException("Failed to encode " + type.getSimpleName(), e);
        }
    }

    @Override
    public M decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new MetadataSerializationException("Cannot decode empty " + type.getSimpleName());
        }
        try {
            return objectMapper.readValue(bytes, type);
        } catch (IOException e) {
            throw new MetadataSerializationException("Failed to decode " + type.getSimpleName(), e);
        }
    }
}
