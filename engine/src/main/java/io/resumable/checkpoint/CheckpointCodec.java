package io.resumable.checkpoint;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * JSON encoding of {@link Checkpoint} with a schema version check and a size cap.
 */
public class CheckpointCodec {
    private final ObjectMapper mapper;
    private final int maxBytes;

    public CheckpointCodec(int maxBytes) {
        this(defaultMapper(), maxBytes);
    }

    public CheckpointCodec(ObjectMapper mapper, int maxBytes) {
        this.mapper = mapper;
        this.maxBytes = maxBytes <= 0 ? Integer.MAX_VALUE : maxBytes;
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public byte[] encode(Checkpoint checkpoint) {
        byte[] bytes;
        try {
            bytes = mapper.writeValueAsBytes(checkpoint);
        } catch (JsonProcessingException e) {
            throw new CheckpointStoreException("cannot encode checkpoint for job " + checkpoint.jobId(), e);
        }
        if (bytes.length > maxBytes) {
            throw new CheckpointStoreException("checkpoint for job " + checkpoint.jobId() + " is " + bytes.length
                    + " bytes, backend allows " + maxBytes);
        }
        return bytes;
    }

    public Checkpoint decode(String key, byte[] bytes) {
        Checkpoint cp;
        try {
            cp = mapper.readValue(bytes, Checkpoint.class);
        } catch (IOException | IllegalArgumentException | NullPointerException e) {
            throw new CheckpointCorruptedException("unreadable checkpoint at " + key + ": "
                    + abbreviate(new String(bytes, StandardCharsets.UTF_8)), e);
        }
        if (cp.schemaVersion() != Checkpoint.CURRENT_VERSION) {
            throw new CheckpointCorruptedException("checkpoint at " + key + " has schema version " + cp.schemaVersion()
                    + ", expected " + Checkpoint.CURRENT_VERSION);
        }
        return cp;
    }

    private static String abbreviate(String s) {
        return s.length() <= 80 ? s : s.substring(0, 77) + "...";
    }
}
