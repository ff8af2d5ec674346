package com.keystone.core.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.keystone.core.error.ErrorCategory;
import com.keystone.core.error.PersistenceException;

import java.io.IOException;

/**
 * JSON encoding of checkpoint documents: metadata, state and a format version tag.
 * Documents written by a newer format version are rejected.
 */
public class CheckpointCodec {

    public static final int FORMAT_VERSION = 1;

    private final ObjectMapper objectMapper;

    public CheckpointCodec() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public record CheckpointDocument(int formatVersion, Checkpoint checkpoint, OrchestrationSnapshot state) {}

    public byte[] encode(Checkpoint checkpoint, OrchestrationSnapshot state) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsBytes(new CheckpointDocument(FORMAT_VERSION, checkpoint, state));
        } catch (IOException e) {
            throw new PersistenceException(ErrorCategory.SERIALIZATION_ERROR, PersistenceException.Operation.CREATE,
                    "Failed to serialize checkpoint " + checkpoint.id(), e);
        }
    }

    public Checkpoint decodeMetadata(byte[] document) {
        return decode(document).checkpoint();
    }

    public OrchestrationSnapshot decodeState(byte[] document) {
        return decode(document).state();
    }

    private CheckpointDocument decode(byte[] document) {
        CheckpointDocument decoded;
        try {
            decoded = objectMapper.readValue(document, CheckpointDocument.class);
        } catch (IOException e) {
            throw new PersistenceException(ErrorCategory.SERIALIZATION_ERROR, PersistenceException.Operation.LOAD,
                    "Failed to deserialize checkpoint document", e);
        }
        if (decoded.formatVersion() > FORMAT_VERSION || decoded.checkpoint() == null) {
            throw new PersistenceException(ErrorCategory.SERIALIZATION_ERROR, PersistenceException.Operation.LOAD,
                    "Unsupported checkpoint format version " + decoded.formatVersion());
        }
        return decoded;
    }
}
