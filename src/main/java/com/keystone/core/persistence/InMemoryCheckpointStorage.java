package com.keystone.core.persistence;

import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps checkpoint documents on the heap. State is lost when the process exits.
 */
public class InMemoryCheckpointStorage implements CheckpointStorage {

    private final String lineage;
    private final ConcurrentHashMap<String, byte[]> documents = new ConcurrentHashMap<>();

    public InMemoryCheckpointStorage(String lineage) {
        this.lineage = lineage;
    }

    @Override
    public String reference(String checkpointId) {
        return "memory:" + lineage + "/" + checkpointId;
    }

    @Override
    public void write(String checkpointId, byte[] document) {
        documents.put(checkpointId, document.clone());
    }

    @Override
    public byte[] read(String checkpointId) throws NoSuchFileException {
        byte[] document = documents.get(checkpointId);
        if (document == null) {
            throw new NoSuchFileException(reference(checkpointId));
        }
        return document.clone();
    }

    @Override
    public void delete(String checkpointId) {
        documents.remove(checkpointId);
    }

    @Override
    public List<String> ids() {
        return new ArrayList<>(documents.keySet());
    }
}
