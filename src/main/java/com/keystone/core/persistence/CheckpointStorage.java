package com.keystone.core.persistence;

import java.io.IOException;
import java.util.List;

/**
 * Raw byte storage for checkpoint documents of one lineage.
 */
public interface CheckpointStorage {

    String reference(String checkpointId);

    void write(String checkpointId, byte[] document) throws IOException;

    /**
     * @throws java.nio.file.NoSuchFileException if no document is stored under the id
     */
    byte[] read(String checkpointId) throws IOException;

    void delete(String checkpointId) throws IOException;

    /** Ids of all stored documents, in no particular order. */
    List<String> ids() throws IOException;
}
