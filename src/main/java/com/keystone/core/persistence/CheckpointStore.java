package com.keystone.core.persistence;

import com.keystone.core.error.ErrorCategory;
import com.keystone.core.error.PersistenceException;
import com.keystone.core.metrics.KeystoneMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Retention-bounded store of orchestration snapshots for one lineage.
 * <p>
 * Checkpoints are append-only; once more than {@code maxCheckpoints} are held the oldest are
 * evicted and their stored documents deleted. The checkpoint just created is never evicted.
 * Taking the snapshot and writing it happen inside one critical section.
 */
public class CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

    private final String lineage;
    private final CheckpointStorage storage;
    private final CheckpointCodec codec;
    private final int maxCheckpoints;
    private final Clock clock;
    private final KeystoneMetrics metrics;

    /** Insertion order == creation order. */
    private final LinkedHashMap<String, Checkpoint> index = new LinkedHashMap<>();
    private long sequence;

    public CheckpointStore(String lineage, CheckpointStorage storage, CheckpointCodec codec,
                           int maxCheckpoints, Clock clock, KeystoneMetrics metrics) {
        if (maxCheckpoints < 1) {
            throw new IllegalArgumentException("maxCheckpoints must be at least 1 (current: " + maxCheckpoints + ")");
        }
        this.lineage = lineage;
        this.storage = storage;
        this.codec = codec;
        this.maxCheckpoints = maxCheckpoints;
        this.clock = clock;
        this.metrics = metrics;
        recoverIndex();
    }

    public String create(OrchestrationSnapshot state, CheckpointReason reason, String detail) {
        return create(() -> state, reason, detail);
    }

    /**
     * Takes the snapshot and persists it as one exclusive step, then evicts down to the bound.
     *
     * @return the new checkpoint id
     * @throws PersistenceException with operation CREATE when the snapshot cannot be written
     */
    public synchronized String create(Supplier<OrchestrationSnapshot> snapshotter, CheckpointReason reason,
                                      String detail) {
        OrchestrationSnapshot state = snapshotter.get();
        long seq = sequence + 1;
        String id = String.format("%s-CP-%04d", lineage, seq);
        var checkpoint = new Checkpoint(id, clock.instant(), seq, reason, detail, state.summary(),
                storage.reference(id));

        byte[] document = codec.encode(checkpoint, state);
        try {
            storage.write(id, document);
        } catch (IOException e) {
            throw new PersistenceException(ErrorCategory.IO_ERROR, PersistenceException.Operation.CREATE,
                    "Failed to write checkpoint " + id + ": " + e.getMessage(), e);
        }
        sequence = seq;
        index.put(id, checkpoint);
        log.debug("Created checkpoint {} ({}{})", id, reason, detail != null ? " " + detail : "");
        if (metrics != null) {
            metrics.recordCheckpoint("created");
        }
        evictBeyondBound(id);
        return id;
    }

    /**
     * Loads the snapshot stored for {@code checkpointId}.
     *
     * @throws PersistenceException CHECKPOINT_NOT_FOUND, SERIALIZATION_ERROR or IO_ERROR (operation LOAD)
     */
    public synchronized OrchestrationSnapshot load(String checkpointId) {
        if (!index.containsKey(checkpointId)) {
            throw PersistenceException.notFound(checkpointId);
        }
        byte[] document;
        try {
            document = storage.read(checkpointId);
        } catch (NoSuchFileException e) {
            throw PersistenceException.notFound(checkpointId);
        } catch (IOException e) {
            throw new PersistenceException(ErrorCategory.IO_ERROR, PersistenceException.Operation.LOAD,
                    "Failed to read checkpoint " + checkpointId + ": " + e.getMessage(), e);
        }
        return codec.decodeState(document);
    }

    /** Summaries ordered oldest first. */
    public synchronized List<Checkpoint> list() {
        return new ArrayList<>(index.values());
    }

    public synchronized Optional<Checkpoint> latest() {
        Checkpoint last = null;
        for (var checkpoint : index.values()) {
            last = checkpoint;
        }
        return Optional.ofNullable(last);
    }

    public synchronized int size() {
        return index.size();
    }

    /** Deletes every checkpoint of this lineage. */
    public synchronized void clear() {
        for (var id : new ArrayList<>(index.keySet())) {
            deleteDocument(id);
        }
        index.clear();
        log.debug("Cleared checkpoint lineage {}", lineage);
    }

    public String lineage() {
        return lineage;
    }

    public int maxCheckpoints() {
        return maxCheckpoints;
    }

    private void evictBeyondBound(String justCreated) {
        var iterator = index.entrySet().iterator();
        while (index.size() > maxCheckpoints && iterator.hasNext()) {
            var oldest = iterator.next();
            if (oldest.getKey().equals(justCreated)) {
                break;
            }
            iterator.remove();
            deleteDocument(oldest.getKey());
            log.debug("Evicted checkpoint {}", oldest.getKey());
            if (metrics != null) {
                metrics.recordCheckpoint("evicted");
            }
        }
    }

    private void deleteDocument(String id) {
        try {
            storage.delete(id);
        } catch (IOException e) {
            log.warn("Failed to delete checkpoint document {}: {}", id, e.getMessage());
        }
    }

    /** Rebuilds the index from documents already present in storage (e.g. after a restart). */
    private void recoverIndex() {
        List<String> ids;
        try {
            ids = storage.ids();
        } catch (IOException e) {
            log.warn("Unable to list existing checkpoints for lineage {}: {}", lineage, e.getMessage());
            return;
        }
        var recovered = new ArrayList<Checkpoint>();
        for (var id : ids) {
            try {
                recovered.add(codec.decodeMetadata(storage.read(id)));
            } catch (IOException | PersistenceException e) {
                log.warn("Skipping unreadable checkpoint document {}: {}", id, e.getMessage());
            }
        }
        recovered.sort(Comparator.comparingLong(Checkpoint::sequence));
        for (var checkpoint : recovered) {
            index.put(checkpoint.id(), checkpoint);
            sequence = Math.max(sequence, checkpoint.sequence());
        }
        if (!recovered.isEmpty()) {
            log.info("Recovered {} checkpoint(s) for lineage {}", recovered.size(), lineage);
            evictBeyondBound(recovered.get(recovered.size() - 1).id());
        }
    }
}
