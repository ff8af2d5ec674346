package com.keystone.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Stores one JSON document per checkpoint under {@code <root>/<lineage>/<id>.json}.
 * <p>
 * Documents are written to a temporary file and moved into place so a crash never
 * leaves a half-written checkpoint behind. This allows runs to be resumed or
 * inspected across JVM restarts.
 */
public class FileSystemCheckpointStorage implements CheckpointStorage {

    private static final Logger log = LoggerFactory.getLogger(FileSystemCheckpointStorage.class);
    private static final String SUFFIX = ".json";

    private final Path directory;

    public FileSystemCheckpointStorage(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
    }

    @Override
    public String reference(String checkpointId) {
        return pathOf(checkpointId).toString();
    }

    @Override
    public void write(String checkpointId, byte[] document) throws IOException {
        Files.createDirectories(directory);
        Path target = pathOf(checkpointId);
        Path temp = directory.resolve(checkpointId + SUFFIX + ".tmp");
        Files.write(temp, document);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.debug("Wrote checkpoint document {}", target);
    }

    @Override
    public byte[] read(String checkpointId) throws IOException {
        return Files.readAllBytes(pathOf(checkpointId));
    }

    @Override
    public void delete(String checkpointId) throws IOException {
        Files.deleteIfExists(pathOf(checkpointId));
    }

    @Override
    public List<String> ids() throws IOException {
        var ids = new ArrayList<String>();
        if (!Files.isDirectory(directory)) {
            return ids;
        }
        try (var files = Files.list(directory)) {
            files.map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(SUFFIX))
                    .map(name -> name.substring(0, name.length() - SUFFIX.length()))
                    .forEach(ids::add);
        }
        return ids;
    }

    private Path pathOf(String checkpointId) {
        return directory.resolve(checkpointId + SUFFIX);
    }
}
