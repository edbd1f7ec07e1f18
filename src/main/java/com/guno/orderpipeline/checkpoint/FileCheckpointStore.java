package com.guno.orderpipeline.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.guno.orderpipeline.exception.PipelineException;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;

/**
 * One JSON file per run key under a directory. Writes go to a temp file
 * that is moved over the checkpoint atomically.
 */
@Slf4j
public class FileCheckpointStore implements CheckpointStore {

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileCheckpointStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public long load(String runKey) {
        Path file = fileFor(runKey);
        if (!Files.exists(file)) {
            return 0;
        }
        try {
            Checkpoint checkpoint = objectMapper.readValue(file.toFile(), Checkpoint.class);
            log.info("📍 Resuming run {} from checkpoint {}", runKey, checkpoint.getCommittedRecords());
            return checkpoint.getCommittedRecords();
        } catch (IOException e) {
            throw new PipelineException("Cannot read checkpoint " + file, e);
        }
    }

    @Override
    public void save(String runKey, long committedRecords) {
        Path file = fileFor(runKey);
        try {
            Files.createDirectories(directory);
            Path tmp = Files.createTempFile(directory, "checkpoint-", ".tmp");
            objectMapper.writeValue(tmp.toFile(), new Checkpoint(runKey, committedRecords, Instant.now().toString()));
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new PipelineException("Cannot write checkpoint " + file, e);
        }
    }

    @Override
    public void clear(String runKey) {
        try {
            Files.deleteIfExists(fileFor(runKey));
        } catch (IOException e) {
            throw new PipelineException("Cannot delete checkpoint for " + runKey, e);
        }
    }

    private Path fileFor(String runKey) {
        String safe = runKey.replaceAll("[^A-Za-z0-9._-]", "_");
        return directory.resolve(safe + ".checkpoint.json");
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class Checkpoint {
        private String runKey;
        private long committedRecords;
        private String savedAt;
    }
}
