package com.guno.orderpipeline.checkpoint;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, Long> checkpoints = new ConcurrentHashMap<>();

    @Override
    public long load(String runKey) {
        return checkpoints.getOrDefault(runKey, 0L);
    }

    @Override
    public void save(String runKey, long committedRecords) {
        checkpoints.put(runKey, committedRecords);
    }

    @Override
    public void clear(String runKey) {
        checkpoints.remove(runKey);
    }
}
