package com.guno.orderpipeline.checkpoint;

/**
 * Durable count of input records a run has fully processed, keyed by run.
 */
public interface CheckpointStore {

    /**
     * @return committed record count, 0 when the run has no checkpoint
     */
    long load(String runKey);

    void save(String runKey, long committedRecords);

    void clear(String runKey);
}
