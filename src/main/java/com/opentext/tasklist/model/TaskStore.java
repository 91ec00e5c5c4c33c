package com.opentext.tasklist.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Durable read/write boundary for the whole task collection.
 * <p>
 * Implementations perform no locking; callers that read-modify-write must serialize
 * themselves. Readers must never observe a half-written collection.
 * </p>
 */
public interface TaskStore {

    /**
     * Read the full collection in persisted order.
     * @return the stored tasks, or an empty list if the backing file does not exist yet
     * @throws CorruptStoreException if the backing file exists but cannot be parsed
     */
    List<Task> load();

    /**
     * Replace the persisted collection with the given tasks, creating the parent directory
     * if needed. The swap is atomic: on failure the previous contents stay in place.
     * @param tasks the complete collection to persist
     * @throws StoreWriteException on any I/O failure
     */
    void save(List<Task> tasks);

    /** @return the backing file */
    Path path();
}
