package com.containerwatch.tracker.persistence;

import java.util.Collection;
import java.util.List;

/**
 * Durable collection of records that is read in full and rewritten in full.
 * Implementations must never expose a partially written state to {@link #load()}.
 */
public interface RecordStore<T> {

    /**
     * Reads every readable record. Records that cannot be decoded are skipped, never fatal.
     */
    List<T> load();

    /**
     * Replaces the stored collection with {@code records}.
     *
     * @throws StoreWriteException if the new state could not be made durable; the previous state is kept
     */
    void save(Collection<T> records);
}
