package com.petition.archive.repository;

import java.time.Instant;
import java.util.List;

/**
 * Row-level primitives against one named store (a single table in either the
 * processing or the archive database).
 *
 * Every record kind handled by the archive workflow carries a
 * {@code timestampValidationClose}; the "closed before" predicate is always
 * {@code timestamp_validation_close < watermark}.
 *
 * @param <T> record type held by the store
 */
public interface RecordStore<T> {

    /**
     * @return the table name, used to tag audit entries and metrics
     */
    String storeName();

    /**
     * Selects every row whose validation window closed strictly before the watermark.
     */
    List<T> findClosedBefore(Instant watermark);

    /**
     * Inserts one row as-is.
     */
    void insert(T record);

    /**
     * Deletes every row whose validation window closed strictly before the watermark.
     *
     * @return number of rows deleted
     */
    int deleteClosedBefore(Instant watermark);

    /**
     * @return current number of rows in the store
     */
    long count();
}
