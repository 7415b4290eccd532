package com.petition.archive.repository;

import com.petition.archive.model.Validation;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * The live {@code validation} store, which additionally answers the orphan query
 * against the pending signatures held in the same database.
 */
public interface ValidationStore extends RecordStore<Validation> {

    /**
     * Left anti-join: validations closed before the watermark for which no pending
     * signature shares the {@code secretValidationKey}.
     */
    List<Validation> findOrphansClosedBefore(Instant watermark);

    /**
     * Deletes validations carrying one of the given keys, restricted to rows closed
     * before the watermark.
     *
     * @return number of rows deleted
     */
    int deleteByKeysClosedBefore(Collection<String> secretValidationKeys, Instant watermark);
}
