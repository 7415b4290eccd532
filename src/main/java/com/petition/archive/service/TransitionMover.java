package com.petition.archive.service;

import java.time.Instant;

/**
 * Moves the rows of one record category whose validation window closed before the
 * watermark out of the processing store.
 *
 * Callers depend only on this contract; the current implementation is
 * {@link TwoPassTransitionMover}.
 */
public interface TransitionMover {

    /**
     * Archives (when enabled) and then deletes every row of the route's source store
     * with {@code timestampValidationClose < watermark}.
     *
     * @param route            category with its processing and archive stores
     * @param watermark        exclusive upper bound on {@code timestampValidationClose}
     * @param archivingEnabled whether rows are copied to the archive store before deletion
     * @return archived and deleted row counts
     * @throws com.petition.archive.repository.StoreAccessException if a store operation fails;
     *         no deletion is attempted after a failed archive step
     */
    <T> TransitionCounts move(TransitionRoute<T> route, Instant watermark, boolean archivingEnabled);
}
