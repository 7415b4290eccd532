package com.petition.archive.service;

import com.petition.archive.model.AuditSeverity;
import com.petition.archive.repository.RecordStore;
import com.petition.archive.repository.StoreAccessException;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * {@link TransitionMover} that works in two independent passes:
 * <ol>
 *   <li>select every eligible row and insert each into the archive store;</li>
 *   <li>delete every row matching the same predicate from the processing store.</li>
 * </ol>
 *
 * The delete is by predicate, not tied to individual insert results. If the process
 * dies between the passes, the next run archives the same rows again before deleting
 * them, so archive stores may hold duplicates sharing a natural key. They never lose a
 * row: an exception in the first pass propagates before the delete is issued.
 */
@Singleton
public class TwoPassTransitionMover implements TransitionMover {

    private static final Logger log = LoggerFactory.getLogger(TwoPassTransitionMover.class);

    private final AuditLogService auditLogService;
    private final NewRelicEmitService nrEmitService;

    @Inject
    public TwoPassTransitionMover(AuditLogService auditLogService, NewRelicEmitService nrEmitService) {
        this.auditLogService = auditLogService;
        this.nrEmitService = nrEmitService;
    }

    @Override
    public <T> TransitionCounts move(TransitionRoute<T> route, Instant watermark, boolean archivingEnabled) {
        int archived = 0;
        if (archivingEnabled) {
            archived = archive(route, watermark);
        } else {
            log.info("Archiving disabled, deleting {} without archive copy closedBefore={}",
                    route.category().label(), watermark);
        }
        int deleted = delete(route, watermark);
        return new TransitionCounts(archived, deleted);
    }

    // -----------------------------------------------------------------------
    // Passes
    // -----------------------------------------------------------------------

    private <T> int archive(TransitionRoute<T> route, Instant watermark) {
        RecordStore<T> source = route.source();
        RecordStore<T> archive = route.archive();

        List<T> eligible = source.findClosedBefore(watermark);
        log.info("Archiving {} from={} to={} eligible={} closedBefore={}",
                route.category().label(), source.storeName(), archive.storeName(), eligible.size(), watermark);

        int archived = 0;
        for (T record : eligible) {
            archive.insert(record);
            archived++;
        }

        auditLogService.record(route.category().archiveSeverity(),
                "Archived {count} {category} from {source} to {archive}",
                "count", archived,
                "category", route.category().label(),
                "source", source.storeName(),
                "archive", archive.storeName());

        reportStoreSize(archive);
        nrEmitService.emitItemsAdded(archive.storeName(), archived);
        return archived;
    }

    private <T> int delete(TransitionRoute<T> route, Instant watermark) {
        RecordStore<T> source = route.source();

        int deleted = source.deleteClosedBefore(watermark);

        auditLogService.record(AuditSeverity.INFO,
                "Deleted {count} {category} from {source}",
                "count", deleted,
                "category", route.category().label(),
                "source", source.storeName());

        reportStoreSize(source);
        nrEmitService.emitItemsRemoved(source.storeName(), deleted);
        return deleted;
    }

    /**
     * Store-size gauges are metrics only; a failed count is logged and skipped.
     */
    private void reportStoreSize(RecordStore<?> store) {
        try {
            nrEmitService.emitStoreSize(store.storeName(), store.count());
        } catch (StoreAccessException e) {
            log.warn("Could not count rows of store={} for size metric: {}", store.storeName(), e.getMessage());
        }
    }
}
