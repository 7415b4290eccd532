package com.petition.archive.service;

import com.petition.archive.model.AuditSeverity;
import com.petition.archive.model.RecordCategory;
import com.petition.archive.model.Validation;
import com.petition.archive.repository.RecordStore;
import com.petition.archive.repository.StoreAccessException;
import com.petition.archive.repository.ValidationStore;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Detects, archives and deletes orphaned validations: validations for which no
 * pending signature shares the {@code secretValidationKey}.
 *
 * <p>Only validations closed before the watermark are considered. Signature intake
 * and validation intake are separate queues that are neither synchronised nor
 * strictly ordered, so a validation may legitimately arrive before its signature.
 * Before the watermark a missing match says nothing; after it, both queues have
 * drained past the validation's window and an unmatched validation points to
 * tampering or a stale or forged validation link. Orphans are therefore audited at
 * {@link AuditSeverity#ALERT}.
 *
 * <p>The workflow takes the orphan set with {@link #snapshotOrphans(Instant)} before
 * any pending signature is deleted, and archives and deletes from that snapshot.
 * Evaluating the anti-join after the invalid signature step would lose every match
 * that step removed.
 *
 * <p>When archiving is enabled, deletion is restricted to the keys returned by
 * {@link #archiveOrphans(List)}; a validation that failed to archive is never
 * deleted.
 */
@Singleton
public class OrphanReconciler {

    private static final Logger log = LoggerFactory.getLogger(OrphanReconciler.class);

    private final ValidationStore validationStore;
    private final RecordStore<Validation> orphanArchive;
    private final AuditLogService auditLogService;
    private final NewRelicEmitService nrEmitService;

    @Inject
    public OrphanReconciler(ValidationStore validationStore,
                            @Named("orphanedValidationArchive") RecordStore<Validation> orphanArchive,
                            AuditLogService auditLogService,
                            NewRelicEmitService nrEmitService) {
        this.validationStore = validationStore;
        this.orphanArchive = orphanArchive;
        this.auditLogService = auditLogService;
        this.nrEmitService = nrEmitService;
    }

    /**
     * Finds the keys of orphaned validations closed before the watermark.
     *
     * @param watermark exclusive upper bound on {@code timestampValidationClose}
     * @return secret validation keys of the orphans, in close order
     */
    public Set<String> findOrphans(Instant watermark) {
        return keysOf(snapshotOrphans(watermark));
    }

    /**
     * Evaluates the orphan anti-join once and returns the full records.
     *
     * @param watermark exclusive upper bound on {@code timestampValidationClose}
     * @return orphaned validations closed before the watermark, in close order
     */
    public List<Validation> snapshotOrphans(Instant watermark) {
        List<Validation> orphans = validationStore.findOrphansClosedBefore(watermark);
        log.info("Orphan snapshot taken orphans={} closedBefore={}", orphans.size(), watermark);
        return List.copyOf(orphans);
    }

    /**
     * Copies every orphaned validation closed before the watermark into the orphan
     * archive.
     *
     * @param watermark exclusive upper bound on {@code timestampValidationClose}
     * @return keys of the validations that were archived
     * @throws StoreAccessException if the query or an insert fails; nothing is returned
     *         and the caller must not delete
     */
    public Set<String> archiveOrphans(Instant watermark) {
        return archiveOrphans(snapshotOrphans(watermark));
    }

    /**
     * Copies the given orphan snapshot into the orphan archive.
     *
     * @param orphans result of {@link #snapshotOrphans(Instant)}
     * @return keys of the validations that were archived
     * @throws StoreAccessException if an insert fails; the caller must not delete
     */
    public Set<String> archiveOrphans(List<Validation> orphans) {
        Set<String> archivedKeys = new LinkedHashSet<>();
        for (Validation orphan : orphans) {
            orphanArchive.insert(orphan);
            archivedKeys.add(orphan.getSecretValidationKey());
        }

        auditLogService.record(RecordCategory.ORPHANED_VALIDATIONS.archiveSeverity(),
                "Archived {count} {category} ({keys} keys) from {source} to {archive}",
                "count", orphans.size(),
                "keys", archivedKeys.size(),
                "category", RecordCategory.ORPHANED_VALIDATIONS.label(),
                "source", validationStore.storeName(),
                "archive", orphanArchive.storeName());

        reportStoreSize(orphanArchive);
        nrEmitService.emitItemsAdded(orphanArchive.storeName(), orphans.size());
        return Collections.unmodifiableSet(archivedKeys);
    }

    /**
     * Deletes orphaned validations closed before the watermark.
     *
     * @param watermark    exclusive upper bound on {@code timestampValidationClose}
     * @param archivedKeys keys returned by {@link #archiveOrphans(Instant)}, or {@code null}
     *                     when archiving is disabled, in which case the orphans are
     *                     recomputed and deleted directly
     * @return number of validation rows deleted; zero when there is nothing to delete
     */
    public int deleteOrphans(Instant watermark, Set<String> archivedKeys) {
        if (archivedKeys == null) {
            return deleteUnarchivedOrphans(watermark, snapshotOrphans(watermark));
        }
        return delete(watermark, archivedKeys, AuditSeverity.INFO);
    }

    /**
     * Deletes an orphan snapshot without archiving it, for runs with archiving disabled.
     *
     * @param watermark exclusive upper bound on {@code timestampValidationClose}
     * @param orphans   result of {@link #snapshotOrphans(Instant)}
     * @return number of validation rows deleted
     */
    public int deleteUnarchivedOrphans(Instant watermark, List<Validation> orphans) {
        Set<String> keys = keysOf(orphans);
        log.info("Archiving disabled, deleting orphaned validations directly keys={} closedBefore={}",
                keys.size(), watermark);
        // nothing was archived, so this is where the orphans get reported
        return delete(watermark, keys, RecordCategory.ORPHANED_VALIDATIONS.archiveSeverity());
    }

    // -----------------------------------------------------------------------
    // Private helpers
    // -----------------------------------------------------------------------

    private int delete(Instant watermark, Set<String> keys, AuditSeverity severity) {
        int deleted = keys.isEmpty() ? 0 : validationStore.deleteByKeysClosedBefore(keys, watermark);

        auditLogService.record(severity,
                "Deleted {count} {category} ({keys} keys) from {source}",
                "count", deleted,
                "keys", keys.size(),
                "category", RecordCategory.ORPHANED_VALIDATIONS.label(),
                "source", validationStore.storeName());

        reportStoreSize(validationStore);
        nrEmitService.emitItemsRemoved(validationStore.storeName(), deleted);
        return deleted;
    }

    private static Set<String> keysOf(List<Validation> validations) {
        Set<String> keys = new LinkedHashSet<>();
        for (Validation v : validations) {
            keys.add(v.getSecretValidationKey());
        }
        return Collections.unmodifiableSet(keys);
    }

    private void reportStoreSize(RecordStore<?> store) {
        try {
            nrEmitService.emitStoreSize(store.storeName(), store.count());
        } catch (StoreAccessException e) {
            log.warn("Could not count rows of store={} for size metric: {}", store.storeName(), e.getMessage());
        }
    }
}
