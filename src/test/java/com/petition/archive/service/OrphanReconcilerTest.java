package com.petition.archive.service;

import com.petition.archive.model.AuditEntry;
import com.petition.archive.model.AuditSeverity;
import com.petition.archive.model.PendingSignature;
import com.petition.archive.model.Validation;
import com.petition.archive.repository.InMemoryRecordStore;
import com.petition.archive.repository.InMemoryValidationStore;
import com.petition.archive.repository.StoreAccessException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static com.petition.archive.service.TestRecords.pendingSignature;
import static com.petition.archive.service.TestRecords.validation;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class OrphanReconcilerTest {

    private static final Instant W = Instant.parse("2024-03-01T00:00:00Z");

    @Mock
    private NewRelicEmitService nrEmitService;

    private AuditLogService auditLogService;
    private InMemoryRecordStore<PendingSignature> pendingSignatures;
    private InMemoryValidationStore validations;
    private InMemoryRecordStore<Validation> orphanArchive;
    private OrphanReconciler reconciler;

    @BeforeEach
    void setUp() {
        auditLogService = spy(new AuditLogService());
        pendingSignatures = new InMemoryRecordStore<>("pending_signature",
                PendingSignature::getTimestampValidationClose);
        validations = new InMemoryValidationStore("validation", pendingSignatures);
        orphanArchive = new InMemoryRecordStore<>("orphaned_validation_archive",
                Validation::getTimestampValidationClose);
        reconciler = new OrphanReconciler(validations, orphanArchive, auditLogService, nrEmitService);
    }

    @Test
    @DisplayName("a validation whose signature arrived later is not an orphan")
    void matchedValidationIsKept() {
        Validation v1 = validation("v1", "K", W.minusSeconds(10));
        validations.with(v1);
        pendingSignatures.with(pendingSignature("s1", "K", W.minusSeconds(9)));

        Set<String> archived = reconciler.archiveOrphans(W);
        int deleted = reconciler.deleteOrphans(W, archived);

        assertThat(archived).isEmpty();
        assertThat(deleted).isZero();
        assertThat(validations.rows()).containsExactly(v1);
        assertThat(orphanArchive.rows()).isEmpty();
    }

    @Test
    @DisplayName("an unmatched validation is archived and exactly its key is deleted")
    void orphanIsArchivedAndDeleted() {
        Validation v2 = validation("v2", "K2", W.minusSeconds(10));
        Validation matched = validation("v1", "K", W.minusSeconds(10));
        validations.with(v2, matched);
        pendingSignatures.with(pendingSignature("s1", "K", W.minusSeconds(10)));

        Set<String> archived = reconciler.archiveOrphans(W);
        int deleted = reconciler.deleteOrphans(W, archived);

        assertThat(archived).containsExactly("K2");
        assertThat(deleted).isEqualTo(1);
        assertThat(orphanArchive.rows()).containsExactly(v2);
        assertThat(validations.rows()).containsExactly(matched);
    }

    @Test
    @DisplayName("unmatched validations closing after the watermark are left alone")
    void recentUnmatchedValidationIsNotAnOrphan() {
        Validation recent = validation("v3", "K3", W.plusSeconds(10));
        validations.with(recent);

        assertThat(reconciler.findOrphans(W)).isEmpty();
        assertThat(reconciler.deleteOrphans(W, null)).isZero();
        assertThat(validations.rows()).containsExactly(recent);
    }

    @Test
    @DisplayName("an unmatched validation is only flagged once a later watermark passes it")
    void flaggedOnlyAfterWatermarkPasses() {
        validations.with(validation("v5", "K5", W.plusSeconds(30)));

        assertThat(reconciler.findOrphans(W)).isEmpty();
        assertThat(reconciler.findOrphans(W)).isEmpty();
        assertThat(reconciler.findOrphans(W.plusSeconds(60))).containsExactly("K5");
    }

    @Test
    @DisplayName("archiving a snapshot ignores matches removed after it was taken")
    void snapshotSurvivesLaterSignatureDelete() {
        Validation v1 = validation("v1", "K", W.minusSeconds(2));
        Validation v2 = validation("v2", "K2", W.minusSeconds(2));
        validations.with(v1, v2);
        pendingSignatures.with(pendingSignature("s1", "K", W.minusSeconds(1)));

        List<Validation> snapshot = reconciler.snapshotOrphans(W);
        pendingSignatures.deleteClosedBefore(W);
        Set<String> archived = reconciler.archiveOrphans(snapshot);
        int deleted = reconciler.deleteOrphans(W, archived);

        assertThat(archived).containsExactly("K2");
        assertThat(deleted).isEqualTo(1);
        assertThat(orphanArchive.rows()).containsExactly(v2);
        assertThat(validations.rows()).containsExactly(v1);
    }

    @Test
    @DisplayName("deleting an unarchived snapshot only removes its keys and alerts")
    void deleteUnarchivedSnapshot() {
        Validation v1 = validation("v1", "K", W.minusSeconds(2));
        Validation v2 = validation("v2", "K2", W.minusSeconds(2));
        validations.with(v1, v2);
        pendingSignatures.with(pendingSignature("s1", "K", W.minusSeconds(1)));

        List<Validation> snapshot = reconciler.snapshotOrphans(W);
        pendingSignatures.deleteClosedBefore(W);
        int deleted = reconciler.deleteUnarchivedOrphans(W, snapshot);

        assertThat(deleted).isEqualTo(1);
        assertThat(validations.rows()).containsExactly(v1);
        assertThat(orphanArchive.rows()).isEmpty();

        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(auditLogService, atLeastOnce()).record(captor.capture());
        assertThat(captor.getValue().severity()).isEqualTo(AuditSeverity.ALERT);
    }

    @Test
    @DisplayName("deletion never reaches beyond the archived key set")
    void deletionLimitedToArchivedKeys() {
        validations.with(validation("v2", "K2", W.minusSeconds(10)),
                validation("v4", "K4", W.minusSeconds(10)));

        int deleted = reconciler.deleteOrphans(W, Set.of("K2"));

        assertThat(deleted).isEqualTo(1);
        assertThat(validations.rows()).extracting(Validation::getSecretValidationKey).containsExactly("K4");
    }

    @Test
    @DisplayName("an empty key set deletes nothing")
    void emptyKeySet() {
        validations.with(validation("v2", "K2", W.minusSeconds(10)));

        assertThat(reconciler.deleteOrphans(W, Set.of())).isZero();
        assertThat(validations.rows()).hasSize(1);
    }

    @Test
    @DisplayName("with archiving disabled orphans are recomputed and deleted with an alert")
    void directDeleteAlerts() {
        validations.with(validation("v2", "K2", W.minusSeconds(10)));

        int deleted = reconciler.deleteOrphans(W, null);

        assertThat(deleted).isEqualTo(1);
        assertThat(orphanArchive.rows()).isEmpty();

        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(auditLogService, atLeastOnce()).record(captor.capture());
        assertThat(captor.getValue().severity()).isEqualTo(AuditSeverity.ALERT);
        assertThat(captor.getValue().render())
                .isEqualTo("Deleted 1 orphaned validations (1 keys) from validation");
    }

    @Test
    @DisplayName("archiving orphans is audited at alert, the following delete at info")
    void auditSeverities() {
        validations.with(validation("v2", "K2", W.minusSeconds(10)));

        reconciler.deleteOrphans(W, reconciler.archiveOrphans(W));

        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(auditLogService, atLeastOnce()).record(captor.capture());
        assertThat(captor.getAllValues()).extracting(AuditEntry::severity)
                .containsExactly(AuditSeverity.ALERT, AuditSeverity.INFO);
    }

    @Test
    @DisplayName("an archive failure propagates before any validation is deleted")
    void archiveFailure() {
        validations.with(validation("v2", "K2", W.minusSeconds(10)));
        orphanArchive.failInsertAt(0);

        assertThatThrownBy(() -> reconciler.archiveOrphans(W)).isInstanceOf(StoreAccessException.class);
        assertThat(validations.rows()).hasSize(1);
    }

    @Test
    @DisplayName("running twice archives each orphan once")
    void idempotent() {
        validations.with(validation("v2", "K2", W.minusSeconds(10)));

        reconciler.deleteOrphans(W, reconciler.archiveOrphans(W));
        Set<String> second = reconciler.archiveOrphans(W);

        assertThat(second).isEmpty();
        assertThat(reconciler.deleteOrphans(W, second)).isZero();
        assertThat(orphanArchive.rows()).hasSize(1);
    }
}
