package com.petition.archive.service;

import com.petition.archive.model.AuditEntry;
import com.petition.archive.model.AuditSeverity;
import com.petition.archive.model.PendingSignature;
import com.petition.archive.model.RecordCategory;
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

import static com.petition.archive.service.TestRecords.pendingSignature;
import static com.petition.archive.service.TestRecords.validation;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class TwoPassTransitionMoverTest {

    private static final Instant W = Instant.parse("2024-03-01T00:00:00Z");

    @Mock
    private NewRelicEmitService nrEmitService;

    private AuditLogService auditLogService;
    private TwoPassTransitionMover mover;

    private InMemoryRecordStore<PendingSignature> source;
    private InMemoryRecordStore<PendingSignature> archive;
    private TransitionRoute<PendingSignature> route;

    @BeforeEach
    void setUp() {
        auditLogService = spy(new AuditLogService());
        mover = new TwoPassTransitionMover(auditLogService, nrEmitService);

        source = new InMemoryRecordStore<>("pending_signature", PendingSignature::getTimestampValidationClose);
        archive = new InMemoryRecordStore<>("not_validated_signature_archive",
                PendingSignature::getTimestampValidationClose);
        route = new TransitionRoute<>(RecordCategory.INVALID_SIGNATURES, source, archive);
    }

    @Test
    @DisplayName("archives then deletes only records closed before the watermark")
    void movesEligibleRecords() {
        PendingSignature s1 = pendingSignature("s1", "k1", W.minusSeconds(3_600));
        PendingSignature s2 = pendingSignature("s2", "k2", W.minusSeconds(60));
        PendingSignature s3 = pendingSignature("s3", "k3", W.plusSeconds(60));
        source.with(s1, s2, s3);

        TransitionCounts counts = mover.move(route, W, true);

        assertThat(counts).isEqualTo(new TransitionCounts(2, 2));
        assertThat(archive.rows()).containsExactlyInAnyOrder(s1, s2);
        assertThat(source.rows()).containsExactly(s3);
    }

    @Test
    @DisplayName("a record closing exactly at the watermark stays in processing")
    void watermarkIsExclusive() {
        PendingSignature atW = pendingSignature("s1", "k1", W);
        source.with(atW);

        TransitionCounts counts = mover.move(route, W, true);

        assertThat(counts).isEqualTo(new TransitionCounts(0, 0));
        assertThat(source.rows()).containsExactly(atW);
        assertThat(archive.rows()).isEmpty();
    }

    @Test
    @DisplayName("archived records keep every field")
    void archivedRecordIsFieldEqual() {
        PendingSignature s1 = pendingSignature("s1", "k1", W.minusSeconds(10));
        source.with(s1);

        mover.move(route, W, true);

        PendingSignature copy = archive.rows().get(0);
        assertThat(copy).usingRecursiveComparison().isEqualTo(s1);
    }

    @Test
    @DisplayName("a second run with the same watermark changes nothing")
    void idempotent() {
        source.with(pendingSignature("s1", "k1", W.minusSeconds(10)),
                pendingSignature("s2", "k2", W.plusSeconds(10)));

        mover.move(route, W, true);
        List<PendingSignature> sourceAfterFirst = source.rows();
        List<PendingSignature> archiveAfterFirst = archive.rows();

        TransitionCounts second = mover.move(route, W, true);

        assertThat(second).isEqualTo(new TransitionCounts(0, 0));
        assertThat(source.rows()).isEqualTo(sourceAfterFirst);
        assertThat(archive.rows()).isEqualTo(archiveAfterFirst);
    }

    @Test
    @DisplayName("with archiving disabled records are deleted without a copy")
    void archivingDisabled() {
        source.with(pendingSignature("s1", "k1", W.minusSeconds(10)));

        TransitionCounts counts = mover.move(route, W, false);

        assertThat(counts).isEqualTo(new TransitionCounts(0, 1));
        assertThat(source.rows()).isEmpty();
        assertThat(archive.rows()).isEmpty();
    }

    @Test
    @DisplayName("an archive failure propagates and nothing is deleted")
    void archiveFailureSkipsDelete() {
        PendingSignature s1 = pendingSignature("s1", "k1", W.minusSeconds(20));
        PendingSignature s2 = pendingSignature("s2", "k2", W.minusSeconds(10));
        source.with(s1, s2);
        archive.failInsertAt(1);

        assertThatThrownBy(() -> mover.move(route, W, true)).isInstanceOf(StoreAccessException.class);

        assertThat(source.rows()).containsExactly(s1, s2);
        assertThat(archive.rows()).containsExactly(s1);
    }

    @Test
    @DisplayName("re-running after a partial archive duplicates rather than loses records")
    void crashBetweenPassesDuplicates() {
        PendingSignature s1 = pendingSignature("s1", "k1", W.minusSeconds(10));
        source.with(s1);
        // archive pass of an earlier, interrupted run
        archive.insert(s1);

        mover.move(route, W, true);

        assertThat(archive.rows()).containsExactly(s1, s1);
        assertThat(source.rows()).isEmpty();
    }

    @Test
    @DisplayName("audits the archive pass at the category severity and the delete pass at info")
    void auditsBothPasses() {
        source.with(pendingSignature("s1", "k1", W.minusSeconds(10)));

        mover.move(route, W, true);

        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(auditLogService, atLeastOnce()).record(captor.capture());
        List<AuditEntry> entries = captor.getAllValues();

        assertThat(entries).hasSize(2);
        assertThat(entries.get(0).severity()).isEqualTo(AuditSeverity.INFO);
        assertThat(entries.get(0).render())
                .isEqualTo("Archived 1 invalid signatures from pending_signature to not_validated_signature_archive");
        assertThat(entries.get(1).render()).isEqualTo("Deleted 1 invalid signatures from pending_signature");
    }

    @Test
    @DisplayName("zero counts are still audited")
    void auditsZeroCounts() {
        mover.move(route, W, true);

        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(auditLogService, atLeastOnce()).record(captor.capture());

        assertThat(captor.getAllValues()).extracting(e -> e.fields().get("count")).containsExactly(0, 0);
    }

    @Test
    @DisplayName("orphaned validation category archives at alert severity")
    void orphanCategoryIsAlert() {
        InMemoryValidationStore validations = new InMemoryValidationStore("validation",
                new InMemoryRecordStore<>("pending_signature", PendingSignature::getTimestampValidationClose));
        validations.with(validation("v1", "k1", W.minusSeconds(10)));
        InMemoryRecordStore<Validation> orphanArchive =
                new InMemoryRecordStore<>("orphaned_validation_archive", Validation::getTimestampValidationClose);

        mover.move(new TransitionRoute<>(RecordCategory.ORPHANED_VALIDATIONS, validations, orphanArchive), W, true);

        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(auditLogService, atLeastOnce()).record(captor.capture());
        assertThat(captor.getAllValues().get(0).severity()).isEqualTo(AuditSeverity.ALERT);
    }

    @Test
    @DisplayName("emits item counters for the archive and the source")
    void emitsMetrics() {
        source.with(pendingSignature("s1", "k1", W.minusSeconds(10)));

        mover.move(route, W, true);

        verify(nrEmitService).emitItemsAdded("not_validated_signature_archive", 1);
        verify(nrEmitService).emitItemsRemoved("pending_signature", 1);
        verify(nrEmitService).emitStoreSize("not_validated_signature_archive", 1L);
        verify(nrEmitService).emitStoreSize("pending_signature", 0L);
    }
}
