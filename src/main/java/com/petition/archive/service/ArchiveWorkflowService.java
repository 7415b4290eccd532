package com.petition.archive.service;

import com.petition.archive.config.WorkflowSettings;
import com.petition.archive.model.PendingSignature;
import com.petition.archive.model.ProcessedSignature;
import com.petition.archive.model.ProcessedValidation;
import com.petition.archive.model.Validation;
import com.petition.archive.model.WorkflowConfig;
import com.petition.archive.model.WorkflowRun;
import com.petition.archive.model.WorkflowStatus;
import com.petition.archive.repository.WorkflowRunRepository;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the archive workflow: one sequential pass over the four record categories
 * against a single watermark.
 *
 * <p>Steps, in order:
 * <ol>
 *   <li>Resolve the configuration snapshot and compute the watermark. A failure here
 *       aborts the run before any store is touched.</li>
 *   <li>Take the orphaned validation snapshot while every pending signature closed
 *       before the watermark is still present to match against.</li>
 *   <li>Invalid signatures: archive (if enabled), then delete.</li>
 *   <li>Orphaned validations: archive the snapshot and delete exactly the archived
 *       keys, or, with archiving disabled, delete the snapshot directly.</li>
 *   <li>Processed signatures: archive (if enabled), then delete.</li>
 *   <li>Processed validations: archive (if enabled), then delete.</li>
 * </ol>
 *
 * Each step commits on its own. A failure stops the run at that step; earlier steps
 * stay committed and the next run resumes from the same watermark logic. There is
 * no retry here: the invoking layer decides whether to re-run on
 * {@link WorkflowStatus#SERVER_ERROR}.
 *
 * <p>Every run is recorded in the run ledger and reported to New Relic. Neither
 * failure changes the returned status.
 */
@Singleton
public class ArchiveWorkflowService {

    private static final Logger log = LoggerFactory.getLogger(ArchiveWorkflowService.class);

    private final WorkflowSettings workflowSettings;
    private final WatermarkCalculator watermarkCalculator;
    private final TransitionMover transitionMover;
    private final OrphanReconciler orphanReconciler;
    private final TransitionRoute<PendingSignature> invalidSignatures;
    private final TransitionRoute<ProcessedSignature> processedSignatures;
    private final TransitionRoute<ProcessedValidation> processedValidations;
    private final WorkflowLockService lockService;
    private final WorkflowRunRepository runRepository;
    private final NewRelicEmitService nrEmitService;
    private final Clock clock;

    private final AtomicReference<WorkflowRun> lastRun = new AtomicReference<>();

    @Inject
    public ArchiveWorkflowService(WorkflowSettings workflowSettings,
                                  WatermarkCalculator watermarkCalculator,
                                  TransitionMover transitionMover,
                                  OrphanReconciler orphanReconciler,
                                  @Named("invalidSignatures") TransitionRoute<PendingSignature> invalidSignatures,
                                  @Named("processedSignatures") TransitionRoute<ProcessedSignature> processedSignatures,
                                  @Named("processedValidations") TransitionRoute<ProcessedValidation> processedValidations,
                                  WorkflowLockService lockService,
                                  WorkflowRunRepository runRepository,
                                  NewRelicEmitService nrEmitService,
                                  Clock clock) {
        this.workflowSettings = workflowSettings;
        this.watermarkCalculator = watermarkCalculator;
        this.transitionMover = transitionMover;
        this.orphanReconciler = orphanReconciler;
        this.invalidSignatures = invalidSignatures;
        this.processedSignatures = processedSignatures;
        this.processedValidations = processedValidations;
        this.lockService = lockService;
        this.runRepository = runRepository;
        this.nrEmitService = nrEmitService;
        this.clock = clock;
    }

    // -----------------------------------------------------------------------
    // Invocation
    // -----------------------------------------------------------------------

    /**
     * Runs the workflow once.
     *
     * @param jobId      identifier of this invocation
     * @param serverName host the invocation runs on
     * @param workerName worker or trigger that started the invocation
     * @param options    reserved for future extension; currently ignored
     * @return {@link WorkflowStatus#OK} when every step completed, otherwise
     *         {@link WorkflowStatus#SERVER_ERROR}
     */
    public WorkflowStatus runArchiveWorkflow(String jobId,
                                             String serverName,
                                             String workerName,
                                             Map<String, Object> options) {
        WorkflowRun run = WorkflowRun.builder()
                .jobId(jobId)
                .serverName(serverName)
                .workerName(workerName)
                .startedAt(clock.instant())
                .build();

        log.info("Archive workflow starting jobId={} server={} worker={} options={}",
                jobId, serverName, workerName, options == null ? 0 : options.size());

        WorkflowStatus status;
        try (WorkflowLockService.WorkflowLock ignored = lockService.acquire(jobId)) {
            runSteps(run);
            status = WorkflowStatus.OK;
        } catch (WorkflowLockUnavailableException e) {
            log.warn("Archive workflow skipped jobId={}: {}", jobId, e.getMessage());
            run.setErrorMessage(e.getMessage());
            status = WorkflowStatus.SERVER_ERROR;
        } catch (Exception e) {
            log.error("Archive workflow failed jobId={} watermark={}: {}",
                    jobId, run.getWatermark(), e.getMessage(), e);
            run.setErrorMessage(e.getMessage());
            status = WorkflowStatus.SERVER_ERROR;
        }

        run.setStatus(status);
        run.setFinishedAt(clock.instant());
        lastRun.set(run);
        recordRun(run);
        nrEmitService.emitWorkflowResult(run);

        log.info("Archive workflow finished jobId={} status={} watermark={} "
                        + "invalid={}/{} orphaned={}/{} processedSignatures={}/{} processedValidations={}/{}",
                jobId, status, run.getWatermark(),
                run.getInvalidSignaturesArchived(), run.getInvalidSignaturesDeleted(),
                run.getOrphanedValidationsArchived(), run.getOrphanedValidationsDeleted(),
                run.getProcessedSignaturesArchived(), run.getProcessedSignaturesDeleted(),
                run.getProcessedValidationsArchived(), run.getProcessedValidationsDeleted());
        return status;
    }

    /**
     * @return the most recent run finished by this instance, if any
     */
    public Optional<WorkflowRun> getLastRun() {
        return Optional.ofNullable(lastRun.get());
    }

    // -----------------------------------------------------------------------
    // Steps
    // -----------------------------------------------------------------------

    private void runSteps(WorkflowRun run) {
        WorkflowConfig config = workflowSettings.resolve();
        Instant watermark = watermarkCalculator.computeWatermark(config);
        run.setWatermark(watermark);

        boolean archiving = config.archivingEnabled();

        // must precede the invalid signature delete, which removes the matches
        List<Validation> orphans = orphanReconciler.snapshotOrphans(watermark);

        TransitionCounts invalid = transitionMover.move(invalidSignatures, watermark, archiving);
        run.setInvalidSignaturesArchived(invalid.archived());
        run.setInvalidSignaturesDeleted(invalid.deleted());

        if (archiving) {
            Set<String> archivedKeys = orphanReconciler.archiveOrphans(orphans);
            run.setOrphanedValidationsArchived(archivedKeys.size());
            run.setOrphanedValidationsDeleted(orphanReconciler.deleteOrphans(watermark, archivedKeys));
        } else {
            run.setOrphanedValidationsDeleted(orphanReconciler.deleteUnarchivedOrphans(watermark, orphans));
        }

        TransitionCounts signatures = transitionMover.move(processedSignatures, watermark, archiving);
        run.setProcessedSignaturesArchived(signatures.archived());
        run.setProcessedSignaturesDeleted(signatures.deleted());

        TransitionCounts validations = transitionMover.move(processedValidations, watermark, archiving);
        run.setProcessedValidationsArchived(validations.archived());
        run.setProcessedValidationsDeleted(validations.deleted());
    }

    private void recordRun(WorkflowRun run) {
        try {
            runRepository.save(run);
        } catch (Exception e) {
            log.error("Failed to record archive workflow run jobId={} status={}: {}",
                    run.getJobId(), run.getStatus(), e.getMessage(), e);
        }
    }
}
