package com.petition.archive.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Plain Java bean representing a row in the {@code archive_workflow_run} table:
 * the ledger entry of one workflow invocation.
 *
 * Counts stay at zero for steps that did not run (archiving disabled, or the run
 * aborted before reaching them).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowRun {

    private String jobId;

    private String serverName;

    private String workerName;

    private WorkflowStatus status;

    /** Watermark used for the run; null when it could not be computed. */
    private Instant watermark;

    private int invalidSignaturesArchived;
    private int invalidSignaturesDeleted;
    private int orphanedValidationsArchived;
    private int orphanedValidationsDeleted;
    private int processedSignaturesArchived;
    private int processedSignaturesDeleted;
    private int processedValidationsArchived;
    private int processedValidationsDeleted;

    /** Message of the failure that aborted the run, if any. */
    private String errorMessage;

    private Instant startedAt;

    private Instant finishedAt;
}
