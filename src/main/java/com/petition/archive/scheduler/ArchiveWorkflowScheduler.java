package com.petition.archive.scheduler;

import com.petition.archive.model.WorkflowStatus;
import com.petition.archive.service.ArchiveWorkflowService;
import io.micronaut.context.annotation.Requires;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Map;
import java.util.UUID;

/**
 * Cron trigger for the archive workflow.
 *
 * <p>Runs daily at 03:30 UTC by default ({@code archive.schedule-cron}). Every trigger
 * gets a fresh job id; the workflow itself never throws, so a failed run simply
 * shows up as {@code SERVER_ERROR} in the log and the run ledger and is retried at
 * the next trigger.
 *
 * <p>Overlapping triggers (e.g. several instances sharing the same cron) are only
 * serialised when {@code archive.lock.enabled=true}.
 *
 * <p>Disable with {@code archive.scheduler.enabled=false}, e.g. when an external
 * job runner calls the REST endpoint instead.
 */
@Singleton
@Requires(property = "archive.scheduler.enabled", notEquals = "false")
public class ArchiveWorkflowScheduler {

    private static final Logger log = LoggerFactory.getLogger(ArchiveWorkflowScheduler.class);

    static final String WORKER_NAME = "scheduler";

    private final ArchiveWorkflowService archiveWorkflowService;

    @Inject
    public ArchiveWorkflowScheduler(ArchiveWorkflowService archiveWorkflowService) {
        this.archiveWorkflowService = archiveWorkflowService;
    }

    // -----------------------------------------------------------------------
    // Scheduled task
    // -----------------------------------------------------------------------

    @Scheduled(cron = "${archive.schedule-cron:0 30 3 * * *}")
    public void runScheduled() {
        String jobId = UUID.randomUUID().toString();
        log.info("ArchiveWorkflowScheduler triggering jobId={}", jobId);

        WorkflowStatus status = archiveWorkflowService.runArchiveWorkflow(jobId, serverName(), WORKER_NAME, Map.of());

        if (status != WorkflowStatus.OK) {
            log.warn("ArchiveWorkflowScheduler run did not complete jobId={} status={}", jobId, status);
        }
    }

    static String serverName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Could not resolve local host name: {}", e.getMessage());
            return "unknown";
        }
    }
}
