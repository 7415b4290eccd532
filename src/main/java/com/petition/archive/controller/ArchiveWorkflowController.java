package com.petition.archive.controller;

import com.petition.archive.model.RunRequest;
import com.petition.archive.model.RunResponse;
import com.petition.archive.model.WorkflowRun;
import com.petition.archive.model.WorkflowStatus;
import com.petition.archive.repository.WorkflowRunRepository;
import com.petition.archive.service.ArchiveWorkflowService;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * REST controller for triggering and inspecting archive workflow runs.
 *
 * Base path: {@code /api/archive-workflow}
 *
 * Endpoints:
 * <ul>
 *   <li>{@code POST /api/archive-workflow/runs}          - run the workflow synchronously</li>
 *   <li>{@code GET  /api/archive-workflow/runs/{jobId}}  - latest ledger entry for a job id</li>
 * </ul>
 *
 * Runs block on JDBC, so both endpoints execute on the blocking I/O pool.
 */
@Controller("/api/archive-workflow")
@ExecuteOn(TaskExecutors.BLOCKING)
public class ArchiveWorkflowController {

    private static final Logger log = LoggerFactory.getLogger(ArchiveWorkflowController.class);

    static final String DEFAULT_SERVER = "api";
    static final String DEFAULT_WORKER = "api";

    @Inject
    private ArchiveWorkflowService archiveWorkflowService;

    @Inject
    private WorkflowRunRepository runRepository;

    // -----------------------------------------------------------------------
    // POST /api/archive-workflow/runs
    // -----------------------------------------------------------------------

    /**
     * Runs the workflow and maps its status onto the HTTP status of the response.
     *
     * @param request optional body; missing fields are generated or defaulted
     * @return 200 with the job id on success, 500 with the job id on failure
     */
    @Post("/runs")
    public HttpResponse<RunResponse> run(@Body @Nullable @Valid RunRequest request) {
        String jobId = request == null || isBlank(request.jobId()) ? UUID.randomUUID().toString() : request.jobId();
        String serverName = request == null || isBlank(request.serverName()) ? DEFAULT_SERVER : request.serverName();
        String workerName = request == null || isBlank(request.workerName()) ? DEFAULT_WORKER : request.workerName();
        Map<String, Object> options = request == null || request.options() == null ? Map.of() : request.options();

        log.info("POST /runs jobId={} server={} worker={}", jobId, serverName, workerName);
        WorkflowStatus status = archiveWorkflowService.runArchiveWorkflow(jobId, serverName, workerName, options);

        return HttpResponse.<RunResponse>status(HttpStatus.valueOf(status.httpCode()))
                .body(new RunResponse(jobId, status));
    }

    // -----------------------------------------------------------------------
    // GET /api/archive-workflow/runs/{jobId}
    // -----------------------------------------------------------------------

    /**
     * Returns the most recent ledger entry for a job id.
     *
     * @param jobId the job identifier from the URL path
     * @return HTTP 200 with the {@link WorkflowRun}, or HTTP 404
     */
    @Get("/runs/{jobId}")
    public HttpResponse<WorkflowRun> getRun(@PathVariable String jobId) {
        log.info("GET /runs/{}", jobId);
        Optional<WorkflowRun> run = runRepository.findLatestByJobId(jobId);
        if (run.isEmpty()) {
            log.info("Run not found for jobId={}", jobId);
            return HttpResponse.notFound();
        }
        return HttpResponse.ok(run.get());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
