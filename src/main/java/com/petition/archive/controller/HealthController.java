package com.petition.archive.controller;

import com.petition.archive.model.WorkflowRun;
import com.petition.archive.service.ArchiveWorkflowService;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import jakarta.inject.Inject;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Liveness probe endpoint.
 *
 * Returns {@code {"status":"UP"}} plus the status, job id and finish time of the
 * last archive run this instance executed, so an operator can spot a failing
 * workflow without reading the logs. A failed run does not make the probe fail:
 * the process itself is still healthy.
 */
@Controller("/health")
public class HealthController {

    @Inject
    private ArchiveWorkflowService archiveWorkflowService;

    /**
     * @return status map with optional {@code lastRun*} entries
     */
    @Get
    public Map<String, String> health() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", "UP");

        Optional<WorkflowRun> lastRun = archiveWorkflowService.getLastRun();
        lastRun.ifPresent(run -> {
            body.put("lastRunJobId", run.getJobId());
            body.put("lastRunStatus", run.getStatus().name());
            body.put("lastRunFinishedAt", String.valueOf(run.getFinishedAt()));
        });
        return body;
    }
}
