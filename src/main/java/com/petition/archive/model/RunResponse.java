package com.petition.archive.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response body for {@code POST /api/archive-workflow/runs}.
 */
public record RunResponse(

        @JsonProperty("jobId")
        String jobId,

        @JsonProperty("status")
        WorkflowStatus status

) {
}
