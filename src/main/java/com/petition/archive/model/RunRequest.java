package com.petition.archive.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;

import java.util.Map;

/**
 * Inbound payload for {@code POST /api/archive-workflow/runs}.
 *
 * Every field is optional; missing identifiers are generated by the controller.
 */
public record RunRequest(

        /**
         * Caller-chosen job identifier, used to look the run up afterwards.
         */
        @Size(max = 128, message = "jobId must be at most 128 characters")
        @JsonProperty("jobId")
        String jobId,

        @Size(max = 255, message = "serverName must be at most 255 characters")
        @JsonProperty("serverName")
        String serverName,

        @Size(max = 255, message = "workerName must be at most 255 characters")
        @JsonProperty("workerName")
        String workerName,

        /**
         * Reserved for future extension; passed through to the workflow untouched.
         */
        @JsonProperty("options")
        Map<String, Object> options

) {
}
