package com.petition.archive.model;

import java.time.Duration;
import java.util.List;

/**
 * Immutable configuration snapshot for a single workflow invocation.
 *
 * Resolved once at the start of a run by
 * {@link com.petition.archive.config.WorkflowSettings#resolve()} and passed
 * explicitly to every step, so a property change mid-run never splits a run
 * between two behaviours.
 *
 * @param archivingEnabled         whether records are copied to the archive before deletion
 * @param minimumSignatureLifetime minimum age before any record may be treated as closed
 * @param requiredQueues           intake queues whose drain state bounds the watermark
 */
public record WorkflowConfig(
        boolean archivingEnabled,
        Duration minimumSignatureLifetime,
        List<String> requiredQueues
) {

    public WorkflowConfig {
        requiredQueues = List.copyOf(requiredQueues);
    }
}
