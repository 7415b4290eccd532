package com.petition.archive.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A validation that was matched to its signature and processed.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ProcessedValidation {

    private String vid;
    private String secretValidationKey;
    private Instant timestampReceivedValidation;
    private Instant timestampValidationClose;
    private String clientIp;
    private String petitionId;

    /** Instant at which the validation was applied to its signature. */
    private Instant timestampProcessedValidation;
}
