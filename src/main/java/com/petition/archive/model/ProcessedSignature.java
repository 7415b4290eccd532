package com.petition.archive.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A signature that completed its workflow (validated and counted, or discarded)
 * and is waiting for post-closure archival.
 *
 * Carries every {@link PendingSignature} field plus the processing instant.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ProcessedSignature {

    private String sid;
    private String secretValidationKey;
    private String sourceApiKey;
    private String petitionId;
    private Instant timestampPetitionClose;
    private Instant timestampValidationClose;
    private String email;
    private String firstName;
    private String lastName;
    private String streetAddress;
    private String postalCode;
    private String city;
    private String countryCode;
    private LocalDate birthDate;
    private Instant timestampInitiatedValidation;
    private Instant timestampReceivedSignature;

    /** Instant at which the signature was counted or discarded. */
    private Instant timestampProcessedSignature;
}
