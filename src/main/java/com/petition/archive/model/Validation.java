package com.petition.archive.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A signer's confirmation that arrived through the validation link.
 *
 * Stored in {@code validation} while waiting to be matched with a
 * {@link PendingSignature} by {@code secretValidationKey}, and in
 * {@code orphaned_validation_archive} when no match ever turned up.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Validation {

    private String vid;

    private String secretValidationKey;

    private Instant timestampReceivedValidation;

    private Instant timestampValidationClose;

    /** Address the validation request came from. */
    private String clientIp;

    private String petitionId;
}
