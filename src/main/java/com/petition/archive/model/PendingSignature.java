package com.petition.archive.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Plain Java bean representing a signature that has been submitted but whose
 * validation has not completed.
 *
 * The same shape is stored in two places:
 * <ul>
 *   <li>{@code pending_signature} (processing database) while the signature is live</li>
 *   <li>{@code not_validated_signature_archive} (archive database) once the
 *       validation window has closed without a validation arriving</li>
 * </ul>
 *
 * Intentionally kept free of ORM annotations; persistence is handled via plain
 * JDBC in {@link com.petition.archive.repository.PendingSignatureRepository}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PendingSignature {

    /** Signature identifier assigned at intake. */
    private String sid;

    /** Secret key shared with the matching validation (sent to the signer by e-mail). */
    private String secretValidationKey;

    /** API key of the petition site that submitted the signature. */
    private String sourceApiKey;

    private String petitionId;

    /** Instant at which the petition closes for new signatures. */
    private Instant timestampPetitionClose;

    /** Instant after which the signature can no longer be validated. */
    private Instant timestampValidationClose;

    // Personal fields as entered by the signer
    private String email;
    private String firstName;
    private String lastName;
    private String streetAddress;
    private String postalCode;
    private String city;
    private String countryCode;
    private LocalDate birthDate;

    /** Instant at which the validation e-mail was sent. */
    private Instant timestampInitiatedValidation;

    /** Instant at which the signature reached the intake queue. */
    private Instant timestampReceivedSignature;
}
