package com.petition.archive.service;

import com.petition.archive.model.PendingSignature;
import com.petition.archive.model.ProcessedSignature;
import com.petition.archive.model.ProcessedValidation;
import com.petition.archive.model.Validation;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Fixture builders shared by the service tests.
 */
final class TestRecords {

    private TestRecords() {
    }

    static PendingSignature pendingSignature(String sid, String key, Instant validationClose) {
        return PendingSignature.builder()
                .sid(sid)
                .secretValidationKey(key)
                .sourceApiKey("api-key-1")
                .petitionId("petition-1")
                .timestampPetitionClose(validationClose.plusSeconds(86_400))
                .timestampValidationClose(validationClose)
                .email(sid + "@example.org")
                .firstName("Ada")
                .lastName("Lovelace")
                .streetAddress("1 Main Street")
                .postalCode("1000")
                .city("Brussels")
                .countryCode("BE")
                .birthDate(LocalDate.of(1990, 5, 17))
                .timestampInitiatedValidation(validationClose.minusSeconds(3_600))
                .timestampReceivedSignature(validationClose.minusSeconds(7_200))
                .build();
    }

    static Validation validation(String vid, String key, Instant validationClose) {
        return Validation.builder()
                .vid(vid)
                .secretValidationKey(key)
                .timestampReceivedValidation(validationClose.minusSeconds(600))
                .timestampValidationClose(validationClose)
                .clientIp("203.0.113.7")
                .petitionId("petition-1")
                .build();
    }

    static ProcessedSignature processedSignature(String sid, Instant validationClose) {
        return ProcessedSignature.builder()
                .sid(sid)
                .secretValidationKey("key-" + sid)
                .sourceApiKey("api-key-1")
                .petitionId("petition-1")
                .timestampValidationClose(validationClose)
                .email(sid + "@example.org")
                .countryCode("BE")
                .timestampProcessedSignature(validationClose.minusSeconds(60))
                .build();
    }

    static ProcessedValidation processedValidation(String vid, Instant validationClose) {
        return ProcessedValidation.builder()
                .vid(vid)
                .secretValidationKey("key-" + vid)
                .timestampValidationClose(validationClose)
                .petitionId("petition-1")
                .timestampProcessedValidation(validationClose.minusSeconds(60))
                .build();
    }
}
