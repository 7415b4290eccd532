package com.petition.archive.config;

import com.petition.archive.model.PendingSignature;
import com.petition.archive.model.ProcessedSignature;
import com.petition.archive.model.ProcessedValidation;
import com.petition.archive.model.RecordCategory;
import com.petition.archive.model.Validation;
import com.petition.archive.repository.PendingSignatureRepository;
import com.petition.archive.repository.PendingValidationRepository;
import com.petition.archive.repository.ProcessedSignatureRepository;
import com.petition.archive.repository.ProcessedValidationRepository;
import com.petition.archive.repository.RecordStore;
import com.petition.archive.repository.ValidationRepository;
import com.petition.archive.repository.ValidationStore;
import com.petition.archive.service.TransitionRoute;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Named;
import jakarta.inject.Singleton;

import javax.sql.DataSource;
import java.time.Duration;

/**
 * Wires the eight record stores onto their databases.
 *
 * The unqualified {@link DataSource} is the processing database
 * ({@code datasources.default}); the archive tables live behind
 * {@code datasources.archive}. Each transition route receives explicit handles for
 * both sides instead of switching a shared connection between databases.
 */
@Factory
public class RecordStoreFactory {

    // Processing database
    public static final String PENDING_SIGNATURE    = "pending_signature";
    public static final String VALIDATION           = "validation";
    public static final String PROCESSED_SIGNATURE  = "processed_signature";
    public static final String PROCESSED_VALIDATION = "processed_validation";

    // Archive database
    public static final String NOT_VALIDATED_SIGNATURE_ARCHIVE = "not_validated_signature_archive";
    public static final String ORPHANED_VALIDATION_ARCHIVE     = "orphaned_validation_archive";
    public static final String PROCESSED_SIGNATURE_ARCHIVE     = "processed_signature_archive";
    public static final String PROCESSED_VALIDATION_ARCHIVE    = "processed_validation_archive";

    private final Duration queryTimeout;

    public RecordStoreFactory(@Value("${archive.store-timeout:60s}") Duration queryTimeout) {
        this.queryTimeout = queryTimeout;
    }

    @Singleton
    @Named("invalidSignatures")
    TransitionRoute<PendingSignature> invalidSignatures(DataSource processing,
                                                        @Named("archive") DataSource archive) {
        return new TransitionRoute<>(RecordCategory.INVALID_SIGNATURES,
                new PendingSignatureRepository(processing, PENDING_SIGNATURE, queryTimeout),
                new PendingSignatureRepository(archive, NOT_VALIDATED_SIGNATURE_ARCHIVE, queryTimeout));
    }

    @Singleton
    @Named("processedSignatures")
    TransitionRoute<ProcessedSignature> processedSignatures(DataSource processing,
                                                            @Named("archive") DataSource archive) {
        return new TransitionRoute<>(RecordCategory.PROCESSED_SIGNATURES,
                new ProcessedSignatureRepository(processing, PROCESSED_SIGNATURE, queryTimeout),
                new ProcessedSignatureRepository(archive, PROCESSED_SIGNATURE_ARCHIVE, queryTimeout));
    }

    @Singleton
    @Named("processedValidations")
    TransitionRoute<ProcessedValidation> processedValidations(DataSource processing,
                                                              @Named("archive") DataSource archive) {
        return new TransitionRoute<>(RecordCategory.PROCESSED_VALIDATIONS,
                new ProcessedValidationRepository(processing, PROCESSED_VALIDATION, queryTimeout),
                new ProcessedValidationRepository(archive, PROCESSED_VALIDATION_ARCHIVE, queryTimeout));
    }

    @Singleton
    ValidationStore validationStore(DataSource processing) {
        return new PendingValidationRepository(processing, VALIDATION, PENDING_SIGNATURE, queryTimeout);
    }

    @Singleton
    @Named("orphanedValidationArchive")
    RecordStore<Validation> orphanedValidationArchive(@Named("archive") DataSource archive) {
        return new ValidationRepository(archive, ORPHANED_VALIDATION_ARCHIVE, queryTimeout);
    }
}
