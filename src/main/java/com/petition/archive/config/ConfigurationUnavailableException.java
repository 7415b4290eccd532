package com.petition.archive.config;

/**
 * Thrown when the workflow configuration cannot be resolved into a usable
 * {@link com.petition.archive.model.WorkflowConfig}. Fatal to the invocation:
 * the run aborts before any store is touched.
 */
public class ConfigurationUnavailableException extends RuntimeException {

    public ConfigurationUnavailableException(String message) {
        super(message);
    }
}
