package com.petition.archive.service;

/**
 * Thrown when another invocation already holds the workflow lock. The caller fails
 * fast instead of queuing behind the running invocation.
 */
public class WorkflowLockUnavailableException extends RuntimeException {

    public WorkflowLockUnavailableException(String message) {
        super(message);
    }
}
