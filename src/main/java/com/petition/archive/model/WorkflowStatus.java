package com.petition.archive.model;

/**
 * Outcome of one archive workflow invocation.
 *
 * Only {@link #OK} and {@link #SERVER_ERROR} are produced by the workflow itself;
 * the remaining codes belong to the invocation layer (e.g. an unknown run id).
 */
public enum WorkflowStatus {

    OK(200),
    BAD_REQUEST(400),
    FORBIDDEN(403),
    NOT_FOUND(404),
    SERVER_ERROR(500);

    private final int httpCode;

    WorkflowStatus(int httpCode) {
        this.httpCode = httpCode;
    }

    public int httpCode() {
        return httpCode;
    }
}
