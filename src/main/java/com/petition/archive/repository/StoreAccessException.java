package com.petition.archive.repository;

/**
 * Unchecked wrapper for any failure of a store primitive (connection, SQL error
 * or query timeout).
 *
 * A store failure is fatal to the workflow step that issued it; the step is not
 * retried and no deletion is attempted for the affected category.
 */
public class StoreAccessException extends RuntimeException {

    public StoreAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
