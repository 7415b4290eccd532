package com.petition.archive.model;

/**
 * Severity attached to an audit log entry.
 *
 * <ul>
 *   <li>INFO  - routine turnover (records aged out and moved to the archive)</li>
 *   <li>ALERT - possible tampering, e.g. validations that never matched a signature</li>
 * </ul>
 */
public enum AuditSeverity {

    INFO,
    ALERT
}
