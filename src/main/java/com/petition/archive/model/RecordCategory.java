package com.petition.archive.model;

/**
 * The four kinds of record the archive workflow moves out of the processing
 * database.
 *
 * <ul>
 *   <li>INVALID_SIGNATURES    - pending signatures whose validation window closed unvalidated</li>
 *   <li>ORPHANED_VALIDATIONS  - validations that never matched a pending signature</li>
 *   <li>PROCESSED_SIGNATURES  - counted or discarded signatures of closed petitions</li>
 *   <li>PROCESSED_VALIDATIONS - validations already applied to their signature</li>
 * </ul>
 */
public enum RecordCategory {

    INVALID_SIGNATURES("invalid signatures", AuditSeverity.INFO),
    ORPHANED_VALIDATIONS("orphaned validations", AuditSeverity.ALERT),
    PROCESSED_SIGNATURES("processed signatures", AuditSeverity.INFO),
    PROCESSED_VALIDATIONS("processed validations", AuditSeverity.INFO);

    private final String label;
    private final AuditSeverity archiveSeverity;

    RecordCategory(String label, AuditSeverity archiveSeverity) {
        this.label = label;
        this.archiveSeverity = archiveSeverity;
    }

    /** Human-readable name used in audit messages. */
    public String label() {
        return label;
    }

    /** Severity of the audit entry written when records of this category are archived. */
    public AuditSeverity archiveSeverity() {
        return archiveSeverity;
    }
}
