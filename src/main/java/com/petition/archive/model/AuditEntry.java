package com.petition.archive.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A structured audit log entry: a message template with {@code {name}} placeholders,
 * the fields that fill them, and a severity.
 *
 * Numeric fields (counts) are kept as numbers so that log shippers can index them;
 * descriptive fields (category, store names) are strings.
 *
 * @param severity routine ({@code INFO}) or tamper signal ({@code ALERT})
 * @param template message with {@code {name}} placeholders
 * @param fields   placeholder values in insertion order
 */
public record AuditEntry(AuditSeverity severity, String template, Map<String, Object> fields) {

    public AuditEntry {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * @return the template with every known placeholder replaced; unknown
     *         placeholders are left as they are
     */
    public String render() {
        String message = template;
        for (Map.Entry<String, Object> field : fields.entrySet()) {
            message = message.replace("{" + field.getKey() + "}", String.valueOf(field.getValue()));
        }
        return message;
    }
}
