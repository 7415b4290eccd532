package com.petition.archive.service;

import com.petition.archive.model.AuditEntry;
import com.petition.archive.model.AuditSeverity;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes audit entries to the dedicated {@code audit} logger.
 *
 * {@link AuditSeverity#INFO} entries are logged at info level. {@link AuditSeverity#ALERT}
 * entries are logged at error level and carry the {@code ALERT} marker so that
 * the logging backend can route them to an alerting appender.
 *
 * Each line has the rendered message followed by the raw fields as
 * {@code key=value} pairs.
 */
@Singleton
public class AuditLogService {

    private static final Logger audit = LoggerFactory.getLogger("audit");

    static final Marker ALERT_MARKER = MarkerFactory.getMarker("ALERT");

    /**
     * Records an entry.
     *
     * @param entry the entry to write
     */
    public void record(AuditEntry entry) {
        String fields = entry.fields().entrySet().stream()
                .map(f -> f.getKey() + "=" + f.getValue())
                .collect(Collectors.joining(" "));

        if (entry.severity() == AuditSeverity.ALERT) {
            audit.error(ALERT_MARKER, "{} [{}]", entry.render(), fields);
        } else {
            audit.info("{} [{}]", entry.render(), fields);
        }
    }

    /**
     * Convenience overload building the entry from alternating name/value pairs.
     *
     * @param severity  entry severity
     * @param template  message template
     * @param keyValues field names and values, alternating
     */
    public void record(AuditSeverity severity, String template, Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Audit fields must be given as name/value pairs");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            fields.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        record(new AuditEntry(severity, template, fields));
    }
}
