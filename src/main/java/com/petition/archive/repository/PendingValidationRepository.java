package com.petition.archive.repository;

import com.petition.archive.model.Validation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * JDBC repository for the live {@code validation} table.
 *
 * The orphan query is a {@code NOT EXISTS} anti-join against the pending signature
 * table, which lives in the same processing database. Deletion by key set is
 * split into chunks of {@value #DELETE_CHUNK_SIZE} keys per statement to keep the
 * {@code IN} list bounded.
 */
public class PendingValidationRepository extends ValidationRepository implements ValidationStore {

    private static final Logger log = LoggerFactory.getLogger(PendingValidationRepository.class);

    static final int DELETE_CHUNK_SIZE = 500;

    private final String pendingSignatureTable;

    public PendingValidationRepository(DataSource dataSource,
                                       String tableName,
                                       String pendingSignatureTable,
                                       Duration queryTimeout) {
        super(dataSource, tableName, queryTimeout);
        this.pendingSignatureTable = pendingSignatureTable;
    }

    @Override
    public List<Validation> findOrphansClosedBefore(Instant watermark) {
        final String sql = selectColumns() + " v"
                + " WHERE v.timestamp_validation_close < ?"
                + "   AND NOT EXISTS (SELECT 1 FROM " + pendingSignatureTable + " s"
                + "                    WHERE s.secret_validation_key = v.secret_validation_key)"
                + " ORDER BY v.timestamp_validation_close";

        return queryList(sql, "findOrphansClosedBefore", ps -> ps.setTimestamp(1, Timestamp.from(watermark)));
    }

    @Override
    public int deleteByKeysClosedBefore(Collection<String> secretValidationKeys, Instant watermark) {
        if (secretValidationKeys == null || secretValidationKeys.isEmpty()) {
            return 0;
        }

        List<String> keys = new ArrayList<>(secretValidationKeys);
        int deleted = 0;

        try (Connection conn = dataSource().getConnection()) {
            for (int i = 0; i < keys.size(); i += DELETE_CHUNK_SIZE) {
                List<String> chunk = keys.subList(i, Math.min(i + DELETE_CHUNK_SIZE, keys.size()));
                final String sql = "DELETE FROM " + tableName()
                        + " WHERE timestamp_validation_close < ?"
                        + "   AND secret_validation_key IN ("
                        + String.join(", ", Collections.nCopies(chunk.size(), "?")) + ")";

                try (PreparedStatement ps = prepare(conn, sql)) {
                    ps.setTimestamp(1, Timestamp.from(watermark));
                    for (int k = 0; k < chunk.size(); k++) {
                        ps.setString(k + 2, chunk.get(k));
                    }
                    deleted += ps.executeUpdate();
                }
            }
        } catch (SQLException e) {
            log.error("Error deleting from {} keys={} closedBefore={} deletedSoFar={}",
                    tableName(), keys.size(), watermark, deleted, e);
            throw new StoreAccessException("DB error in deleteByKeysClosedBefore on " + tableName(), e);
        }

        log.info("Deleted from {} by key keys={} closedBefore={} rows={}", tableName(), keys.size(), watermark, deleted);
        return deleted;
    }
}
