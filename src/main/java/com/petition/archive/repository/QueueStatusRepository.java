package com.petition.archive.repository;

import io.micronaut.context.annotation.Value;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JDBC reader for the {@code queue_status} table, maintained by the intake queue
 * workers: one row per queue with the unix timestamp (seconds) at which the queue
 * was last observed empty.
 */
@Singleton
public class QueueStatusRepository {

    private static final Logger log = LoggerFactory.getLogger(QueueStatusRepository.class);

    private final DataSource dataSource;
    private final int queryTimeoutSeconds;

    @Inject
    public QueueStatusRepository(DataSource dataSource,
                                 @Value("${archive.store-timeout:60s}") Duration queryTimeout) {
        this.dataSource = dataSource;
        this.queryTimeoutSeconds = (int) Math.max(1, queryTimeout.toSeconds());
    }

    /**
     * Reads the last-emptied timestamp of every known intake queue.
     *
     * @return queue name to unix timestamp in seconds (empty if no queue has reported yet)
     */
    public Map<String, Long> lastEmptiedTimestamps() {
        final String sql = """
                SELECT queue_name, last_emptied_at
                  FROM queue_status
                 ORDER BY queue_name
                """;

        Map<String, Long> result = new LinkedHashMap<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setQueryTimeout(queryTimeoutSeconds);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.put(rs.getString("queue_name"), rs.getLong("last_emptied_at"));
                }
            }
        } catch (SQLException e) {
            log.error("Error reading queue_status", e);
            throw new StoreAccessException("DB error in lastEmptiedTimestamps", e);
        }
        return result;
    }
}
