package com.petition.archive.repository;

import com.petition.archive.model.WorkflowRun;
import com.petition.archive.model.WorkflowStatus;
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
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * JDBC-based repository for the {@code archive_workflow_run} ledger table.
 *
 * Rows are written once, at the end of a run. A job id may appear more than once
 * when a caller re-runs with the same id; lookups return the most recent run.
 */
@Singleton
public class WorkflowRunRepository {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRunRepository.class);

    /** Width of the {@code error_message} column. */
    static final int ERROR_MESSAGE_MAX = 2000;

    private final DataSource dataSource;
    private final int queryTimeoutSeconds;

    @Inject
    public WorkflowRunRepository(DataSource dataSource,
                                 @Value("${archive.store-timeout:60s}") Duration queryTimeout) {
        this.dataSource = dataSource;
        this.queryTimeoutSeconds = (int) Math.max(1, queryTimeout.toSeconds());
    }

    /**
     * Finds the most recent run recorded under the given job id.
     *
     * @param jobId caller-chosen or generated job identifier
     * @return the run if present
     */
    public Optional<WorkflowRun> findLatestByJobId(String jobId) {
        final String sql = """
                SELECT job_id, server_name, worker_name, status, watermark,
                       invalid_signatures_archived, invalid_signatures_deleted,
                       orphaned_validations_archived, orphaned_validations_deleted,
                       processed_signatures_archived, processed_signatures_deleted,
                       processed_validations_archived, processed_validations_deleted,
                       error_message, started_at, finished_at
                  FROM archive_workflow_run
                 WHERE job_id = ?
                 ORDER BY started_at DESC
                 LIMIT 1
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setQueryTimeout(queryTimeoutSeconds);
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Error in findLatestByJobId jobId={}", jobId, e);
            throw new StoreAccessException("DB error in findLatestByJobId", e);
        }
        return Optional.empty();
    }

    /**
     * Inserts a finished run.
     *
     * @param run the run to persist
     */
    public void save(WorkflowRun run) {
        final String sql = """
                INSERT INTO archive_workflow_run
                    (job_id, server_name, worker_name, status, watermark,
                     invalid_signatures_archived, invalid_signatures_deleted,
                     orphaned_validations_archived, orphaned_validations_deleted,
                     processed_signatures_archived, processed_signatures_deleted,
                     processed_validations_archived, processed_validations_deleted,
                     error_message, started_at, finished_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setQueryTimeout(queryTimeoutSeconds);
            ps.setString(1, run.getJobId());
            setNullableString(ps, 2, run.getServerName());
            setNullableString(ps, 3, run.getWorkerName());
            ps.setString(4, run.getStatus().name());
            setNullableTimestamp(ps, 5, run.getWatermark());
            ps.setInt(6, run.getInvalidSignaturesArchived());
            ps.setInt(7, run.getInvalidSignaturesDeleted());
            ps.setInt(8, run.getOrphanedValidationsArchived());
            ps.setInt(9, run.getOrphanedValidationsDeleted());
            ps.setInt(10, run.getProcessedSignaturesArchived());
            ps.setInt(11, run.getProcessedSignaturesDeleted());
            ps.setInt(12, run.getProcessedValidationsArchived());
            ps.setInt(13, run.getProcessedValidationsDeleted());
            setNullableString(ps, 14, truncate(run.getErrorMessage()));
            setNullableTimestamp(ps, 15, run.getStartedAt());
            setNullableTimestamp(ps, 16, run.getFinishedAt());

            ps.executeUpdate();
            log.info("Saved archive_workflow_run jobId={} status={}", run.getJobId(), run.getStatus());

        } catch (SQLException e) {
            log.error("Error saving archive_workflow_run jobId={}", run.getJobId(), e);
            throw new StoreAccessException("DB error in save", e);
        }
    }

    // -----------------------------------------------------------------------
    // Private helpers
    // -----------------------------------------------------------------------

    private WorkflowRun mapRow(ResultSet rs) throws SQLException {
        WorkflowRun r = new WorkflowRun();
        r.setJobId(rs.getString("job_id"));
        r.setServerName(rs.getString("server_name"));
        r.setWorkerName(rs.getString("worker_name"));
        r.setStatus(WorkflowStatus.valueOf(rs.getString("status")));
        r.setWatermark(toInstant(rs.getTimestamp("watermark")));
        r.setInvalidSignaturesArchived(rs.getInt("invalid_signatures_archived"));
        r.setInvalidSignaturesDeleted(rs.getInt("invalid_signatures_deleted"));
        r.setOrphanedValidationsArchived(rs.getInt("orphaned_validations_archived"));
        r.setOrphanedValidationsDeleted(rs.getInt("orphaned_validations_deleted"));
        r.setProcessedSignaturesArchived(rs.getInt("processed_signatures_archived"));
        r.setProcessedSignaturesDeleted(rs.getInt("processed_signatures_deleted"));
        r.setProcessedValidationsArchived(rs.getInt("processed_validations_archived"));
        r.setProcessedValidationsDeleted(rs.getInt("processed_validations_deleted"));
        r.setErrorMessage(rs.getString("error_message"));
        r.setStartedAt(toInstant(rs.getTimestamp("started_at")));
        r.setFinishedAt(toInstant(rs.getTimestamp("finished_at")));
        return r;
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= ERROR_MESSAGE_MAX) {
            return message;
        }
        return message.substring(0, ERROR_MESSAGE_MAX);
    }

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }

    private static void setNullableString(PreparedStatement ps, int idx, String value) throws SQLException {
        if (value == null) {
            ps.setNull(idx, Types.VARCHAR);
        } else {
            ps.setString(idx, value);
        }
    }

    private static void setNullableTimestamp(PreparedStatement ps, int idx, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(idx, Types.TIMESTAMP);
        } else {
            ps.setTimestamp(idx, Timestamp.from(value));
        }
    }
}
