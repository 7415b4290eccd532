package com.petition.archive.service;

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

/**
 * Optional mutual exclusion between overlapping workflow invocations, using a
 * PostgreSQL transaction-level advisory lock keyed by the job name.
 *
 * The lock lives in an open transaction on a dedicated connection that stays
 * checked out for the whole run. Closing the returned {@link WorkflowLock} ends
 * that transaction, which releases the lock before the connection goes back to
 * the pool. Acquisition never
 * waits: {@code pg_try_advisory_lock} either grants the lock immediately or the
 * call fails with {@link WorkflowLockUnavailableException}.
 *
 * Disabled unless {@code archive.lock.enabled=true}; when disabled every call
 * returns a no-op lock and concurrent runs may archive the same rows twice.
 */
@Singleton
public class WorkflowLockService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowLockService.class);

    private final DataSource dataSource;
    private final boolean enabled;
    private final String lockName;

    @Inject
    public WorkflowLockService(DataSource dataSource,
                               @Value("${archive.lock.enabled:false}") boolean enabled,
                               @Value("${archive.lock.name:signature-archive-workflow}") String lockName) {
        this.dataSource = dataSource;
        this.enabled = enabled;
        this.lockName = lockName;
    }

    /**
     * A held workflow lock; closing it releases the lock.
     */
    public interface WorkflowLock extends AutoCloseable {

        @Override
        void close();
    }

    /**
     * Tries to take the workflow lock without waiting.
     *
     * @param jobId invocation the lock is taken for (logging only)
     * @return the held lock
     * @throws WorkflowLockUnavailableException if another invocation holds the lock or
     *         the lock cannot be requested
     */
    public WorkflowLock acquire(String jobId) {
        if (!enabled) {
            return () -> { };
        }

        Connection conn = null;
        try {
            conn = dataSource.getConnection();
            conn.setAutoCommit(false);
            boolean granted;
            try (PreparedStatement ps = conn.prepareStatement("SELECT pg_try_advisory_xact_lock(hashtext(?))")) {
                ps.setString(1, lockName);
                try (ResultSet rs = ps.executeQuery()) {
                    granted = rs.next() && rs.getBoolean(1);
                }
            }

            if (!granted) {
                closeQuietly(conn, jobId);
                throw new WorkflowLockUnavailableException("Workflow lock " + lockName + " is held by another run");
            }

            log.info("Acquired workflow lock name={} jobId={}", lockName, jobId);
            final Connection held = conn;
            return () -> release(held, jobId);

        } catch (SQLException e) {
            closeQuietly(conn, jobId);
            log.error("Error acquiring workflow lock name={} jobId={}", lockName, jobId, e);
            throw new WorkflowLockUnavailableException("Workflow lock " + lockName + " could not be requested: "
                    + e.getMessage());
        }
    }

    // -----------------------------------------------------------------------
    // Private helpers
    // -----------------------------------------------------------------------

    private void release(Connection conn, String jobId) {
        closeQuietly(conn, jobId);
        log.info("Released workflow lock name={} jobId={}", lockName, jobId);
    }

    /**
     * Rolls back the lock transaction, which drops the advisory lock, and returns the
     * connection to the pool.
     */
    private void closeQuietly(Connection conn, String jobId) {
        if (conn == null) {
            return;
        }
        try {
            if (!conn.getAutoCommit()) {
                conn.rollback();
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            log.warn("Failed to end lock transaction jobId={}: {}", jobId, e.getMessage());
        }
        try {
            conn.close();
        } catch (SQLException e) {
            log.warn("Failed to close lock connection jobId={}: {}", jobId, e.getMessage());
        }
    }
}
