package com.petition.archive.repository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * JDBC base class for a single processing or archive table.
 *
 * Subclasses describe the column list and how a row maps to and from the record
 * type; the SQL for the four store primitives is derived from that description.
 * The same subclass is instantiated once per table sharing the schema, e.g.
 * {@code pending_signature} in the processing database and
 * {@code not_validated_signature_archive} in the archive database.
 *
 * Every statement carries the configured query timeout. Any {@link SQLException},
 * a timeout included, is logged and rethrown as {@link StoreAccessException}.
 *
 * @param <T> record type held by the table
 */
public abstract class JdbcRecordStore<T> implements RecordStore<T> {

    private static final Logger log = LoggerFactory.getLogger(JdbcRecordStore.class);

    private static final int FETCH_SIZE = 500;

    private final DataSource dataSource;
    private final String tableName;
    private final int queryTimeoutSeconds;

    protected JdbcRecordStore(DataSource dataSource, String tableName, Duration queryTimeout) {
        this.dataSource = dataSource;
        this.tableName = tableName;
        this.queryTimeoutSeconds = (int) Math.max(1, queryTimeout.toSeconds());
    }

    // -----------------------------------------------------------------------
    // Row description supplied by subclasses
    // -----------------------------------------------------------------------

    /**
     * @return column names in bind order
     */
    protected abstract List<String> columns();

    protected abstract T mapRow(ResultSet rs) throws SQLException;

    /**
     * Binds every column of {@code record} in {@link #columns()} order, starting at
     * parameter index 1.
     */
    protected abstract void bindRow(PreparedStatement ps, T record) throws SQLException;

    /**
     * @return identity of the record for log lines, e.g. {@code sid=abc}
     */
    protected abstract String describe(T record);

    // -----------------------------------------------------------------------
    // Store primitives
    // -----------------------------------------------------------------------

    @Override
    public String storeName() {
        return tableName;
    }

    @Override
    public List<T> findClosedBefore(Instant watermark) {
        final String sql = selectColumns() + " WHERE timestamp_validation_close < ?"
                + " ORDER BY timestamp_validation_close";

        return queryList(sql, "findClosedBefore", ps -> ps.setTimestamp(1, Timestamp.from(watermark)));
    }

    @Override
    public void insert(T record) {
        final String sql = "INSERT INTO " + tableName
                + " (" + String.join(", ", columns()) + ")"
                + " VALUES (" + String.join(", ", Collections.nCopies(columns().size(), "?")) + ")";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = prepare(conn, sql)) {

            bindRow(ps, record);
            ps.executeUpdate();
            log.debug("Inserted {} {}", tableName, describe(record));

        } catch (SQLException e) {
            log.error("Error inserting into {} {}", tableName, describe(record), e);
            throw new StoreAccessException("DB error in insert into " + tableName, e);
        }
    }

    @Override
    public int deleteClosedBefore(Instant watermark) {
        final String sql = "DELETE FROM " + tableName + " WHERE timestamp_validation_close < ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = prepare(conn, sql)) {

            ps.setTimestamp(1, Timestamp.from(watermark));
            int rows = ps.executeUpdate();
            log.info("Deleted from {} closedBefore={} rows={}", tableName, watermark, rows);
            return rows;

        } catch (SQLException e) {
            log.error("Error deleting from {} closedBefore={}", tableName, watermark, e);
            throw new StoreAccessException("DB error in deleteClosedBefore on " + tableName, e);
        }
    }

    @Override
    public long count() {
        final String sql = "SELECT COUNT(*) FROM " + tableName;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = prepare(conn, sql);
             ResultSet rs = ps.executeQuery()) {

            return rs.next() ? rs.getLong(1) : 0L;

        } catch (SQLException e) {
            log.error("Error counting rows of {}", tableName, e);
            throw new StoreAccessException("DB error in count on " + tableName, e);
        }
    }

    // -----------------------------------------------------------------------
    // Helpers shared with subclasses
    // -----------------------------------------------------------------------

    @FunctionalInterface
    protected interface ParameterBinder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    protected String tableName() {
        return tableName;
    }

    protected DataSource dataSource() {
        return dataSource;
    }

    /**
     * @return {@code SELECT <columns> FROM <table>} without a trailing clause
     */
    protected String selectColumns() {
        return "SELECT " + String.join(", ", columns()) + " FROM " + tableName;
    }

    protected List<T> queryList(String sql, String operation, ParameterBinder binder) {
        List<T> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = prepare(conn, sql)) {

            binder.bind(ps);
            ps.setFetchSize(FETCH_SIZE);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Error in {} on {}", operation, tableName, e);
            throw new StoreAccessException("DB error in " + operation + " on " + tableName, e);
        }
        return result;
    }

    protected PreparedStatement prepare(Connection conn, String sql) throws SQLException {
        PreparedStatement ps = conn.prepareStatement(sql);
        ps.setQueryTimeout(queryTimeoutSeconds);
        return ps;
    }

    protected static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }

    protected static LocalDate toLocalDate(Date date) {
        return date == null ? null : date.toLocalDate();
    }

    protected static void setNullableString(PreparedStatement ps, int idx, String value) throws SQLException {
        if (value == null) {
            ps.setNull(idx, Types.VARCHAR);
        } else {
            ps.setString(idx, value);
        }
    }

    protected static void setNullableTimestamp(PreparedStatement ps, int idx, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(idx, Types.TIMESTAMP);
        } else {
            ps.setTimestamp(idx, Timestamp.from(value));
        }
    }

    protected static void setNullableDate(PreparedStatement ps, int idx, LocalDate value) throws SQLException {
        if (value == null) {
            ps.setNull(idx, Types.DATE);
        } else {
            ps.setDate(idx, Date.valueOf(value));
        }
    }
}
