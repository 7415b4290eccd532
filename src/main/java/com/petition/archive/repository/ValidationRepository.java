package com.petition.archive.repository;

import com.petition.archive.model.Validation;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

/**
 * JDBC repository for tables shaped like {@code validation}.
 *
 * Used as-is for {@code orphaned_validation_archive}; the live table is served by
 * {@link PendingValidationRepository}, which adds the orphan queries.
 */
public class ValidationRepository extends JdbcRecordStore<Validation> {

    static final List<String> COLUMNS = List.of(
            "vid", "secret_validation_key", "timestamp_received_validation",
            "timestamp_validation_close", "client_ip", "petition_id");

    public ValidationRepository(DataSource dataSource, String tableName, Duration queryTimeout) {
        super(dataSource, tableName, queryTimeout);
    }

    @Override
    protected List<String> columns() {
        return COLUMNS;
    }

    @Override
    protected Validation mapRow(ResultSet rs) throws SQLException {
        Validation v = new Validation();
        v.setVid(rs.getString("vid"));
        v.setSecretValidationKey(rs.getString("secret_validation_key"));
        v.setTimestampReceivedValidation(toInstant(rs.getTimestamp("timestamp_received_validation")));
        v.setTimestampValidationClose(toInstant(rs.getTimestamp("timestamp_validation_close")));
        v.setClientIp(rs.getString("client_ip"));
        v.setPetitionId(rs.getString("petition_id"));
        return v;
    }

    @Override
    protected void bindRow(PreparedStatement ps, Validation v) throws SQLException {
        ps.setString(1, v.getVid());
        setNullableString(ps, 2, v.getSecretValidationKey());
        setNullableTimestamp(ps, 3, v.getTimestampReceivedValidation());
        setNullableTimestamp(ps, 4, v.getTimestampValidationClose());
        setNullableString(ps, 5, v.getClientIp());
        setNullableString(ps, 6, v.getPetitionId());
    }

    @Override
    protected String describe(Validation v) {
        return "vid=" + v.getVid();
    }
}
