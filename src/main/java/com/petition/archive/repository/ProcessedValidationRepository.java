package com.petition.archive.repository;

import com.petition.archive.model.ProcessedValidation;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC repository for {@code processed_validation} and its archive twin.
 */
public class ProcessedValidationRepository extends JdbcRecordStore<ProcessedValidation> {

    private static final List<String> COLUMNS;

    static {
        List<String> columns = new ArrayList<>(ValidationRepository.COLUMNS);
        columns.add("timestamp_processed_validation");
        COLUMNS = List.copyOf(columns);
    }

    public ProcessedValidationRepository(DataSource dataSource, String tableName, Duration queryTimeout) {
        super(dataSource, tableName, queryTimeout);
    }

    @Override
    protected List<String> columns() {
        return COLUMNS;
    }

    @Override
    protected ProcessedValidation mapRow(ResultSet rs) throws SQLException {
        ProcessedValidation v = new ProcessedValidation();
        v.setVid(rs.getString("vid"));
        v.setSecretValidationKey(rs.getString("secret_validation_key"));
        v.setTimestampReceivedValidation(toInstant(rs.getTimestamp("timestamp_received_validation")));
        v.setTimestampValidationClose(toInstant(rs.getTimestamp("timestamp_validation_close")));
        v.setClientIp(rs.getString("client_ip"));
        v.setPetitionId(rs.getString("petition_id"));
        v.setTimestampProcessedValidation(toInstant(rs.getTimestamp("timestamp_processed_validation")));
        return v;
    }

    @Override
    protected void bindRow(PreparedStatement ps, ProcessedValidation v) throws SQLException {
        ps.setString(1, v.getVid());
        setNullableString(ps, 2, v.getSecretValidationKey());
        setNullableTimestamp(ps, 3, v.getTimestampReceivedValidation());
        setNullableTimestamp(ps, 4, v.getTimestampValidationClose());
        setNullableString(ps, 5, v.getClientIp());
        setNullableString(ps, 6, v.getPetitionId());
        setNullableTimestamp(ps, 7, v.getTimestampProcessedValidation());
    }

    @Override
    protected String describe(ProcessedValidation v) {
        return "vid=" + v.getVid();
    }
}
