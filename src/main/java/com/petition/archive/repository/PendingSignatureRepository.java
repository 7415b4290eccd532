package com.petition.archive.repository;

import com.petition.archive.model.PendingSignature;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

/**
 * JDBC repository for tables shaped like {@code pending_signature}.
 *
 * Backs both the live {@code pending_signature} table and the
 * {@code not_validated_signature_archive} table; see
 * {@link com.petition.archive.config.RecordStoreFactory}.
 */
public class PendingSignatureRepository extends JdbcRecordStore<PendingSignature> {

    static final List<String> COLUMNS = List.of(
            "sid", "secret_validation_key", "source_api_key", "petition_id",
            "timestamp_petition_close", "timestamp_validation_close",
            "email", "first_name", "last_name", "street_address", "postal_code",
            "city", "country_code", "birth_date",
            "timestamp_initiated_validation", "timestamp_received_signature");

    public PendingSignatureRepository(DataSource dataSource, String tableName, Duration queryTimeout) {
        super(dataSource, tableName, queryTimeout);
    }

    @Override
    protected List<String> columns() {
        return COLUMNS;
    }

    @Override
    protected PendingSignature mapRow(ResultSet rs) throws SQLException {
        PendingSignature s = new PendingSignature();
        s.setSid(rs.getString("sid"));
        s.setSecretValidationKey(rs.getString("secret_validation_key"));
        s.setSourceApiKey(rs.getString("source_api_key"));
        s.setPetitionId(rs.getString("petition_id"));
        s.setTimestampPetitionClose(toInstant(rs.getTimestamp("timestamp_petition_close")));
        s.setTimestampValidationClose(toInstant(rs.getTimestamp("timestamp_validation_close")));
        s.setEmail(rs.getString("email"));
        s.setFirstName(rs.getString("first_name"));
        s.setLastName(rs.getString("last_name"));
        s.setStreetAddress(rs.getString("street_address"));
        s.setPostalCode(rs.getString("postal_code"));
        s.setCity(rs.getString("city"));
        s.setCountryCode(rs.getString("country_code"));
        s.setBirthDate(toLocalDate(rs.getDate("birth_date")));
        s.setTimestampInitiatedValidation(toInstant(rs.getTimestamp("timestamp_initiated_validation")));
        s.setTimestampReceivedSignature(toInstant(rs.getTimestamp("timestamp_received_signature")));
        return s;
    }

    @Override
    protected void bindRow(PreparedStatement ps, PendingSignature s) throws SQLException {
        ps.setString(1, s.getSid());
        setNullableString(ps, 2, s.getSecretValidationKey());
        setNullableString(ps, 3, s.getSourceApiKey());
        setNullableString(ps, 4, s.getPetitionId());
        setNullableTimestamp(ps, 5, s.getTimestampPetitionClose());
        setNullableTimestamp(ps, 6, s.getTimestampValidationClose());
        setNullableString(ps, 7, s.getEmail());
        setNullableString(ps, 8, s.getFirstName());
        setNullableString(ps, 9, s.getLastName());
        setNullableString(ps, 10, s.getStreetAddress());
        setNullableString(ps, 11, s.getPostalCode());
        setNullableString(ps, 12, s.getCity());
        setNullableString(ps, 13, s.getCountryCode());
        setNullableDate(ps, 14, s.getBirthDate());
        setNullableTimestamp(ps, 15, s.getTimestampInitiatedValidation());
        setNullableTimestamp(ps, 16, s.getTimestampReceivedSignature());
    }

    @Override
    protected String describe(PendingSignature s) {
        return "sid=" + s.getSid();
    }
}
