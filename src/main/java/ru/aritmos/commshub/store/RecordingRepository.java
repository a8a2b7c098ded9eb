package ru.aritmos.commshub.store;

import jakarta.inject.Singleton;
import ru.aritmos.commshub.model.Recording;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Записи разговоров. Один звонок может иметь несколько записей (перезапись, сегменты).
 */
@Singleton
public class RecordingRepository {

    private static final String COLUMNS =
            "id, org_id, call_id, provider_recording_id, recording_url, storage_key, retention_policy_id, created_at";

    private final DataSource dataSource;

    public RecordingRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Зарегистрировать запись в транзакции вызывающего.
     */
    public Recording insert(Connection c,
                            long orgId,
                            long callId,
                            String providerRecordingId,
                            String recordingUrl,
                            Long retentionPolicyId,
                            int timeoutSec) throws SQLException {
        Instant now = Instant.now();
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO comms_recordings (org_id, call_id, provider_recording_id, recording_url, storage_key, retention_policy_id, created_at) " +
                        "VALUES (?, ?, ?, ?, NULL, ?, ?)",
                new String[]{"id"})) {
            ps.setQueryTimeout(timeoutSec);
            ps.setLong(1, orgId);
            ps.setLong(2, callId);
            ps.setString(3, providerRecordingId);
            ps.setString(4, recordingUrl);
            JdbcSupport.setLongOrNull(ps, 5, retentionPolicyId);
            JdbcSupport.setInstant(ps, 6, now);
            ps.executeUpdate();
            long id = JdbcSupport.generatedId(ps);
            return new Recording(id, orgId, callId, providerRecordingId, recordingUrl, null, retentionPolicyId, now);
        }
    }

    public Optional<Recording> find(long orgId, long recordingId) {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM comms_recordings WHERE org_id=? AND id=?")) {
            ps.setLong(1, orgId);
            ps.setLong(2, recordingId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Не удалось прочитать запись разговора", e);
        }
    }

    public List<Recording> listByCall(long orgId, long callId) {
        List<Recording> out = new ArrayList<>();
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT " + COLUMNS + " FROM comms_recordings WHERE org_id=? AND call_id=? ORDER BY created_at DESC, id DESC")) {
            ps.setLong(1, orgId);
            ps.setLong(2, callId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Не удалось прочитать записи звонка", e);
        }
        return out;
    }

    private static Recording map(ResultSet rs) throws SQLException {
        return new Recording(
                rs.getLong("id"),
                rs.getLong("org_id"),
                rs.getLong("call_id"),
                rs.getString("provider_recording_id"),
                rs.getString("recording_url"),
                rs.getString("storage_key"),
                JdbcSupport.longOrNull(rs, "retention_policy_id"),
                JdbcSupport.instant(rs, "created_at"));
    }
}
