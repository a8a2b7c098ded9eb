package ru.aritmos.commshub.store;

import jakarta.inject.Singleton;
import ru.aritmos.commshub.model.Transcript;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Singleton
public class TranscriptRepository {

    private final DataSource dataSource;

    public TranscriptRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public Transcript insert(long orgId,
                             long callId,
                             String text,
                             String segmentsJson,
                             int confidencePercent,
                             String method,
                             String evidenceHash,
                             Long retentionPolicyId) {
        Instant now = Instant.now();
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT INTO comms_transcripts (org_id, call_id, transcript_text, segments_json, confidence, method_used, evidence_hash, retention_policy_id, created_at) " +
                             "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                     new String[]{"id"})) {
            ps.setLong(1, orgId);
            ps.setLong(2, callId);
            ps.setString(3, text);
            ps.setString(4, segmentsJson);
            ps.setInt(5, confidencePercent);
            ps.setString(6, method);
            ps.setString(7, evidenceHash);
            JdbcSupport.setLongOrNull(ps, 8, retentionPolicyId);
            JdbcSupport.setInstant(ps, 9, now);
            ps.executeUpdate();
            long id = JdbcSupport.generatedId(ps);
            return new Transcript(id, orgId, callId, text, segmentsJson, confidencePercent, method, evidenceHash, retentionPolicyId, now);
        } catch (SQLException e) {
            throw new IllegalStateException("Не удалось сохранить стенограмму", e);
        }
    }

    public List<Transcript> listByCall(long orgId, long callId) {
        List<Transcript> out = new ArrayList<>();
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT id, org_id, call_id, transcript_text, segments_json, confidence, method_used, evidence_hash, retention_policy_id, created_at " +
                             "FROM comms_transcripts WHERE org_id=? AND call_id=? ORDER BY id ASC")) {
            ps.setLong(1, orgId);
            ps.setLong(2, callId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new Transcript(
                            rs.getLong("id"),
                            rs.getLong("org_id"),
                            rs.getLong("call_id"),
                            rs.getString("transcript_text"),
                            rs.getString("segments_json"),
                            rs.getInt("confidence"),
                            rs.getString("method_used"),
                            rs.getString("evidence_hash"),
                            JdbcSupport.longOrNull(rs, "retention_policy_id"),
                            JdbcSupport.instant(rs, "created_at")));
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Не удалось прочитать стенограммы", e);
        }
        return out;
    }
}
