package ru.aritmos.commshub.collab;

import jakarta.inject.Singleton;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Политики хранения из таблицы {@code retention_policies}; берётся самая новая активная политика.
 */
@Singleton
public class JdbcRetentionPolicyDirectory implements RetentionPolicyDirectory {

    private final DataSource dataSource;

    public JdbcRetentionPolicyDirectory(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<Policy> lookup(long orgId, String classificationKey) {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT id, org_id, applies_to, retention_days FROM retention_policies " +
                             "WHERE org_id=? AND applies_to=? AND LOWER(status)='active' ORDER BY id DESC LIMIT 1")) {
            ps.setLong(1, orgId);
            ps.setString(2, classificationKey);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                int days = rs.getInt(4);
                Integer retentionDays = rs.wasNull() ? null : days;
                return Optional.of(new Policy(rs.getLong(1), rs.getLong(2), rs.getString(3), retentionDays));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Не удалось прочитать политику хранения", e);
        }
    }
}
