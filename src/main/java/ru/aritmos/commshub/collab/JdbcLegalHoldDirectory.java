package ru.aritmos.commshub.collab;

import jakarta.inject.Singleton;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

@Singleton
public class JdbcLegalHoldDirectory implements LegalHoldDirectory {

    private final DataSource dataSource;

    public JdbcLegalHoldDirectory(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<Hold> active(long orgId, String resourceType, String resourceId) {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT id, org_id, resource_type, resource_id, reason FROM legal_holds " +
                             "WHERE org_id=? AND resource_type=? AND resource_id=? AND UPPER(status)='ACTIVE' " +
                             "ORDER BY id DESC LIMIT 1")) {
            ps.setLong(1, orgId);
            ps.setString(2, resourceType);
            ps.setString(3, resourceId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new Hold(rs.getLong(1), rs.getLong(2), rs.getString(3), rs.getString(4), rs.getString(5)));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Не удалось проверить legal hold", e);
        }
    }
}
