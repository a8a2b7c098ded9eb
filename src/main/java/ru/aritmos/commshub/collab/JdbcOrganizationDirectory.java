package ru.aritmos.commshub.collab;

import jakarta.inject.Singleton;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Справочник организаций поверх таблиц {@code organizations} и {@code module_registry}.
 */
@Singleton
public class JdbcOrganizationDirectory implements OrganizationDirectory {

    private final DataSource dataSource;

    public JdbcOrganizationDirectory(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public boolean exists(long orgId) {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT 1 FROM organizations WHERE id=?")) {
            ps.setLong(1, orgId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Не удалось прочитать организацию", e);
        }
    }

    @Override
    public boolean moduleEnabled(long orgId, String moduleKey) {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT enabled, kill_switch FROM module_registry WHERE org_id=? AND module_key=?")) {
            ps.setLong(1, orgId);
            ps.setString(2, moduleKey);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return false;
                }
                return rs.getBoolean(1) && !rs.getBoolean(2);
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Не удалось прочитать реестр модулей", e);
        }
    }
}
