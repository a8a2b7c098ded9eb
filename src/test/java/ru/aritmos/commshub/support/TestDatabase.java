package ru.aritmos.commshub.support;

import org.flywaydb.core.Flyway;
import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.UUID;

/**
 * Изолированная H2-база в режиме PostgreSQL со схемой из миграций Flyway.
 */
public final class TestDatabase {

    private final JdbcDataSource dataSource;

    private TestDatabase(JdbcDataSource dataSource) {
        this.dataSource = dataSource;
    }

    public static TestDatabase create() {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
        ds.setUser("sa");
        ds.setPassword("");
        Flyway.configure()
                .dataSource(ds)
                .locations("classpath:db/migration")
                .load()
                .migrate();
        return new TestDatabase(ds);
    }

    public DataSource dataSource() {
        return dataSource;
    }

    /**
     * Организация с включённым (или выключенным) модулем связи.
     */
    public void organization(long orgId, boolean commsEnabled) {
        update("INSERT INTO organizations (id, name) VALUES (?, ?)", orgId, "org-" + orgId);
        update("INSERT INTO module_registry (org_id, module_key, enabled, kill_switch) VALUES (?, 'COMMS', ?, FALSE)", orgId, commsEnabled);
    }

    public long legalHold(long orgId, String resourceType, long resourceId) {
        return insert("INSERT INTO legal_holds (org_id, resource_type, resource_id, status, reason) VALUES (?, ?, ?, 'ACTIVE', 'litigation')",
                orgId, resourceType, String.valueOf(resourceId));
    }

    public void releaseHold(long holdId) {
        update("UPDATE legal_holds SET status='RELEASED' WHERE id=?", holdId);
    }

    public long retentionPolicy(long orgId, String appliesTo, int days) {
        return insert("INSERT INTO retention_policies (org_id, name, applies_to, retention_days, status) VALUES (?, ?, ?, ?, 'active')",
                orgId, appliesTo + "-policy", appliesTo, days);
    }

    public long count(String sql, Object... args) {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            bind(ps, args);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        } catch (SQLException e) {
            throw new IllegalStateException(e);
        }
    }

    public int update(String sql, Object... args) {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            bind(ps, args);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException(e);
        }
    }

    public long insert(String sql, Object... args) {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql, new String[]{"id"})) {
            bind(ps, args);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                keys.next();
                return keys.getLong(1);
            }
        } catch (SQLException e) {
            throw new IllegalStateException(e);
        }
    }

    private static void bind(PreparedStatement ps, Object... args) throws SQLException {
        for (int i = 0; i < args.length; i++) {
            ps.setObject(i + 1, args[i]);
        }
    }
}
