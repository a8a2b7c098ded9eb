package ru.aritmos.commshub.collab;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.commshub.model.SystemActor;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

/**
 * Журнал аудита в таблице {@code comms_audit_log}.
 * <p>
 * Снимки before/after сериализуются в JSON как есть: вызывающий код не передаёт сюда сырые тела сообщений.
 */
@Singleton
public class JdbcAuditSink implements AuditSink {

    private static final Logger log = LoggerFactory.getLogger(JdbcAuditSink.class);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcAuditSink(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = dataSource;
        this.objectMapper = objectMapper;
    }

    @Override
    public void record(long orgId,
                       SystemActor actor,
                       String action,
                       String resource,
                       String resourceId,
                       Object before,
                       Object after,
                       String eventType) {
        SystemActor who = actor == null ? SystemActor.user(null) : actor;
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT INTO comms_audit_log (org_id, actor, action, resource, resource_id, event_type, before_json, after_json, created_at) " +
                             "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
            ps.setLong(1, orgId);
            ps.setString(2, who.label());
            ps.setString(3, action);
            ps.setString(4, resource);
            ps.setString(5, resourceId);
            ps.setString(6, eventType);
            ps.setString(7, toJson(before));
            ps.setString(8, toJson(after));
            ps.setTimestamp(9, Timestamp.from(Instant.now()));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Не удалось записать аудит", e);
        }
        log.info("[AUDIT] org={} actor={} action={} resource={}:{} event={}", orgId, who.label(), action, resource, resourceId, eventType);
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Снимок аудита не сериализуется в JSON", e);
        }
    }
}
