package ru.aritmos.commshub.store;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.commshub.core.IdempotencyConflictException;
import ru.aritmos.commshub.model.CallEvent;
import ru.aritmos.commshub.model.CallEventDraft;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Идемпотентное хранилище событий таймлайна.
 * <p>
 * Решение «принято/дубликат» принимает уникальное ограничение {@code (org_id, dedup_key)}:
 * событие сначала вставляется, и только нарушение уникальности означает дубликат.
 * Проверки «сначала SELECT, потом INSERT» нет, поэтому две параллельные доставки одного события
 * не могут обе оказаться принятыми: проигравшая получает {@code accepted=false}.
 * <p>
 * Ключ идемпотентности:
 * <ul>
 *   <li>{@code evt:<provider_event_id>}, если провайдер передал id события;</li>
 *   <li>иначе {@code cmp:<external_call_id>|<canonical_type>|<occurred_at>}: два разных события одного типа
 *   с одинаковым временем считаются одним;</li>
 *   <li>без id и без времени ключа нет (NULL), и такая доставка всегда принимается.</li>
 * </ul>
 */
@Singleton
public class CallEventStore {

    private static final Logger log = LoggerFactory.getLogger(CallEventStore.class);

    private static final String COLUMNS =
            "id, org_id, call_id, external_call_id, event_type, raw_event_type, provider_event_id, occurred_at, dedup_key, payload_json, created_at";

    private final DataSource dataSource;

    public CallEventStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Результат попытки принять событие.
     *
     * @param event вставленное событие или уже существующее (для дубликата)
     */
    public record AcceptResult(boolean accepted, CallEvent event) {
    }

    /**
     * Вычислить ключ идемпотентности.
     *
     * @return ключ или null, если строить его не из чего
     */
    public static String dedupKey(String providerEventId, String externalCallId, String canonicalType, Instant occurredAt) {
        if (providerEventId != null && !providerEventId.isBlank()) {
            return "evt:" + providerEventId.trim();
        }
        if (occurredAt == null) {
            return null;
        }
        return "cmp:" + (externalCallId == null ? "" : externalCallId) + "|" + canonicalType + "|" + occurredAt;
    }

    /**
     * Принять событие в рамках транзакции вызывающего.
     * <p>
     * Вставка выполняется под собственным savepoint: нарушение уникальности откатывает только её,
     * остальная работа транзакции сохраняется.
     *
     * @param c соединение с открытой транзакцией
     * @param orgId организация
     * @param callId звонок, к которому относится событие
     * @param draft событие
     * @param timeoutSec таймаут SQL
     */
    public AcceptResult tryAccept(Connection c, long orgId, long callId, CallEventDraft draft, int timeoutSec) throws SQLException {
        String key = dedupKey(draft.providerEventId(), draft.externalCallId(), draft.eventType().code(), draft.occurredAt());
        try {
            return new AcceptResult(true, insert(c, orgId, callId, key, draft, timeoutSec));
        } catch (IdempotencyConflictException e) {
            CallEvent existing = findByDedupKey(c, orgId, e.dedupKey(), timeoutSec)
                    .orElseThrow(() -> new IllegalStateException("Нарушено ограничение целостности при вставке события", e.getCause()));
            log.debug("[WEBHOOK][DEDUP] org={} key={} existingEventId={}", orgId, key, existing.id());
            return new AcceptResult(false, existing);
        }
    }

    private CallEvent insert(Connection c, long orgId, long callId, String key, CallEventDraft draft, int timeoutSec) throws SQLException {
        Instant now = Instant.now();
        Savepoint sp = c.setSavepoint();
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO comms_call_events (org_id, call_id, external_call_id, event_type, raw_event_type, provider_event_id, occurred_at, dedup_key, payload_json, created_at) " +
                        "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                new String[]{"id"})) {
            ps.setQueryTimeout(timeoutSec);
            ps.setLong(1, orgId);
            ps.setLong(2, callId);
            ps.setString(3, draft.externalCallId());
            ps.setString(4, draft.eventType().code());
            ps.setString(5, draft.rawEventType());
            ps.setString(6, draft.providerEventId() == null ? "" : draft.providerEventId());
            JdbcSupport.setInstant(ps, 7, draft.occurredAt());
            ps.setString(8, key);
            ps.setString(9, draft.payloadJson());
            JdbcSupport.setInstant(ps, 10, now);
            ps.executeUpdate();
            long id = JdbcSupport.generatedId(ps);
            c.releaseSavepoint(sp);
            return new CallEvent(id, orgId, callId, draft.externalCallId(), draft.eventType().code(), draft.rawEventType(),
                    draft.providerEventId() == null ? "" : draft.providerEventId(), draft.occurredAt(), key, draft.payloadJson(), now);
        } catch (SQLException e) {
            c.rollback(sp);
            if (key != null && JdbcSupport.isIntegrityViolation(e)) {
                throw new IdempotencyConflictException(orgId, key, e);
            }
            throw e;
        }
    }

    public Optional<CallEvent> findByDedupKey(Connection c, long orgId, String key, int timeoutSec) throws SQLException {
        if (key == null) {
            return Optional.empty();
        }
        try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM comms_call_events WHERE org_id=? AND dedup_key=?")) {
            ps.setQueryTimeout(timeoutSec);
            ps.setLong(1, orgId);
            ps.setString(2, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    /**
     * Таймлайн звонка по внешнему id: по времени события (неизвестное время в конце), затем по порядку вставки.
     */
    public List<CallEvent> timeline(long orgId, String externalCallId) {
        return query("SELECT " + COLUMNS + " FROM comms_call_events WHERE org_id=? AND external_call_id=? " +
                "ORDER BY occurred_at ASC NULLS LAST, id ASC", orgId, externalCallId);
    }

    public List<CallEvent> listByCall(long orgId, long callId) {
        return query("SELECT " + COLUMNS + " FROM comms_call_events WHERE org_id=? AND call_id=? " +
                "ORDER BY occurred_at ASC NULLS LAST, id ASC", orgId, callId);
    }

    private List<CallEvent> query(String sql, long orgId, Object arg) {
        List<CallEvent> out = new ArrayList<>();
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, orgId);
            ps.setObject(2, arg);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Не удалось прочитать таймлайн звонка", e);
        }
        return out;
    }

    static CallEvent map(ResultSet rs) throws SQLException {
        return new CallEvent(
                rs.getLong("id"),
                rs.getLong("org_id"),
                rs.getLong("call_id"),
                rs.getString("external_call_id"),
                rs.getString("event_type"),
                rs.getString("raw_event_type"),
                rs.getString("provider_event_id"),
                JdbcSupport.instant(rs, "occurred_at"),
                rs.getString("dedup_key"),
                rs.getString("payload_json"),
                JdbcSupport.instant(rs, "created_at"));
    }
}
