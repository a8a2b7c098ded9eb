package ru.aritmos.commshub.store;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.commshub.collab.RetentionPolicyDirectory;
import ru.aritmos.commshub.core.NotFoundException;
import ru.aritmos.commshub.model.CallEventDraft;
import ru.aritmos.commshub.model.CallLog;
import ru.aritmos.commshub.model.CallLogPatch;
import ru.aritmos.commshub.model.CallState;
import ru.aritmos.commshub.model.CanonicalEventType;
import ru.aritmos.commshub.model.CallEvent;
import ru.aritmos.commshub.model.Recording;

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
 * Хранилище агрегатов звонков.
 * <p>
 * Применение события выполняется одной транзакцией: строка агрегата блокируется
 * ({@code SELECT ... FOR UPDATE}), событие принимается через {@link CallEventStore}, затем поля сливаются
 * и строка обновляется. Два обработчика событий одного звонка сериализуются на блокировке строки,
 * поэтому слияние не теряет обновлений. Конфликты сериализации и взаимоблокировки (SQLState 40)
 * приводят к повтору всей транзакции.
 */
@Singleton
public class CallAggregateRepository {

    private static final Logger log = LoggerFactory.getLogger(CallAggregateRepository.class);

    static final int MAX_TX_ATTEMPTS = 3;

    private static final String COLUMNS =
            "id, org_id, external_call_id, direction, caller, recipient, call_state, last_event, dtmf_digits, duration_seconds, " +
                    "recording_url, disposition, classification, linked_object_type, linked_object_id, answered_at, ended_at, " +
                    "payload_json, created_at, updated_at";

    private final DataSource dataSource;
    private final CallEventStore eventStore;
    private final RecordingRepository recordings;
    private final RetentionPolicyDirectory retentionPolicies;

    public CallAggregateRepository(DataSource dataSource,
                                   CallEventStore eventStore,
                                   RecordingRepository recordings,
                                   RetentionPolicyDirectory retentionPolicies) {
        this.dataSource = dataSource;
        this.eventStore = eventStore;
        this.recordings = recordings;
        this.retentionPolicies = retentionPolicies;
    }

    /**
     * Итог применения одной доставки.
     *
     * @param before агрегат до изменения (null, если звонок создан этой доставкой)
     * @param after агрегат после изменения
     * @param accepted событие новое (не дубликат)
     * @param event принятое событие или существующее событие-оригинал
     * @param recording зарегистрированная запись или null
     */
    public record ApplyResult(CallLog before, CallLog after, boolean accepted, CallEvent event, Recording recording) {

        public boolean created() {
            return before == null;
        }
    }

    private record Target(CallLog log, boolean created) {
    }

    /**
     * Применить событие к агрегату звонка.
     *
     * @param orgId организация
     * @param patch поля события
     * @param draft событие таймлайна
     * @param providerRecordingId id записи у провайдера (для событий «запись доступна»)
     * @param timeoutSec таймаут каждого SQL-запроса
     */
    public ApplyResult apply(long orgId, CallLogPatch patch, CallEventDraft draft, String providerRecordingId, int timeoutSec) {
        SQLException last = null;
        for (int attempt = 1; attempt <= MAX_TX_ATTEMPTS; attempt++) {
            try {
                return applyOnce(orgId, patch, draft, providerRecordingId, timeoutSec);
            } catch (SQLException e) {
                if (!JdbcSupport.isTransient(e)) {
                    throw new IllegalStateException("Не удалось применить событие звонка", e);
                }
                last = e;
                log.warn("[WEBHOOK][TX] transient failure org={} attempt={}/{} sqlState={}", orgId, attempt, MAX_TX_ATTEMPTS, e.getSQLState());
            }
        }
        throw new IllegalStateException("Не удалось применить событие звонка после " + MAX_TX_ATTEMPTS + " попыток", last);
    }

    private ApplyResult applyOnce(long orgId, CallLogPatch patch, CallEventDraft draft, String providerRecordingId, int timeoutSec) throws SQLException {
        try (Connection c = dataSource.getConnection()) {
            boolean autoCommit = c.getAutoCommit();
            c.setAutoCommit(false);
            try {
                ApplyResult result = applyInTx(c, orgId, patch, draft, providerRecordingId, timeoutSec);
                c.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(autoCommit);
            }
        }
    }

    private ApplyResult applyInTx(Connection c, long orgId, CallLogPatch patch, CallEventDraft draft,
                                  String providerRecordingId, int timeoutSec) throws SQLException {
        Instant now = Instant.now();
        Savepoint beforeTarget = c.setSavepoint();

        String ext = patch.externalCallId();
        Target target = (ext == null || ext.isEmpty())
                ? new Target(insertShell(c, CallLog.shell(orgId, null, now), timeoutSec), true)
                : lockOrCreate(c, orgId, ext, now, timeoutSec);

        CallEventStore.AcceptResult accept = eventStore.tryAccept(c, orgId, target.log().id(), draft, timeoutSec);
        CallLog after;
        if (!accept.accepted() && accept.event().callId() != target.log().id()) {
            // дубликат относится к другому звонку: у него обновляются только last_event и payload
            if (target.created()) {
                c.rollback(beforeTarget);
            }
            CallLog original = lockById(c, orgId, accept.event().callId(), timeoutSec)
                    .orElseThrow(() -> new IllegalStateException("Звонок события-оригинала не найден"));
            log.info("[WEBHOOK] duplicate of another call org={} ext={} originalCallId={}", orgId, ext, original.id());
            target = new Target(original, false);
            after = original.touch(patch.rawEventType(), patch.payloadJson(), now);
        } else {
            after = target.log().merge(patch, accept.accepted(), now);
        }

        CallLog before = target.created() ? null : target.log();
        if (!after.equals(target.log())) {
            update(c, after, timeoutSec);
        }

        Recording recording = null;
        if (accept.accepted()
                && draft.eventType() == CanonicalEventType.RECORDING_AVAILABLE
                && patch.recordingUrl() != null && !patch.recordingUrl().isEmpty()) {
            Long policyId = retentionPolicies.lookup(orgId, after.retentionKey())
                    .map(RetentionPolicyDirectory.Policy::id)
                    .orElse(null);
            recording = recordings.insert(c, orgId, after.id(), providerRecordingId, patch.recordingUrl(), policyId, timeoutSec);
        }
        return new ApplyResult(before, after, accept.accepted(), accept.event(), recording);
    }

    private Target lockOrCreate(Connection c, long orgId, String ext, Instant now, int timeoutSec) throws SQLException {
        Optional<CallLog> existing = lockByExternalId(c, orgId, ext, timeoutSec);
        if (existing.isPresent()) {
            return new Target(existing.get(), false);
        }
        Savepoint sp = c.setSavepoint();
        try {
            CallLog created = insertShell(c, CallLog.shell(orgId, ext, now), timeoutSec);
            c.releaseSavepoint(sp);
            return new Target(created, true);
        } catch (SQLException e) {
            if (!JdbcSupport.isIntegrityViolation(e)) {
                throw e;
            }
            // параллельная доставка успела создать звонок
            c.rollback(sp);
            CallLog raced = lockByExternalId(c, orgId, ext, timeoutSec)
                    .orElseThrow(() -> new IllegalStateException("Звонок не найден после конфликта вставки", e));
            return new Target(raced, false);
        }
    }

    private Optional<CallLog> lockByExternalId(Connection c, long orgId, String ext, int timeoutSec) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT " + COLUMNS + " FROM comms_call_logs WHERE org_id=? AND external_call_id=? FOR UPDATE")) {
            ps.setQueryTimeout(timeoutSec);
            ps.setLong(1, orgId);
            ps.setString(2, ext);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    private Optional<CallLog> lockById(Connection c, long orgId, long id, int timeoutSec) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT " + COLUMNS + " FROM comms_call_logs WHERE org_id=? AND id=? FOR UPDATE")) {
            ps.setQueryTimeout(timeoutSec);
            ps.setLong(1, orgId);
            ps.setLong(2, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    private CallLog insertShell(Connection c, CallLog shell, int timeoutSec) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO comms_call_logs (org_id, external_call_id, direction, call_state, dtmf_digits, duration_seconds, created_at, updated_at) " +
                        "VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                new String[]{"id"})) {
            ps.setQueryTimeout(timeoutSec);
            ps.setLong(1, shell.orgId());
            ps.setString(2, shell.externalCallId());
            ps.setString(3, shell.direction());
            ps.setString(4, shell.callState().name());
            ps.setString(5, shell.dtmfDigits());
            ps.setInt(6, shell.durationSeconds());
            JdbcSupport.setInstant(ps, 7, shell.createdAt());
            JdbcSupport.setInstant(ps, 8, shell.updatedAt());
            ps.executeUpdate();
            return shell.withId(JdbcSupport.generatedId(ps));
        }
    }

    private void update(Connection c, CallLog log, int timeoutSec) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE comms_call_logs SET external_call_id=?, direction=?, caller=?, recipient=?, call_state=?, last_event=?, " +
                        "dtmf_digits=?, duration_seconds=?, recording_url=?, disposition=?, classification=?, linked_object_type=?, " +
                        "linked_object_id=?, answered_at=?, ended_at=?, payload_json=?, updated_at=? WHERE org_id=? AND id=?")) {
            ps.setQueryTimeout(timeoutSec);
            ps.setString(1, log.externalCallId());
            ps.setString(2, log.direction());
            ps.setString(3, log.caller());
            ps.setString(4, log.recipient());
            ps.setString(5, log.callState().name());
            ps.setString(6, log.lastEvent());
            ps.setString(7, log.dtmfDigits());
            ps.setInt(8, log.durationSeconds());
            ps.setString(9, log.recordingUrl());
            ps.setString(10, log.disposition());
            ps.setString(11, log.classification());
            ps.setString(12, log.linkedObjectType());
            ps.setString(13, log.linkedObjectId());
            JdbcSupport.setInstant(ps, 14, log.answeredAt());
            JdbcSupport.setInstant(ps, 15, log.endedAt());
            ps.setString(16, log.payloadJson());
            JdbcSupport.setInstant(ps, 17, log.updatedAt());
            ps.setLong(18, log.orgId());
            ps.setLong(19, log.id());
            ps.executeUpdate();
        }
    }

    /**
     * Снимки агрегата до и после изменения через API.
     */
    public record Change(CallLog before, CallLog after) {
    }

    /**
     * Привязать звонок к объекту предметной области и задать классификацию.
     *
     * @throws NotFoundException если звонка нет в организации
     */
    public Change link(long orgId, long callId, String objectType, String objectId, String classification, int timeoutSec) {
        try (Connection c = dataSource.getConnection()) {
            boolean autoCommit = c.getAutoCommit();
            c.setAutoCommit(false);
            try {
                CallLog before = lockById(c, orgId, callId, timeoutSec)
                        .orElseThrow(() -> new NotFoundException("comms_call", "Звонок не найден"));
                CallLog after = before.withLink(objectType, objectId, classification, Instant.now());
                update(c, after, timeoutSec);
                c.commit();
                return new Change(before, after);
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Не удалось привязать звонок", e);
        }
    }

    /**
     * Сохранить звонок, зарегистрированный через API.
     *
     * @throws IllegalArgumentException звонок с таким внешним id в организации уже есть
     */
    public CallLog create(CallLog draft, int timeoutSec) {
        try (Connection c = dataSource.getConnection()) {
            boolean autoCommit = c.getAutoCommit();
            c.setAutoCommit(false);
            try {
                CallLog created = insertShell(c, draft, timeoutSec);
                update(c, created, timeoutSec);
                c.commit();
                return created;
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            if (JdbcSupport.isIntegrityViolation(e)) {
                throw new IllegalArgumentException("Звонок с внешним id " + draft.externalCallId() + " уже зарегистрирован", e);
            }
            throw new IllegalStateException("Не удалось зарегистрировать звонок", e);
        }
    }

    public Optional<CallLog> find(long orgId, long callId) {
        return queryOne("SELECT " + COLUMNS + " FROM comms_call_logs WHERE org_id=? AND id=?", orgId, callId);
    }

    public Optional<CallLog> findByExternalId(long orgId, String externalCallId) {
        return queryOne("SELECT " + COLUMNS + " FROM comms_call_logs WHERE org_id=? AND external_call_id=?", orgId, externalCallId);
    }

    /**
     * Звонки организации, новые первыми.
     */
    public List<CallLog> list(long orgId, int limit) {
        int lim = Math.min(Math.max(1, limit), 500);
        List<CallLog> out = new ArrayList<>();
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT " + COLUMNS + " FROM comms_call_logs WHERE org_id=? ORDER BY created_at DESC, id DESC LIMIT ?")) {
            ps.setLong(1, orgId);
            ps.setInt(2, lim);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Не удалось прочитать список звонков", e);
        }
        return out;
    }

    private Optional<CallLog> queryOne(String sql, long orgId, Object arg) {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, orgId);
            ps.setObject(2, arg);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Не удалось прочитать звонок", e);
        }
    }

    private static CallLog map(ResultSet rs) throws SQLException {
        return new CallLog(
                rs.getLong("id"),
                rs.getLong("org_id"),
                rs.getString("external_call_id"),
                rs.getString("direction"),
                rs.getString("caller"),
                rs.getString("recipient"),
                CallState.parse(rs.getString("call_state")),
                rs.getString("last_event"),
                rs.getString("dtmf_digits"),
                rs.getInt("duration_seconds"),
                rs.getString("recording_url"),
                rs.getString("disposition"),
                rs.getString("classification"),
                rs.getString("linked_object_type"),
                rs.getString("linked_object_id"),
                JdbcSupport.instant(rs, "answered_at"),
                JdbcSupport.instant(rs, "ended_at"),
                rs.getString("payload_json"),
                JdbcSupport.instant(rs, "created_at"),
                JdbcSupport.instant(rs, "updated_at"));
    }
}
