package ru.aritmos.commshub.delivery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.commshub.core.NotFoundException;
import ru.aritmos.commshub.core.SensitiveDataSanitizer;
import ru.aritmos.commshub.model.CommsEvent;
import ru.aritmos.commshub.model.DeliveryAttempt;
import ru.aritmos.commshub.model.DeliveryStatus;
import ru.aritmos.commshub.model.OutboundChannel;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Учёт исходящей работы: логический Event и история попыток доставки.
 * <p>
 * Event создаётся в статусе {@code queued} до вызова провайдера; каждая попытка добавляет строку
 * в {@code comms_delivery_attempts} и в той же транзакции переводит Event в статус своей попытки.
 * Автоматических повторов нет: {@code retry_queued} выставляет оператор.
 */
@Singleton
public class DeliveryAttemptTracker {

    private static final Logger log = LoggerFactory.getLogger(DeliveryAttemptTracker.class);

    public static final String OPERATOR_PROVIDER = "operator";

    private static final int ERROR_MAX_LENGTH = 2000;

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public DeliveryAttemptTracker(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = dataSource;
        this.objectMapper = objectMapper;
    }

    /**
     * Создать Event в статусе {@code queued}.
     *
     * @param payload получатель и обезличенное превью (без сырого текста)
     */
    public CommsEvent openEvent(long orgId, OutboundChannel channel, Map<String, Object> payload) {
        Instant now = Instant.now();
        String payloadJson = toJson(payload);
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT INTO comms_events (org_id, channel, status, payload_json, created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?)",
                     new String[]{"id"})) {
            ps.setLong(1, orgId);
            ps.setString(2, channel.code());
            ps.setString(3, DeliveryStatus.QUEUED.code());
            ps.setString(4, payloadJson);
            ps.setTimestamp(5, Timestamp.from(now));
            ps.setTimestamp(6, Timestamp.from(now));
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new IllegalStateException("INSERT comms_events не вернул id");
                }
                long id = keys.getLong(1);
                log.info("[DELIVERY][EVENT] queued org={} eventId={} channel={}", orgId, id, channel.code());
                return new CommsEvent(id, orgId, channel.code(), DeliveryStatus.QUEUED.code(), payloadJson, now, now, List.of());
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Не удалось создать событие доставки", e);
        }
    }

    /**
     * Записать попытку доставки и перевести Event в её статус.
     *
     * @param outcome {@code SENT}, {@code FAILED} или {@code RETRY_QUEUED}
     * @param response ответ провайдера (без секретов) или null
     * @param error текст ошибки (санитизируется) или null
     */
    public DeliveryAttempt recordAttempt(long orgId,
                                         long eventId,
                                         String provider,
                                         DeliveryStatus outcome,
                                         Map<String, Object> response,
                                         String error) {
        if (outcome == DeliveryStatus.QUEUED) {
            throw new IllegalArgumentException("Статус queued недопустим для попытки доставки");
        }
        Instant now = Instant.now();
        String responseJson = response == null ? null : toJson(response);
        String safeError = SensitiveDataSanitizer.safeShort(error, ERROR_MAX_LENGTH);

        try (Connection c = dataSource.getConnection()) {
            boolean autoCommit = c.getAutoCommit();
            c.setAutoCommit(false);
            try {
                try (PreparedStatement upd = c.prepareStatement(
                        "UPDATE comms_events SET status=?, updated_at=? WHERE org_id=? AND id=?")) {
                    upd.setString(1, outcome.code());
                    upd.setTimestamp(2, Timestamp.from(now));
                    upd.setLong(3, orgId);
                    upd.setLong(4, eventId);
                    if (upd.executeUpdate() == 0) {
                        throw new NotFoundException("comms_event", "Событие доставки не найдено");
                    }
                }
                long id;
                try (PreparedStatement ins = c.prepareStatement(
                        "INSERT INTO comms_delivery_attempts (org_id, event_id, provider, status, response_json, error, created_at) VALUES (?, ?, ?, ?, ?, ?, ?)",
                        new String[]{"id"})) {
                    ins.setLong(1, orgId);
                    ins.setLong(2, eventId);
                    ins.setString(3, provider);
                    ins.setString(4, outcome.code());
                    ins.setString(5, responseJson);
                    ins.setString(6, safeError);
                    ins.setTimestamp(7, Timestamp.from(now));
                    ins.executeUpdate();
                    try (ResultSet keys = ins.getGeneratedKeys()) {
                        if (!keys.next()) {
                            throw new IllegalStateException("INSERT comms_delivery_attempts не вернул id");
                        }
                        id = keys.getLong(1);
                    }
                }
                c.commit();
                log.info("[DELIVERY][ATTEMPT] org={} eventId={} provider={} status={}", orgId, eventId, provider, outcome.code());
                return new DeliveryAttempt(id, orgId, eventId, provider, outcome.code(), responseJson, safeError, now);
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Не удалось записать попытку доставки", e);
        }
    }

    /**
     * Поставить Event в очередь на повтор (действие оператора). Провайдер при этом не вызывается.
     *
     * @throws NotFoundException события нет в организации
     */
    public CommsEvent markRetryQueued(long orgId, long eventId) {
        recordAttempt(orgId, eventId, OPERATOR_PROVIDER, DeliveryStatus.RETRY_QUEUED, null, null);
        return get(orgId, eventId).orElseThrow(() -> new NotFoundException("comms_event", "Событие доставки не найдено"));
    }

    /**
     * Event с историей попыток.
     */
    public Optional<CommsEvent> get(long orgId, long eventId) {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT id, org_id, channel, status, payload_json, created_at, updated_at FROM comms_events WHERE org_id=? AND id=?")) {
            ps.setLong(1, orgId);
            ps.setLong(2, eventId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapEvent(rs).withAttempts(attempts(c, orgId, eventId)));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Не удалось прочитать событие доставки", e);
        }
    }

    /**
     * События организации, новые первыми (без истории попыток).
     */
    public List<CommsEvent> listEvents(long orgId, int limit) {
        int lim = Math.min(Math.max(1, limit), 500);
        List<CommsEvent> out = new ArrayList<>();
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT id, org_id, channel, status, payload_json, created_at, updated_at FROM comms_events " +
                             "WHERE org_id=? ORDER BY created_at DESC, id DESC LIMIT ?")) {
            ps.setLong(1, orgId);
            ps.setInt(2, lim);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapEvent(rs));
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Не удалось прочитать очередь доставки", e);
        }
        return out;
    }

    public List<DeliveryAttempt> listAttempts(long orgId, int limit) {
        int lim = Math.min(Math.max(1, limit), 500);
        List<DeliveryAttempt> out = new ArrayList<>();
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT id, org_id, event_id, provider, status, response_json, error, created_at FROM comms_delivery_attempts " +
                             "WHERE org_id=? ORDER BY created_at DESC, id DESC LIMIT ?")) {
            ps.setLong(1, orgId);
            ps.setInt(2, lim);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapAttempt(rs));
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Не удалось прочитать попытки доставки", e);
        }
        return out;
    }

    private List<DeliveryAttempt> attempts(Connection c, long orgId, long eventId) throws SQLException {
        List<DeliveryAttempt> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT id, org_id, event_id, provider, status, response_json, error, created_at FROM comms_delivery_attempts " +
                        "WHERE org_id=? AND event_id=? ORDER BY id ASC")) {
            ps.setLong(1, orgId);
            ps.setLong(2, eventId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapAttempt(rs));
                }
            }
        }
        return out;
    }

    private static CommsEvent mapEvent(ResultSet rs) throws SQLException {
        return new CommsEvent(
                rs.getLong(1),
                rs.getLong(2),
                rs.getString(3),
                rs.getString(4),
                rs.getString(5),
                rs.getTimestamp(6) == null ? null : rs.getTimestamp(6).toInstant(),
                rs.getTimestamp(7) == null ? null : rs.getTimestamp(7).toInstant(),
                List.of());
    }

    private static DeliveryAttempt mapAttempt(ResultSet rs) throws SQLException {
        return new DeliveryAttempt(
                rs.getLong(1),
                rs.getLong(2),
                rs.getLong(3),
                rs.getString(4),
                rs.getString(5),
                rs.getString(6),
                rs.getString(7),
                rs.getTimestamp(8) == null ? null : rs.getTimestamp(8).toInstant());
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value == null ? Map.of() : value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload доставки не сериализуется в JSON", e);
        }
    }
}
