package ru.aritmos.commshub.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Разбор тела доставки в {@link WebhookEvent}.
 * <p>
 * Строковые поля обрезаются до ширины колонок, в которые они попадают: слишком длинное значение
 * от провайдера не должно делать доставку неприменимой.
 */
@Singleton
public class WebhookEventParser {

    static final int MAX_ID = 256;
    static final int MAX_EVENT_TYPE = 128;
    static final int MAX_DIRECTION = 32;
    static final int MAX_PARTY = 128;
    static final int MAX_DISPOSITION = 128;
    static final int MAX_URL = 2048;
    static final int MAX_DIGITS = 256;

    private static final Logger log = LoggerFactory.getLogger(WebhookEventParser.class);

    private final ObjectMapper objectMapper;

    public WebhookEventParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws IllegalArgumentException тело не является JSON-объектом
     */
    public WebhookEvent parse(byte[] rawBody) {
        String text = rawBody == null ? "" : new String(rawBody, StandardCharsets.UTF_8);
        JsonNode body;
        try {
            body = text.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Тело webhook не является корректным JSON", e);
        } catch (IOException e) {
            throw new IllegalArgumentException("Не удалось прочитать тело webhook", e);
        }
        if (body == null || !body.isObject()) {
            throw new IllegalArgumentException("Тело webhook должно быть JSON-объектом");
        }

        JsonNode data = object(body.get("data"));
        JsonNode payload = object(data.get("payload"));
        if (payload.isEmpty()) {
            payload = object(body.get("payload"));
        }

        String eventType = first(text(data, "event_type"), text(body, "event_type"));
        String recordingUrl = first(text(payload, "recording_url"), text(object(payload.get("recording_urls")), "mp3"));

        return new WebhookEvent(
                clip("event_type", eventType.isEmpty() ? "unknown" : eventType, MAX_EVENT_TYPE),
                clip("id", first(text(data, "id"), text(payload, "event_id")), MAX_ID),
                parseInstant(first(text(data, "occurred_at"), text(payload, "occurred_at"))),
                clip("call_control_id",
                        first(text(payload, "call_control_id"), text(payload, "call_leg_id"), text(payload, "call_session_id")),
                        MAX_ID),
                orgId(payload),
                clip("direction", emptyTo(text(payload, "direction"), "inbound"), MAX_DIRECTION),
                clip("from", first(text(payload, "from"), text(payload, "caller"), text(payload, "from_number")), MAX_PARTY),
                clip("to", first(text(payload, "to"), text(payload, "recipient"), text(payload, "to_number")), MAX_PARTY),
                duration(payload),
                clip("recording_url", recordingUrl, MAX_URL),
                clip("recording_id", text(payload, "recording_id"), MAX_ID),
                clip("hangup_cause", text(payload, "hangup_cause"), MAX_DISPOSITION),
                clip("digits", first(text(payload, "digits"), text(payload, "dtmf")), MAX_DIGITS),
                text.isBlank() ? "{}" : text
        );
    }

    /**
     * ISO-8601 со смещением или {@code Z}; нераспознанное значение даёт null.
     */
    static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value.trim()).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Long orgId(JsonNode payload) {
        Long direct = asLong(payload.get("org_id"));
        if (direct != null) {
            return direct;
        }
        return asLong(object(payload.get("metadata")).get("org_id"));
    }

    private static Integer duration(JsonNode payload) {
        JsonNode n = payload.hasNonNull("duration") ? payload.get("duration") : payload.get("duration_seconds");
        if (n == null || n.isNull()) {
            return null;
        }
        if (n.isNumber()) {
            return n.intValue();
        }
        try {
            return (int) Double.parseDouble(n.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Long asLong(JsonNode n) {
        if (n == null || n.isNull()) {
            return null;
        }
        if (n.canConvertToLong() && n.isIntegralNumber()) {
            return n.longValue();
        }
        String s = n.asText().trim();
        if (s.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static JsonNode object(JsonNode n) {
        return n != null && n.isObject() ? n : JsonNodeFactory.instance.objectNode();
    }

    private static String text(JsonNode node, String field) {
        JsonNode n = node.get(field);
        if (n == null || n.isNull() || n.isContainerNode()) {
            return "";
        }
        return n.asText();
    }

    private static String first(String... values) {
        for (String v : values) {
            if (v != null && !v.isEmpty()) {
                return v;
            }
        }
        return "";
    }

    static String clip(String field, String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        log.warn("[WEBHOOK] field {} truncated from {} to {} chars", field, value.length(), max);
        return value.substring(0, max);
    }

    private static String emptyTo(String v, String fallback) {
        return v == null || v.isEmpty() ? fallback : v;
    }
}
