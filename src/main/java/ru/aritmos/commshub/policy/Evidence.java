package ru.aritmos.commshub.policy;

import io.micronaut.serde.annotation.Serdeable;
import ru.aritmos.commshub.core.PayloadHasher;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ссылка на доказательство в decision packet.
 * <p>
 * Сырое содержимое сюда не попадает: только вид, источник, метаданные (хэши, идентификаторы) и хэш самой ссылки.
 *
 * @param kind вид доказательства ({@code transcript}, {@code legal_hold}, ...)
 * @param subject источник ({@code comms_call:42}, ...)
 * @param metadata метаданные низкой чувствительности, например {@code content_hash}
 * @param hash SHA-256 канонического JSON {kind, subject, metadata}
 */
@Serdeable
public record Evidence(String kind, String subject, Map<String, Object> metadata, String hash) {

    public static Evidence of(String kind, String subject, Map<String, Object> metadata) {
        Map<String, Object> meta = metadata == null ? Map.of() : Map.copyOf(metadata);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", kind);
        body.put("source", subject);
        body.put("metadata", meta);
        return new Evidence(kind, subject, meta, PayloadHasher.hash(body));
    }

    /**
     * Доказательство по содержимому: в метаданные кладётся только хэш содержимого.
     */
    public static Evidence ofContent(String kind, String subject, Object content) {
        return of(kind, subject, Map.of("content_hash", PayloadHasher.hash(content)));
    }
}
