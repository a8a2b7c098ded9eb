package ru.aritmos.commshub.core;

import java.util.Map;
import java.util.UUID;

/**
 * Контекст корреляции входящего запроса (webhook или API).
 * <p>
 * Идентификаторы попадают в логи и в заголовки ответа, чтобы эксплуатация могла сопоставить
 * запись лога с конкретной доставкой провайдера.
 */
public record CorrelationContext(String correlationId, String requestId) {

    public static final String CORRELATION_HEADER = "X-Correlation-Id";
    public static final String REQUEST_HEADER = "X-Request-Id";

    public static CorrelationContext resolve(String correlationId, String requestId) {
        String corr = normalize(correlationId);
        String req = normalize(requestId);

        if (corr == null && req == null) {
            String generated = "ch-" + UUID.randomUUID();
            return new CorrelationContext(generated, generated);
        }
        if (corr == null) {
            return new CorrelationContext(req, req);
        }
        if (req == null) {
            return new CorrelationContext(corr, corr);
        }
        return new CorrelationContext(corr, req);
    }

    public static CorrelationContext fromHeaders(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) {
            return resolve(null, null);
        }
        return resolve(firstHeader(headers, CORRELATION_HEADER), firstHeader(headers, REQUEST_HEADER));
    }

    private static String firstHeader(Map<String, String> headers, String name) {
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey() != null && e.getKey().equalsIgnoreCase(name) && e.getValue() != null && !e.getValue().isBlank()) {
                return e.getValue().trim();
            }
        }
        return null;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String t = value.trim();
        return t.isEmpty() ? null : t;
    }
}
