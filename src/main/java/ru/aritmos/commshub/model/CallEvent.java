package ru.aritmos.commshub.model;

import io.micronaut.serde.annotation.Serdeable;

import java.time.Instant;

/**
 * Запись таймлайна звонка: одна строка на принятую (не дублирующую) доставку.
 * <p>
 * Неизменяема после записи.
 *
 * @param eventType канонический код ({@code comms.call.*})
 * @param rawEventType тип события провайдера
 * @param providerEventId id события провайдера (может быть пустым)
 * @param dedupKey вычисленный ключ идемпотентности (null, если ключ построить не из чего)
 */
@Serdeable
public record CallEvent(long id,
                        long orgId,
                        long callId,
                        String externalCallId,
                        String eventType,
                        String rawEventType,
                        String providerEventId,
                        Instant occurredAt,
                        String dedupKey,
                        String payloadJson,
                        Instant createdAt) {
}
