package ru.aritmos.commshub.model;

import java.time.Instant;

/**
 * Частичный агрегат звонка, извлечённый из одной webhook-доставки.
 * <p>
 * Пустые значения означают «нет данных» и при слиянии ничего не стирают.
 *
 * @param rawEventType сырой тип события провайдера (попадает в {@code lastEvent})
 * @param callState состояние после нормализации
 * @param durationSeconds длительность или null
 * @param occurredAt время события от провайдера или null
 * @param payloadJson сырой payload в JSON
 */
public record CallLogPatch(String externalCallId,
                           String direction,
                           String caller,
                           String recipient,
                           String rawEventType,
                           CallState callState,
                           String dtmfDigits,
                           Integer durationSeconds,
                           String recordingUrl,
                           String disposition,
                           Instant occurredAt,
                           String payloadJson) {
}
