package ru.aritmos.commshub.webhook;

import java.time.Instant;

/**
 * Минимальная типизированная схема доставки Telnyx.
 * <p>
 * Конверт: {@code {"data": {"event_type", "id", "occurred_at", "payload": {...}}}}; верхнеуровневый
 * {@code payload} принимается для старого формата. Поля ниже извлекаются из payload; всё остальное
 * остаётся только в сыром снимке {@code rawJson}.
 *
 * @param rawEventType тип события провайдера ({@code unknown}, если не указан)
 * @param providerEventId {@code data.id} или {@code payload.event_id} (пустая строка, если нет)
 * @param occurredAt {@code data.occurred_at} или {@code payload.occurred_at}; null, если нет или не разбирается
 * @param externalCallId {@code call_control_id}, {@code call_leg_id} или {@code call_session_id}
 * @param orgId {@code payload.org_id} или {@code payload.metadata.org_id}
 * @param durationSeconds {@code duration} или {@code duration_seconds}; null, если нет
 * @param recordingUrl {@code recording_url} или {@code recording_urls.mp3}
 * @param hangupCause причина завершения; если нет, диспозицией становится тип события
 * @param rawJson исходное тело доставки
 */
public record WebhookEvent(String rawEventType,
                           String providerEventId,
                           Instant occurredAt,
                           String externalCallId,
                           Long orgId,
                           String direction,
                           String caller,
                           String recipient,
                           Integer durationSeconds,
                           String recordingUrl,
                           String recordingId,
                           String hangupCause,
                           String dtmfDigits,
                           String rawJson) {

    public String disposition() {
        return hangupCause != null && !hangupCause.isEmpty() ? hangupCause : rawEventType;
    }
}
