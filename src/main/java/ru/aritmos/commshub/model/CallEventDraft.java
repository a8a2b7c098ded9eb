package ru.aritmos.commshub.model;

import java.time.Instant;

/**
 * Событие таймлайна до вставки: звонок и ключ идемпотентности ещё не определены.
 */
public record CallEventDraft(String externalCallId,
                             CanonicalEventType eventType,
                             String rawEventType,
                             String providerEventId,
                             Instant occurredAt,
                             String payloadJson) {
}
