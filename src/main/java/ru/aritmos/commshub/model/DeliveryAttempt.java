package ru.aritmos.commshub.model;

import io.micronaut.serde.annotation.Serdeable;

import java.time.Instant;

/**
 * Одна попытка вызова провайдера в рамках {@link CommsEvent}.
 */
@Serdeable
public record DeliveryAttempt(long id,
                              long orgId,
                              long eventId,
                              String provider,
                              String status,
                              String responseJson,
                              String error,
                              Instant createdAt) {
}
