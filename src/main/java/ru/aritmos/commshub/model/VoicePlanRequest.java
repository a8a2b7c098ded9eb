package ru.aritmos.commshub.model;

import io.micronaut.serde.annotation.Serdeable;

/**
 * Запрос на план голосового вывода.
 *
 * @param ambientNoise уровень окружающего шума 0..1
 * @param allowSpeaker разрешён ли вывод на динамик устройства
 */
@Serdeable
public record VoicePlanRequest(String message, String urgency, double ambientNoise, Boolean allowSpeaker) {

    public VoicePlanRequest {
        urgency = urgency == null || urgency.isBlank() ? "informational" : urgency.trim();
        allowSpeaker = allowSpeaker == null ? Boolean.TRUE : allowSpeaker;
    }
}
