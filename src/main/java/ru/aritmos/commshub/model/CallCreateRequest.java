package ru.aritmos.commshub.model;

import io.micronaut.serde.annotation.Serdeable;

/**
 * Регистрация звонка через API (ручной ввод или исходящий вызов, начатый оператором).
 *
 * @param externalCallId id звонка у провайдера, если уже известен; по нему последующие webhook-события
 *                       дополняют этот же агрегат
 */
@Serdeable
public record CallCreateRequest(String caller,
                                String recipient,
                                String direction,
                                Integer durationSeconds,
                                String recordingUrl,
                                String disposition,
                                String externalCallId) {

    public CallCreateRequest {
        direction = direction == null || direction.isBlank() ? "outbound" : direction.trim();
        durationSeconds = durationSeconds == null ? 0 : durationSeconds;
        disposition = disposition == null || disposition.isBlank() ? "unknown" : disposition.trim();
    }
}
