package ru.aritmos.commshub.model;

import io.micronaut.serde.annotation.Serdeable;

import java.util.List;

/**
 * Запрос на создание стенограммы.
 *
 * @param confidence уверенность распознавания 0..1
 * @param method способ получения ({@code local}, {@code manual}, ...)
 */
@Serdeable
public record TranscriptRequest(String text, List<TranscriptSegment> segments, double confidence, String method) {

    public TranscriptRequest {
        segments = segments == null ? List.of() : List.copyOf(segments);
        method = method == null || method.isBlank() ? "local" : method.trim();
    }
}
