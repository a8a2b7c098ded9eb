package ru.aritmos.commshub.model;

import io.micronaut.serde.annotation.Serdeable;

/**
 * Фрагмент стенограммы.
 *
 * @param start начало, секунды от начала звонка
 * @param end конец, секунды от начала звонка
 */
@Serdeable
public record TranscriptSegment(double start, double end, String speaker, String text, double confidence) {
}
