package ru.aritmos.commshub.model;

import io.micronaut.serde.annotation.Serdeable;

import java.time.Instant;

/**
 * Стенограмма звонка.
 *
 * @param confidencePercent уверенность распознавания в процентах (0..100)
 * @param evidenceHash SHA-256 канонического содержимого стенограммы
 */
@Serdeable
public record Transcript(long id,
                         long orgId,
                         long callId,
                         String text,
                         String segmentsJson,
                         int confidencePercent,
                         String method,
                         String evidenceHash,
                         Long retentionPolicyId,
                         Instant createdAt) {
}
