package ru.aritmos.commshub.model;

import io.micronaut.serde.annotation.Serdeable;

import java.time.Instant;

/**
 * Запись разговора, зарегистрированная по событию «запись доступна».
 *
 * @param storageKey ключ в хранилище (если запись скачана в собственное хранилище)
 * @param retentionPolicyId ссылка на политику хранения или null
 */
@Serdeable
public record Recording(long id,
                        long orgId,
                        long callId,
                        String providerRecordingId,
                        String recordingUrl,
                        String storageKey,
                        Long retentionPolicyId,
                        Instant createdAt) {
}
