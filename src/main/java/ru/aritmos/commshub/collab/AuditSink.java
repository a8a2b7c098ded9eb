package ru.aritmos.commshub.collab;

import ru.aritmos.commshub.model.SystemActor;

/**
 * Журнал аудита (внешний коллаборатор).
 */
public interface AuditSink {

    /**
     * Записать действие.
     *
     * @param actor явный инициатор (система провайдера или пользователь)
     * @param action {@code create}, {@code update}, {@code read}, {@code blocked}, ...
     * @param resource тип ресурса ({@code comms_call}, {@code comms_recording}, ...)
     * @param before снимок до изменения или null
     * @param after снимок после изменения или null
     * @param eventType код события ({@code comms.call.answered}, {@code comms.recording.blocked}, ...)
     */
    void record(long orgId,
                SystemActor actor,
                String action,
                String resource,
                String resourceId,
                Object before,
                Object after,
                String eventType);
}
