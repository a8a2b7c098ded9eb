package ru.aritmos.commshub.model;

import java.util.Locale;

/**
 * Статус логической единицы работы (Event) и исход отдельной попытки доставки.
 * <p>
 * {@code QUEUED} бывает только у Event; у попытки бывает {@code SENT}, {@code FAILED} или {@code RETRY_QUEUED}.
 */
public enum DeliveryStatus {
    QUEUED,
    SENT,
    FAILED,
    RETRY_QUEUED;

    /**
     * @return значение в БД и в API ({@code queued}, {@code sent}, ...)
     */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DeliveryStatus fromCode(String code) {
        if (code == null) {
            return QUEUED;
        }
        return DeliveryStatus.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
