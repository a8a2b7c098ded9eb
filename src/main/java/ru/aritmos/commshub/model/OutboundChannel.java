package ru.aritmos.commshub.model;

import java.util.Locale;

/**
 * Канал исходящей отправки.
 */
public enum OutboundChannel {
    SMS,
    FAX,
    VOICE;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException для неизвестного канала
     */
    public static OutboundChannel parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Не указан канал отправки");
        }
        try {
            return OutboundChannel.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Неподдерживаемый канал отправки: " + raw.trim());
        }
    }
}
