package ru.aritmos.commshub.model;

/**
 * Состояние звонка.
 * <p>
 * Прогресс звонка упорядочен: {@code INITIATED < ANSWERED < BRIDGED < ENDED}. Агрегат всегда хранит
 * наиболее продвинутое из увиденных состояний, независимо от порядка прихода событий.
 * <p>
 * {@code RECORDED}, {@code PLAYBACK_COMPLETE}, {@code DTMF} являются побочными отметками: они попадают в таймлайн,
 * но состояние агрегата не меняют. {@code UNKNOWN} никогда не затирает известное состояние.
 */
public enum CallState {
    INITIATED(1),
    ANSWERED(2),
    BRIDGED(3),
    ENDED(4),
    RECORDED(0),
    PLAYBACK_COMPLETE(0),
    DTMF(0),
    UNKNOWN(0);

    private final int progress;

    CallState(int progress) {
        this.progress = progress;
    }

    /**
     * @return true, если состояние участвует в полном порядке прогресса звонка
     */
    public boolean isProgress() {
        return progress > 0;
    }

    public int progress() {
        return progress;
    }

    /**
     * Итоговое состояние агрегата после события.
     *
     * @param current текущее состояние агрегата (может быть null для нового звонка)
     * @param incoming состояние из события
     * @return наиболее продвинутое состояние; побочные отметки и UNKNOWN текущее значение не меняют
     */
    public static CallState advance(CallState current, CallState incoming) {
        if (incoming == null || !incoming.isProgress()) {
            return current == null ? UNKNOWN : current;
        }
        if (current == null || !current.isProgress()) {
            return incoming;
        }
        return incoming.progress > current.progress ? incoming : current;
    }

    public static CallState parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        try {
            return CallState.valueOf(raw.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
