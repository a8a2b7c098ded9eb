package ru.aritmos.commshub.webhook;

import jakarta.inject.Singleton;
import ru.aritmos.commshub.model.CallState;
import ru.aritmos.commshub.model.CanonicalEventType;

import java.util.Map;

/**
 * Перевод типов событий Telnyx в каноническую пару (состояние звонка, тип события).
 * <p>
 * Нормализация никогда не падает: неизвестный тип даёт {@code (UNKNOWN, UNKNOWN)}, и событие всё равно
 * попадает в таймлайн.
 */
@Singleton
public class TelnyxEventNormalizer {

    public record Normalized(CallState state, CanonicalEventType type) {
    }

    public static final Normalized UNKNOWN = new Normalized(CallState.UNKNOWN, CanonicalEventType.UNKNOWN);

    private static final Map<String, Normalized> TABLE = Map.of(
            "call.initiated", new Normalized(CallState.INITIATED, CanonicalEventType.CALL_INITIATED),
            "call.answered", new Normalized(CallState.ANSWERED, CanonicalEventType.CALL_ANSWERED),
            "call.bridged", new Normalized(CallState.BRIDGED, CanonicalEventType.CALL_BRIDGED),
            "call.hangup", new Normalized(CallState.ENDED, CanonicalEventType.CALL_HANGUP),
            "call.recording.saved", new Normalized(CallState.RECORDED, CanonicalEventType.RECORDING_AVAILABLE),
            "recording.available", new Normalized(CallState.RECORDED, CanonicalEventType.RECORDING_AVAILABLE),
            "call.playback.ended", new Normalized(CallState.PLAYBACK_COMPLETE, CanonicalEventType.PLAYBACK_ENDED),
            "call.dtmf.received", new Normalized(CallState.DTMF, CanonicalEventType.DTMF_RECEIVED)
    );

    public Normalized normalize(String rawEventType) {
        if (rawEventType == null) {
            return UNKNOWN;
        }
        return TABLE.getOrDefault(rawEventType.trim(), UNKNOWN);
    }
}
