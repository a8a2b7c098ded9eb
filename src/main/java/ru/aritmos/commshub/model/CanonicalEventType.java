package ru.aritmos.commshub.model;

/**
 * Канонический (не зависящий от провайдера) тип события жизненного цикла звонка.
 */
public enum CanonicalEventType {
    CALL_INITIATED("comms.call.initiated"),
    CALL_ANSWERED("comms.call.answered"),
    CALL_BRIDGED("comms.call.bridged"),
    CALL_HANGUP("comms.call.hangup"),
    RECORDING_AVAILABLE("comms.call.recording.saved"),
    PLAYBACK_ENDED("comms.call.playback.ended"),
    DTMF_RECEIVED("comms.call.dtmf.received"),
    UNKNOWN("comms.call.unknown");

    private final String code;

    CanonicalEventType(String code) {
        this.code = code;
    }

    /**
     * @return код события для аудита и таймлайна (например, {@code comms.call.answered})
     */
    public String code() {
        return code;
    }

    public static CanonicalEventType fromCode(String code) {
        if (code == null) {
            return UNKNOWN;
        }
        for (CanonicalEventType t : values()) {
            if (t.code.equals(code)) {
                return t;
            }
        }
        return UNKNOWN;
    }
}
