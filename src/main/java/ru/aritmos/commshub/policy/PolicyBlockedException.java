package ru.aritmos.commshub.policy;

/**
 * Операция заблокирована решением BLOCK (например, активный legal hold).
 * <p>
 * HTTP-слой отвечает 423 Locked и возвращает пакет решения целиком.
 */
public class PolicyBlockedException extends RuntimeException {

    private final transient DecisionPacket packet;

    public PolicyBlockedException(String message, DecisionPacket packet) {
        super(message);
        this.packet = packet;
    }

    public DecisionPacket packet() {
        return packet;
    }
}
