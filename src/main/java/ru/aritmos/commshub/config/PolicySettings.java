package ru.aritmos.commshub.config;

/**
 * Пороговые значения правил принятия решений.
 */
public record PolicySettings(double transcriptConfidenceThreshold, double ambientNoiseBlockThreshold) {

    public static PolicySettings defaults() {
        return new PolicySettings(0.75, 0.7);
    }
}
