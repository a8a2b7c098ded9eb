package ru.aritmos.commshub.policy;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    LOW("Low", 0.05),
    MEDIUM("Medium", 0.15),
    HIGH("High", 0.25);

    private final String label;
    private final double penalty;

    Severity(String label, double penalty) {
        this.label = label;
        this.penalty = penalty;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Штраф к уверенности решения за причину такой серьёзности.
     */
    public double penalty() {
        return penalty;
    }
}
