package ru.aritmos.commshub.policy;

import io.micronaut.serde.annotation.Serdeable;

import java.util.List;

/**
 * Одна причина решения.
 *
 * @param code версионированный код правила ({@code COMMS.TRANSCRIPT.ALLOW.v1})
 * @param evidenceRefs хэши доказательств, на которые опирается причина
 */
@Serdeable
public record DecisionReason(String code,
                             String message,
                             Severity severity,
                             Decision decision,
                             List<String> evidenceRefs) {

    public DecisionReason {
        evidenceRefs = evidenceRefs == null ? List.of() : List.copyOf(evidenceRefs);
    }
}
