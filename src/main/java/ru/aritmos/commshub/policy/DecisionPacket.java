package ru.aritmos.commshub.policy;

import io.micronaut.serde.annotation.Serdeable;

import java.time.Instant;
import java.util.List;

/**
 * Структурированный, пригодный для аудита вердикт по чувствительной операции.
 *
 * @param component компонент, принявший решение
 * @param decision итоговое (самое строгое) решение
 * @param ruleIds коды правил в порядке добавления причин
 * @param confidence оценка уверенности 0..1
 * @param inputHash SHA-256 канонического входа
 * @param decisionId идентификатор, выдаваемый при фиксации в аудите (null до фиксации)
 * @param decidedAt время фиксации (null до фиксации)
 */
@Serdeable
public record DecisionPacket(String component,
                             String componentVersion,
                             Decision decision,
                             List<String> ruleIds,
                             List<DecisionReason> reasons,
                             List<Evidence> evidence,
                             double confidence,
                             String inputHash,
                             String decisionId,
                             Instant decidedAt) {

    public boolean blocked() {
        return decision == Decision.BLOCK;
    }

    public DecisionPacket stamped(String id, Instant at) {
        return new DecisionPacket(component, componentVersion, decision, ruleIds, reasons, evidence,
                confidence, inputHash, id, at);
    }
}
