package ru.aritmos.commshub.policy;

import ru.aritmos.commshub.core.PayloadHasher;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Сборщик decision packet.
 * <p>
 * Чистая функция над входом: без I/O и без обращения к конфигурации. Итоговым решением становится самое строгое
 * среди причин; если причин нет, добавляется неявная причина ALLOW.
 */
public final class DecisionReasoner {

    static final String IMPLICIT_ALLOW = "DECISION.IMPLICIT.ALLOW.v1";

    private final String component;
    private final String componentVersion;
    private final List<DecisionReason> reasons = new ArrayList<>();
    private final List<Evidence> evidence = new ArrayList<>();

    public DecisionReasoner(String component, String componentVersion) {
        this.component = component;
        this.componentVersion = componentVersion;
    }

    /**
     * Добавить доказательство.
     *
     * @return хэш доказательства для ссылки из причины
     */
    public String addEvidence(Evidence e) {
        evidence.add(e);
        return e.hash();
    }

    public DecisionReasoner addReason(String code, String message, Severity severity, Decision decision, List<String> evidenceRefs) {
        reasons.add(new DecisionReason(code, message, severity, decision, evidenceRefs));
        return this;
    }

    /**
     * Сформировать пакет.
     *
     * @param input вход операции (хэшируется, в пакет не копируется)
     */
    public DecisionPacket evaluate(Object input) {
        return evaluate(component, componentVersion, reasons, evidence, input);
    }

    public static DecisionPacket evaluate(String component,
                                          String componentVersion,
                                          List<DecisionReason> candidateReasons,
                                          List<Evidence> evidence,
                                          Object input) {
        List<DecisionReason> all = new ArrayList<>(candidateReasons == null ? List.of() : candidateReasons);
        if (all.isEmpty()) {
            all.add(new DecisionReason(IMPLICIT_ALLOW, "Ограничений не найдено", Severity.LOW, Decision.ALLOW, List.of()));
        }

        Decision decision = Decision.ALLOW;
        List<String> ruleIds = new ArrayList<>(all.size());
        for (DecisionReason r : all) {
            decision = Decision.strictest(decision, r.decision());
            ruleIds.add(r.code());
        }

        return new DecisionPacket(
                component,
                componentVersion,
                decision,
                List.copyOf(ruleIds),
                List.copyOf(all),
                evidence == null ? List.of() : List.copyOf(evidence),
                confidence(decision, all),
                PayloadHasher.hash(input == null ? Map.of() : input),
                null,
                null);
    }

    static double confidence(Decision decision, List<DecisionReason> reasons) {
        double penalties = 0.0;
        for (DecisionReason r : reasons) {
            Severity s = r.severity() == null ? Severity.LOW : r.severity();
            penalties += s.penalty();
        }
        if (decision == Decision.REQUIRE_CONFIRMATION) {
            penalties += 0.1;
        } else if (decision == Decision.BLOCK) {
            penalties += 0.2;
        }
        double value = 1.0 - penalties;
        // округление убирает хвосты двоичной арифметики (0.6499999...)
        value = Math.round(value * 10_000d) / 10_000d;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
