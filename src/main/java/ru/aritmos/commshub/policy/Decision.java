package ru.aritmos.commshub.policy;

/**
 * Итог решения по чувствительной операции.
 * <p>
 * Строгость: {@code BLOCK > REQUIRE_CONFIRMATION > ALLOW}.
 */
public enum Decision {
    ALLOW(0),
    REQUIRE_CONFIRMATION(1),
    BLOCK(2);

    private final int strictness;

    Decision(int strictness) {
        this.strictness = strictness;
    }

    public static Decision strictest(Decision a, Decision b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return b.strictness > a.strictness ? b : a;
    }
}
