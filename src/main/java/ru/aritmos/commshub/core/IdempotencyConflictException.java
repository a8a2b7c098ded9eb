package ru.aritmos.commshub.core;

/**
 * Нарушение уникальности ключа идемпотентности при вставке события таймлайна.
 * <p>
 * Наружу не пробрасывается: хранилище событий превращает его в решение «дубликат, уже принято».
 */
public class IdempotencyConflictException extends RuntimeException {

    private final long orgId;
    private final String dedupKey;

    public IdempotencyConflictException(long orgId, String dedupKey, Throwable cause) {
        super("Событие с ключом идемпотентности уже существует", cause);
        this.orgId = orgId;
        this.dedupKey = dedupKey;
    }

    public long orgId() {
        return orgId;
    }

    public String dedupKey() {
        return dedupKey;
    }
}
