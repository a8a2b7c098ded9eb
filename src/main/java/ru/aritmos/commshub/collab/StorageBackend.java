package ru.aritmos.commshub.collab;

/**
 * Хранилище бинарного содержимого (записи разговоров).
 */
public interface StorageBackend {

    /**
     * @throws ru.aritmos.commshub.core.NotFoundException если ключа нет
     */
    byte[] readBytes(String key);
}
