package ru.aritmos.commshub.core;

/**
 * Не настроены учётные данные провайдера или иной обязательный параметр исходящей отправки.
 * <p>
 * Для клиента это нарушение предусловия (HTTP 412). Попытка отправки при этом уже записана как {@code failed}.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
