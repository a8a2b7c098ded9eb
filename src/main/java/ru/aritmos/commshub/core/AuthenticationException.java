package ru.aritmos.commshub.core;

/**
 * Запрос не прошёл проверку подлинности. Для webhook это отсутствие заголовков подписи, не настроенный
 * публичный ключ или несошедшаяся подпись; для API это отсутствие пользователя в режимах Keycloak.
 * <p>
 * Отвечаем 401. Сообщение не содержит ни подписи, ни тела запроса.
 */
public class AuthenticationException extends RuntimeException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
