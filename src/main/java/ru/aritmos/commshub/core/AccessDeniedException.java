package ru.aritmos.commshub.core;

/**
 * Пользователь аутентифицирован, но не вправе обращаться к запрошенной организации.
 * <p>
 * API отвечает 403.
 */
public class AccessDeniedException extends RuntimeException {

    public AccessDeniedException(String message) {
        super(message);
    }
}
