package ru.aritmos.commshub.core;

/**
 * Запрошенный ресурс не найден в границах организации.
 * <p>
 * Чужой ресурс и отсутствующий ресурс неразличимы для вызывающего.
 */
public class NotFoundException extends RuntimeException {

    private final String resource;

    public NotFoundException(String resource, String message) {
        super(message);
        this.resource = resource;
    }

    public String resource() {
        return resource;
    }
}
