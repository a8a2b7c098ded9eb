package ru.aritmos.commshub.model;

/**
 * Явная идентичность инициатора действия для аудита.
 * <p>
 * Webhook-путь действует от имени системы провайдера, API-операции действуют от имени пользователя из заголовка.
 */
public record SystemActor(String kind, String id) {

    public static final SystemActor TELNYX_WEBHOOK = new SystemActor("system", "telnyx-webhook");

    public static SystemActor user(String userId) {
        if (userId == null || userId.isBlank()) {
            return new SystemActor("user", "anonymous");
        }
        return new SystemActor("user", userId.trim());
    }

    public String label() {
        return kind + ":" + id;
    }
}
