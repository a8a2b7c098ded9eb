package ru.aritmos.commshub.config;

/**
 * Неизменяемые учётные данные и параметры клиента Telnyx.
 */
public record TelnyxSettings(String apiKey,
                             String fromNumber,
                             String messagingProfileId,
                             String connectionId,
                             String baseUrl,
                             int httpTimeoutMs) {

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * Строка для логов: ключ не раскрывается.
     */
    @Override
    public String toString() {
        return "TelnyxSettings[configured=" + configured() + ", baseUrl=" + baseUrl + ", httpTimeoutMs=" + httpTimeoutMs + "]";
    }
}
