package ru.aritmos.commshub.config;

/**
 * Неизменяемые настройки приёма webhook.
 *
 * @param requireSignature проверять подпись (по умолчанию true; отключение допустимо только для локальных повторов)
 * @param publicKey публичный ключ Ed25519 в base64 (32 байта или X.509 SubjectPublicKeyInfo)
 * @param defaultOrgId организация, если доставка её не указала (может быть null)
 * @param processingTimeoutSec ограничение времени на SQL-операции обработки доставки
 */
public record WebhookSettings(boolean requireSignature,
                              String signatureHeader,
                              String timestampHeader,
                              String publicKey,
                              Long defaultOrgId,
                              int processingTimeoutSec) {

    public static WebhookSettings defaults() {
        return new WebhookSettings(true, "telnyx-signature-ed25519", "telnyx-timestamp", null, null, 10);
    }

    public WebhookSettings withRequireSignature(boolean value) {
        return new WebhookSettings(value, signatureHeader, timestampHeader, publicKey, defaultOrgId, processingTimeoutSec);
    }

    public WebhookSettings withPublicKey(String value) {
        return new WebhookSettings(requireSignature, signatureHeader, timestampHeader, value, defaultOrgId, processingTimeoutSec);
    }

    public WebhookSettings withDefaultOrgId(Long value) {
        return new WebhookSettings(requireSignature, signatureHeader, timestampHeader, publicKey, value, processingTimeoutSec);
    }
}
