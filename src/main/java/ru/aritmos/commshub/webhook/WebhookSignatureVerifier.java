package ru.aritmos.commshub.webhook;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import ru.aritmos.commshub.config.CommsHubProperties;
import ru.aritmos.commshub.config.WebhookSettings;
import ru.aritmos.commshub.core.AuthenticationException;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Проверка подписи Ed25519 входящей доставки Telnyx.
 * <p>
 * Подписывается строка {@code <timestamp>.<raw body>}: проверка идёт по исходным байтам тела,
 * а не по повторно сериализованному JSON.
 * <p>
 * Отключить проверку можно только флагом {@code commshub.webhook.require-signature=false}
 * (локальные повторы доставок); по умолчанию она обязательна.
 */
@Singleton
public class WebhookSignatureVerifier {

    /**
     * Префикс X.509 SubjectPublicKeyInfo для «сырого» 32-байтового ключа Ed25519.
     */
    private static final byte[] ED25519_SPKI_PREFIX = HexFormat.of().parseHex("302a300506032b6570032100");

    private final boolean requireSignature;
    private final PublicKey publicKey;

    @Inject
    public WebhookSignatureVerifier(CommsHubProperties properties) {
        this(properties.webhookSettings());
    }

    /**
     * @throws IllegalArgumentException если ключ задан, но не является ключом Ed25519
     */
    public WebhookSignatureVerifier(WebhookSettings settings) {
        this.requireSignature = settings.requireSignature();
        this.publicKey = settings.publicKey() == null || settings.publicKey().isBlank()
                ? null
                : parsePublicKey(settings.publicKey());
    }

    public boolean signatureRequired() {
        return requireSignature;
    }

    /**
     * Проверить доставку согласно настройке.
     *
     * @throws AuthenticationException нет заголовков, не настроен ключ или подпись не сошлась
     */
    public void verifyDelivery(byte[] rawBody, String signatureHeader, String timestampHeader) {
        if (!requireSignature) {
            return;
        }
        verify(rawBody, signatureHeader, timestampHeader, publicKey);
    }

    /**
     * Проверить подпись.
     *
     * @param rawBody исходные байты тела
     * @param signatureHeader подпись в base64
     * @param timestampHeader значение заголовка времени (входит в подписанную строку как есть)
     * @param key публичный ключ или null
     */
    public static void verify(byte[] rawBody, String signatureHeader, String timestampHeader, PublicKey key) {
        if (signatureHeader == null || signatureHeader.isBlank() || timestampHeader == null || timestampHeader.isBlank()) {
            throw new AuthenticationException("Нет подписи Telnyx");
        }
        if (key == null) {
            throw new AuthenticationException("Не настроен публичный ключ Telnyx");
        }

        byte[] signature;
        try {
            signature = Base64.getDecoder().decode(signatureHeader.trim());
        } catch (IllegalArgumentException e) {
            throw new AuthenticationException("Подпись Telnyx не в base64", e);
        }

        boolean valid;
        try {
            Signature verifier = Signature.getInstance("Ed25519");
            verifier.initVerify(key);
            verifier.update((timestampHeader + ".").getBytes(StandardCharsets.UTF_8));
            verifier.update(rawBody == null ? new byte[0] : rawBody);
            valid = verifier.verify(signature);
        } catch (GeneralSecurityException e) {
            throw new AuthenticationException("Подпись Telnyx не прошла проверку", e);
        }
        if (!valid) {
            throw new AuthenticationException("Подпись Telnyx не прошла проверку");
        }
    }

    /**
     * Разобрать ключ из base64: 32 байта «сырого» ключа или X.509 SubjectPublicKeyInfo.
     */
    public static PublicKey parsePublicKey(String base64) {
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(base64.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Публичный ключ Telnyx не в base64", e);
        }
        byte[] spki = raw;
        if (raw.length == 32) {
            spki = new byte[ED25519_SPKI_PREFIX.length + raw.length];
            System.arraycopy(ED25519_SPKI_PREFIX, 0, spki, 0, ED25519_SPKI_PREFIX.length);
            System.arraycopy(raw, 0, spki, ED25519_SPKI_PREFIX.length, raw.length);
        }
        try {
            return KeyFactory.getInstance("Ed25519").generatePublic(new X509EncodedKeySpec(spki));
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("Публичный ключ Telnyx не является ключом Ed25519", e);
        }
    }
}
