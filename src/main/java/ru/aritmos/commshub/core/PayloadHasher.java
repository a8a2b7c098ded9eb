package ru.aritmos.commshub.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Хэширование payload в каноническом JSON (ключи отсортированы, без пробелов).
 * <p>
 * Используется для evidence в decision packet и для хэша входа решения:
 * в пакет попадает только хэш, сырое содержимое туда не копируется.
 */
public final class PayloadHasher {

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private PayloadHasher() {
    }

    /**
     * Канонический JSON объекта.
     *
     * @param payload объект (Map/List/скаляр/record)
     * @return JSON-строка
     */
    public static String canonicalJson(Object payload) {
        try {
            return CANONICAL.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload не сериализуется в JSON", e);
        }
    }

    /**
     * SHA-256 канонического JSON в hex.
     *
     * @param payload объект
     * @return hex-строка из 64 символов
     */
    public static String hash(Object payload) {
        return sha256Hex(canonicalJson(payload));
    }

    public static String sha256Hex(String input) {
        return sha256Hex(input.getBytes(StandardCharsets.UTF_8));
    }

    public static String sha256Hex(byte[] bytes) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Не удалось вычислить SHA-256", e);
        }
    }
}
