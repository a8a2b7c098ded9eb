package ru.aritmos.commshub.core;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Санитайзер чувствительных данных.
 * <p>
 * Назначение:
 * <ul>
 *   <li>защитить логи, журнал аудита и очередь доставки от случайного хранения токенов, ключей и подписей;</li>
 *   <li>не допустить хранения сырого текста сообщений (SMS/факс) в диагностических полях.</li>
 * </ul>
 * <p>
 * Важно: санитайзер работает эвристически и не заменяет DLP. Payload webhook-событий не модифицируется,
 * поэтому сырой payload нельзя логировать.
 */
public final class SensitiveDataSanitizer {

    private SensitiveDataSanitizer() {
    }

    /**
     * Заголовки/поля, которые нельзя хранить или логировать в сыром виде.
     */
    private static final Set<String> FORBIDDEN_KEYS = Set.of(
            "authorization",
            "cookie",
            "set-cookie",
            "x-auth-token",
            "x-access-token",
            "access_token",
            "api_key",
            "telnyx-signature-ed25519",
            "client_secret"
    );

    private static final String MASK = "***";

    /**
     * Длина превью тела сообщения, которое допускается хранить в очереди доставки.
     */
    public static final int PREVIEW_MAX_LENGTH = 160;

    /**
     * Санитизировать карту заголовков.
     *
     * @param headers исходные заголовки
     * @return санитизированные заголовки (новая карта)
     */
    public static Map<String, String> sanitizeHeaders(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) {
            return Map.of();
        }

        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : headers.entrySet()) {
            String k = e.getKey();
            if (k == null) {
                continue;
            }
            String keyNorm = k.toLowerCase(Locale.ROOT).trim();
            if (FORBIDDEN_KEYS.contains(keyNorm)) {
                out.put(k, MASK);
                continue;
            }
            out.put(k, sanitizeText(e.getValue()));
        }
        return out;
    }

    /**
     * Санитизировать текст (сообщения об ошибках, диагностические строки).
     * <p>
     * Маскируются Bearer-токены и параметры вида {@code api_key=...}; переводы строк схлопываются.
     *
     * @param text исходный текст
     * @return санитизированный текст
     */
    public static String sanitizeText(String text) {
        if (text == null || text.isBlank()) {
            return text;
        }

        String t = text;
        t = t.replaceAll("(?i)bearer\\s+[^\\s]+", "Bearer " + MASK);
        t = t.replaceAll("(?i)(api_key|client_secret|access_token)\\s*=\\s*[^\\s&]+", "$1=" + MASK);
        t = t.replaceAll("[\\r\\n\\t]", " ").trim();
        return t;
    }

    /**
     * Превью текста сообщения для очереди доставки: все цифры заменяются на {@code *},
     * длина ограничивается {@value #PREVIEW_MAX_LENGTH} символами.
     *
     * @param value исходный текст
     * @return превью без цифр (пустая строка для null)
     */
    public static String redactDigits(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            sb.append(Character.isDigit(ch) ? '*' : ch);
        }
        String out = sb.toString();
        return out.length() <= PREVIEW_MAX_LENGTH ? out : out.substring(0, PREVIEW_MAX_LENGTH);
    }

    /**
     * Обрезать и санитизировать строку для хранения в колонке ограниченной длины.
     *
     * @param s исходная строка
     * @param max максимальная длина
     * @return строка или null
     */
    public static String safeShort(String s, int max) {
        if (s == null) {
            return null;
        }
        String v = sanitizeText(s);
        if (v == null) {
            return null;
        }
        v = v.trim();
        return v.length() <= max ? v : v.substring(0, max);
    }
}
