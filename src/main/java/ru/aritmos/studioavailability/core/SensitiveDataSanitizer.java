package ru.aritmos.studioavailability.core;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Санитайзер чувствительных данных сессий источников.
 * <p>
 * Назначение:
 * <ul>
 *   <li>не допустить попадания cookie сессии, CSRF-токенов и заголовков авторизации в логи;</li>
 *   <li>не отдавать их вызывающей стороне в тексте ошибок.</li>
 * </ul>
 * <p>
 * Санитайзер работает эвристически и не заменяет аккуратное логирование в коннекторах.
 */
public final class SensitiveDataSanitizer {

    private SensitiveDataSanitizer() {
    }

    /**
     * Заголовки, значения которых нельзя логировать.
     */
    private static final Set<String> FORBIDDEN_KEYS = Set.of(
            "authorization",
            "cookie",
            "set-cookie",
            "x-csrf-token",
            "x-xsrf-token"
    );

    private static final String MASK = "***";

    /**
     * Санитизировать заголовки (новая карта, ключи сохраняются).
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
            if (FORBIDDEN_KEYS.contains(k.toLowerCase(Locale.ROOT).trim())) {
                out.put(k, MASK);
                continue;
            }
            out.put(k, sanitizeText(e.getValue()));
        }
        return out;
    }

    /**
     * Санитизировать текст (сообщения об ошибках, URL с параметрами).
     * <p>
     * Маскируются {@code PHPSESSID=...}, {@code _token=...}, {@code Bearer ...}; переводы строк заменяются пробелами.
     */
    public static String sanitizeText(String text) {
        if (text == null || text.isBlank()) {
            return text;
        }
        String t = text;
        t = t.replaceAll("(?i)bearer\\s+[^\\s]+", "Bearer " + MASK);
        t = t.replaceAll("(?i)(phpsessid|_token|session|sid)\\s*=\\s*[^\\s&;\"]+", "$1=" + MASK);
        t = t.replaceAll("[\\r\\n\\t]", " ").trim();
        return t;
    }
}
