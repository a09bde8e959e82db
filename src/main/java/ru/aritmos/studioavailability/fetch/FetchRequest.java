package ru.aritmos.studioavailability.fetch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Исходящий запрос к источнику.
 *
 * @param method HTTP-метод (GET/POST)
 * @param url абсолютный URL
 * @param headers заголовки (могут содержать cookie сессии, не логируются в сыром виде)
 * @param form поля формы {@code application/x-www-form-urlencoded} или пустая карта
 */
public record FetchRequest(String method, String url, Map<String, String> headers, Map<String, String> form) {

    public FetchRequest {
        method = method == null || method.isBlank() ? "GET" : method.trim().toUpperCase();
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        form = form == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(form));
    }

    public static FetchRequest get(String url) {
        return new FetchRequest("GET", url, Map.of(), Map.of());
    }

    public static FetchRequest post(String url, Map<String, String> form) {
        return new FetchRequest("POST", url, Map.of(), form);
    }

    /**
     * Копия запроса с дополнительным заголовком.
     */
    public FetchRequest withHeader(String name, String value) {
        if (name == null || name.isBlank() || value == null) {
            return this;
        }
        Map<String, String> h = new LinkedHashMap<>(headers);
        h.put(name, value);
        return new FetchRequest(method, url, h, form);
    }
}
