package ru.aritmos.studioavailability.fetch;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Ответ источника.
 *
 * @param status HTTP-статус
 * @param body тело ответа (строка, UTF-8)
 * @param headers заголовки ответа; имена приводятся к нижнему регистру
 */
public record FetchResponse(int status, String body, Map<String, List<String>> headers) {

    public FetchResponse {
        body = body == null ? "" : body;
        Map<String, List<String>> h = new LinkedHashMap<>();
        if (headers != null) {
            for (Map.Entry<String, List<String>> e : headers.entrySet()) {
                if (e.getKey() == null) {
                    continue;
                }
                h.put(e.getKey().toLowerCase(Locale.ROOT), e.getValue() == null ? List.of() : List.copyOf(e.getValue()));
            }
        }
        headers = Map.copyOf(h);
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public boolean hasBody() {
        return !body.isBlank();
    }

    /**
     * Перенаправление с заголовком {@code Location}.
     */
    public boolean isRedirect() {
        return (status == 301 || status == 302 || status == 303 || status == 307 || status == 308)
                && location().isPresent();
    }

    public Optional<String> location() {
        List<String> values = headers.getOrDefault("location", List.of());
        return values.isEmpty() || values.get(0) == null || values.get(0).isBlank()
                ? Optional.empty()
                : Optional.of(values.get(0).trim());
    }

    /**
     * Копия ответа, в которой перед собственными {@code Set-Cookie} стоят cookie предыдущих переходов.
     * Более поздние значения с тем же именем перекрывают ранние.
     */
    public FetchResponse withEarlierSetCookies(List<String> earlier) {
        if (earlier == null || earlier.isEmpty()) {
            return this;
        }
        List<String> merged = new ArrayList<>(earlier);
        merged.addAll(headers.getOrDefault("set-cookie", List.of()));
        Map<String, List<String>> h = new LinkedHashMap<>(headers);
        h.put("set-cookie", merged);
        return new FetchResponse(status, body, h);
    }

    /**
     * Cookie, выставленные источником через {@code Set-Cookie} (имя → значение).
     */
    public Map<String, String> cookies() {
        Map<String, String> out = new LinkedHashMap<>();
        for (String raw : headers.getOrDefault("set-cookie", List.of())) {
            if (raw == null) {
                continue;
            }
            String pair = raw.split(";", 2)[0];
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            out.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
        }
        return out;
    }

    public Optional<String> cookie(String name) {
        return Optional.ofNullable(cookies().get(name));
    }
}
