package ru.aritmos.studioavailability.fetch;

import jakarta.inject.Singleton;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Транспорт на базе стандартного JDK {@link java.net.http.HttpClient}.
 * <p>
 * Таймаут соединения задаётся на клиенте, таймаут чтения задаётся на каждом запросе.
 * Перенаправления не выполняются: 3xx возвращается как есть, переходы и cookie промежуточных ответов
 * обрабатывает {@link ResilientFetchClient}.
 */
@Singleton
public class JdkHttpTransport implements HttpTransport {

    private final HttpClient client;
    private final String userAgent;

    public JdkHttpTransport(FetchProperties properties) {
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(100, properties.getConnectTimeoutMs())))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
        this.userAgent = properties.getUserAgent();
    }

    @Override
    public FetchResponse exchange(FetchRequest request, Duration readTimeout) throws IOException, InterruptedException {
        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(URI.create(request.url()))
                .timeout(readTimeout);

        if (userAgent != null && !userAgent.isBlank()) {
            b.header("User-Agent", userAgent);
        }
        for (Map.Entry<String, String> e : request.headers().entrySet()) {
            if (e.getKey() == null || e.getKey().isBlank()) {
                continue;
            }
            b.header(e.getKey(), e.getValue() == null ? "" : e.getValue());
        }

        if ("GET".equals(request.method())) {
            b.GET();
        } else {
            b.method(request.method(), HttpRequest.BodyPublishers.ofString(encodeForm(request.form()), StandardCharsets.UTF_8));
            if (!request.headers().containsKey("Content-Type")) {
                b.header("Content-Type", "application/x-www-form-urlencoded; charset=UTF-8");
            }
        }

        HttpResponse<String> resp = client.send(b.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        return new FetchResponse(resp.statusCode(), resp.body(), resp.headers().map());
    }

    static String encodeForm(Map<String, String> form) {
        StringJoiner sj = new StringJoiner("&");
        for (Map.Entry<String, String> e : form.entrySet()) {
            String v = e.getValue() == null ? "" : e.getValue();
            sj.add(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "=" + URLEncoder.encode(v, StandardCharsets.UTF_8));
        }
        return sj.toString();
    }
}
