package ru.aritmos.studioavailability.fetch;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.studioavailability.core.SensitiveDataSanitizer;
import ru.aritmos.studioavailability.error.ScraperAuthenticationException;
import ru.aritmos.studioavailability.error.SourceException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Клиент загрузки с ограниченным числом повторов.
 * <p>
 * Классификация ошибок:
 * <ul>
 *   <li>транзиентные (обрыв/отказ соединения, таймаут, HTTP 5xx и 429): повторяются с экспоненциальной паузой;</li>
 *   <li>HTTP 401/403: {@link ScraperAuthenticationException} сразу, без повторов;</li>
 *   <li>прочие 4xx: {@link SourceException} с {@code retryable=false} сразу, без повторов.</li>
 * </ul>
 * После исчерпания попыток последняя ошибка оборачивается в {@link SourceException} «retries exhausted».
 * <p>
 * Перенаправления (не более {@value #MAX_REDIRECTS}) выполняются здесь, а не транспортом:
 * cookie из {@code Set-Cookie} каждого перехода отправляются на следующий переход того же хоста
 * и попадают в итоговый ответ.
 * <p>
 * Клиент не хранит состояние между вызовами и безопасен для параллельного использования.
 */
@Singleton
public class ResilientFetchClient {

    private static final Logger log = LoggerFactory.getLogger(ResilientFetchClient.class);

    static final int MAX_REDIRECTS = 5;

    private final HttpTransport transport;
    private final RetryPolicy policy;
    private final Duration readTimeout;
    private final Sleeper sleeper;

    @Inject
    public ResilientFetchClient(HttpTransport transport, FetchProperties properties) {
        this(transport, properties.toRetryPolicy(), properties.readTimeout(), Sleeper.THREAD);
    }

    public ResilientFetchClient(HttpTransport transport, RetryPolicy policy, Duration readTimeout, Sleeper sleeper) {
        this.transport = transport;
        this.policy = policy == null ? RetryPolicy.defaults() : policy;
        this.readTimeout = readTimeout == null ? Duration.ofSeconds(30) : readTimeout;
        this.sleeper = sleeper == null ? Sleeper.THREAD : sleeper;
    }

    public RetryPolicy policy() {
        return policy;
    }

    /**
     * Выполнить запрос с повторами.
     *
     * @param sourceId идентификатор источника (для логов)
     * @param request запрос
     * @return успешный (2xx/3xx) ответ
     * @throws SourceException сетевая ошибка или исчерпание попыток
     * @throws ScraperAuthenticationException источник отклонил сессию
     */
    public FetchResponse execute(String sourceId, FetchRequest request) {
        String target = request.method() + " " + SensitiveDataSanitizer.sanitizeText(request.url());
        SourceException last = null;

        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            long startedAt = System.nanoTime();
            try {
                FetchResponse response = attemptOnce(request);
                log.debug("[FETCH] source={} {} attempt={}/{} status={} elapsedMs={} headers={}",
                        sourceId, target, attempt, policy.maxAttempts(), response.status(), elapsedMs(startedAt),
                        SensitiveDataSanitizer.sanitizeHeaders(request.headers()));
                return response;
            } catch (SourceException e) {
                log.warn("[FETCH] source={} {} attempt={}/{} failed elapsedMs={} retryable={} error={}",
                        sourceId, target, attempt, policy.maxAttempts(), elapsedMs(startedAt), e.retryable(),
                        SensitiveDataSanitizer.sanitizeText(e.getMessage()));
                if (!e.retryable()) {
                    throw e;
                }
                last = e;
            }

            if (attempt < policy.maxAttempts()) {
                Duration delay = policy.delayAfter(attempt);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new SourceException("Ожидание повтора прервано для " + target, false, -1, attempt, ie);
                }
            }
        }

        log.warn("[FETCH] source={} {} исчерпаны попытки: {}", sourceId, target, policy.maxAttempts());
        throw SourceException.exhausted(target, policy.maxAttempts(), last);
    }

    private FetchResponse attemptOnce(FetchRequest request) {
        FetchRequest current = request;
        List<String> setCookies = new ArrayList<>();
        for (int hop = 0; ; hop++) {
            FetchResponse response = exchangeOnce(current);
            if (!response.isRedirect()) {
                return response.withEarlierSetCookies(setCookies);
            }
            if (hop >= MAX_REDIRECTS) {
                throw new SourceException("Слишком много перенаправлений: " + MAX_REDIRECTS, false, response.status(), null);
            }
            setCookies.addAll(response.headers().getOrDefault("set-cookie", List.of()));
            current = redirectTarget(current, response);
        }
    }

    /**
     * Следующий запрос цепочки: 307/308 повторяют метод и форму, остальные коды переходят на GET.
     */
    static FetchRequest redirectTarget(FetchRequest request, FetchResponse response) {
        URI from = URI.create(request.url());
        URI to;
        try {
            to = from.resolve(response.location().orElseThrow());
        } catch (IllegalArgumentException e) {
            throw new SourceException("Некорректный адрес перенаправления: " + safeMsg(e), false, response.status(), e);
        }

        boolean keepMethod = response.status() == 307 || response.status() == 308;
        boolean sameHost = from.getHost() != null && from.getHost().equalsIgnoreCase(to.getHost());

        Map<String, String> cookies = new LinkedHashMap<>();
        Map<String, String> headers = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : request.headers().entrySet()) {
            if ("cookie".equalsIgnoreCase(e.getKey())) {
                if (sameHost) {
                    cookies.putAll(parseCookieHeader(e.getValue()));
                }
            } else if (keepMethod || !"content-type".equalsIgnoreCase(e.getKey())) {
                headers.put(e.getKey(), e.getValue());
            }
        }
        if (sameHost) {
            cookies.putAll(response.cookies());
        }
        if (!cookies.isEmpty()) {
            StringJoiner sj = new StringJoiner("; ");
            cookies.forEach((k, v) -> sj.add(k + "=" + v));
            headers.put("Cookie", sj.toString());
        }

        return keepMethod
                ? new FetchRequest(request.method(), to.toString(), headers, request.form())
                : new FetchRequest("GET", to.toString(), headers, Map.of());
    }

    private static Map<String, String> parseCookieHeader(String header) {
        Map<String, String> out = new LinkedHashMap<>();
        if (header == null) {
            return out;
        }
        for (String pair : header.split(";")) {
            int eq = pair.indexOf('=');
            if (eq > 0) {
                out.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
            }
        }
        return out;
    }

    private FetchResponse exchangeOnce(FetchRequest request) {
        FetchResponse response;
        try {
            response = transport.exchange(request, readTimeout);
        } catch (HttpConnectTimeoutException e) {
            throw new SourceException("Таймаут соединения: " + safeMsg(e), true, -1, e);
        } catch (HttpTimeoutException e) {
            throw new SourceException("Таймаут ответа: " + safeMsg(e), true, -1, e);
        } catch (ConnectException e) {
            throw new SourceException("Отказ соединения: " + safeMsg(e), true, -1, e);
        } catch (IOException e) {
            throw new SourceException("Сетевая ошибка: " + safeMsg(e), true, -1, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceException("Запрос прерван", false, -1, e);
        }

        int status = response.status();
        if (status == 401 || status == 403) {
            throw new ScraperAuthenticationException("Источник отклонил сессию: HTTP " + status);
        }
        if (status >= 500 || status == 429) {
            throw new SourceException("Источник вернул HTTP " + status, true, status, null);
        }
        if (status >= 400) {
            throw new SourceException("Источник вернул HTTP " + status, false, status, null);
        }
        return response;
    }

    private static long elapsedMs(long startedAt) {
        return (System.nanoTime() - startedAt) / 1_000_000;
    }

    private static String safeMsg(Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
