package ru.aritmos.studioavailability.fetch;

import org.junit.jupiter.api.Test;
import ru.aritmos.studioavailability.error.ScraperAuthenticationException;
import ru.aritmos.studioavailability.error.SourceException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResilientFetchClientTest {

    private static final RetryPolicy POLICY =
            new RetryPolicy(4, Duration.ofMillis(100), Duration.ofMillis(150), Duration.ofMillis(500));

    @Test
    void transientFailuresAreRetriedUntilExhausted() {
        ScriptedTransport transport = new ScriptedTransport();
        for (int i = 0; i < 10; i++) {
            transport.fail(new ConnectException("Connection refused"));
        }
        List<Duration> delays = new ArrayList<>();
        ResilientFetchClient client = new ResilientFetchClient(transport, POLICY, Duration.ofSeconds(1), delays::add);

        SourceException ex = assertThrows(SourceException.class,
                () -> client.execute("studio_ol", FetchRequest.get("http://localhost/shop/1")));

        assertEquals(4, transport.calls);
        assertEquals(4, ex.attempts());
        assertTrue(ex.getMessage().contains("retries exhausted"));
        assertInstanceOf(SourceException.class, ex.getCause());
        assertEquals(List.of(Duration.ofMillis(150), Duration.ofMillis(200), Duration.ofMillis(400)), delays);
    }

    @Test
    void recoversAfterTransientServerErrors() {
        ScriptedTransport transport = new ScriptedTransport()
                .respond(503, "")
                .fail(new HttpTimeoutException("request timed out"))
                .respond(429, "")
                .respond(200, "ok");
        List<Duration> delays = new ArrayList<>();
        ResilientFetchClient client = new ResilientFetchClient(transport, POLICY, Duration.ofSeconds(1), delays::add);

        FetchResponse response = client.execute("pad_studio", FetchRequest.get("http://localhost/x"));

        assertEquals("ok", response.body());
        assertEquals(4, transport.calls);
        assertEquals(3, delays.size());
    }

    @Test
    void clientErrorIsNotRetried() {
        ScriptedTransport transport = new ScriptedTransport().respond(404, "").respond(200, "ok");
        ResilientFetchClient client = new ResilientFetchClient(transport, POLICY, Duration.ofSeconds(1), d -> { });

        SourceException ex = assertThrows(SourceException.class,
                () -> client.execute("studio246", FetchRequest.get("http://localhost/x")));

        assertEquals(1, transport.calls);
        assertFalse(ex.retryable());
        assertEquals(404, ex.httpStatus());
    }

    @Test
    void rejectedSessionRaisesAuthenticationError() {
        ScriptedTransport transport = new ScriptedTransport().respond(403, "").respond(200, "ok");
        ResilientFetchClient client = new ResilientFetchClient(transport, POLICY, Duration.ofSeconds(1), d -> { });

        assertThrows(ScraperAuthenticationException.class,
                () -> client.execute("pad_studio", FetchRequest.get("http://localhost/x")));
        assertEquals(1, transport.calls);
    }

    @Test
    void interruptedBackoffStopsRetrying() {
        ScriptedTransport transport = new ScriptedTransport().fail(new IOException("reset")).respond(200, "ok");
        ResilientFetchClient client = new ResilientFetchClient(transport, POLICY, Duration.ofSeconds(1), d -> {
            throw new InterruptedException("stop");
        });

        try {
            SourceException ex = assertThrows(SourceException.class,
                    () -> client.execute("pad_studio", FetchRequest.get("http://localhost/x")));
            assertFalse(ex.retryable());
            assertTrue(Thread.currentThread().isInterrupted());
            assertEquals(1, transport.calls);
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void redirectCarriesSessionCookieToNextHopAndResult() {
        ScriptedTransport transport = new ScriptedTransport()
                .respond(302, "", Map.of("Location", List.of("/landing"),
                        "Set-Cookie", List.of("PHPSESSID=abc; path=/")))
                .respond(200, "landing");
        ResilientFetchClient client = new ResilientFetchClient(transport, POLICY, Duration.ofSeconds(1), d -> { });

        FetchRequest post = FetchRequest.post("http://localhost/reserve/login", Map.of("si", "12"))
                .withHeader("Cookie", "lang=ja");
        FetchResponse response = client.execute("studio246", post);

        assertEquals(200, response.status());
        assertEquals("abc", response.cookie("PHPSESSID").orElseThrow());
        assertEquals(2, transport.requests.size());
        FetchRequest followed = transport.requests.get(1);
        assertEquals("GET", followed.method());
        assertEquals("http://localhost/landing", followed.url());
        assertTrue(followed.form().isEmpty());
        assertEquals("lang=ja; PHPSESSID=abc", followed.headers().get("Cookie"));
    }

    @Test
    void temporaryRedirectKeepsMethodAndForm() {
        ScriptedTransport transport = new ScriptedTransport()
                .respond(307, "", Map.of("Location", List.of("https://localhost/get_schedule_shop")))
                .respond(200, "[]");
        ResilientFetchClient client = new ResilientFetchClient(transport, POLICY, Duration.ofSeconds(1), d -> { });

        client.execute("studio_ol", FetchRequest.post("http://localhost/get_schedule_shop", Map.of("shop_id", "673")));

        FetchRequest followed = transport.requests.get(1);
        assertEquals("POST", followed.method());
        assertEquals("https://localhost/get_schedule_shop", followed.url());
        assertEquals(Map.of("shop_id", "673"), followed.form());
    }

    @Test
    void cookiesAreNotForwardedToAnotherHost() {
        ScriptedTransport transport = new ScriptedTransport()
                .respond(302, "", Map.of("Location", List.of("http://elsewhere.example/"),
                        "Set-Cookie", List.of("PHPSESSID=abc")))
                .respond(200, "ok");
        ResilientFetchClient client = new ResilientFetchClient(transport, POLICY, Duration.ofSeconds(1), d -> { });

        client.execute("studio246", FetchRequest.get("http://localhost/").withHeader("Cookie", "a=1"));

        assertFalse(transport.requests.get(1).headers().containsKey("Cookie"));
    }

    @Test
    void redirectLoopIsCutOff() {
        ScriptedTransport transport = new ScriptedTransport();
        for (int i = 0; i <= ResilientFetchClient.MAX_REDIRECTS; i++) {
            transport.respond(302, "", Map.of("Location", List.of("/again")));
        }
        ResilientFetchClient client = new ResilientFetchClient(transport, POLICY, Duration.ofSeconds(1), d -> { });

        SourceException ex = assertThrows(SourceException.class,
                () -> client.execute("pad_studio", FetchRequest.get("http://localhost/start")));

        assertFalse(ex.retryable());
        assertEquals(ResilientFetchClient.MAX_REDIRECTS + 1, transport.calls);
    }

    /**
     * Транспорт с заранее заданной последовательностью ответов.
     */
    static final class ScriptedTransport implements HttpTransport {

        private final Deque<Object> script = new ArrayDeque<>();
        final List<FetchRequest> requests = new ArrayList<>();
        int calls;

        ScriptedTransport respond(int status, String body) {
            return respond(status, body, Map.of());
        }

        ScriptedTransport respond(int status, String body, Map<String, List<String>> headers) {
            script.add(new FetchResponse(status, body, headers));
            return this;
        }

        ScriptedTransport fail(IOException e) {
            script.add(e);
            return this;
        }

        @Override
        public FetchResponse exchange(FetchRequest request, Duration readTimeout) throws IOException {
            calls++;
            requests.add(request);
            Object next = script.poll();
            if (next == null) {
                throw new IOException("script exhausted");
            }
            if (next instanceof IOException e) {
                throw e;
            }
            return (FetchResponse) next;
        }
    }
}
