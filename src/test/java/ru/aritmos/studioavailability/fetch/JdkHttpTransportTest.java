package ru.aritmos.studioavailability.fetch;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdkHttpTransportTest {

    private HttpServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void postSendsFormCookieAndUserAgent() throws Exception {
        AtomicReference<String> body = new AtomicReference<>();
        AtomicReference<String> cookie = new AtomicReference<>();
        AtomicReference<String> agent = new AtomicReference<>();
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/ajax", exchange -> {
            body.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            cookie.set(exchange.getRequestHeaders().getFirst("Cookie"));
            agent.set(exchange.getRequestHeaders().getFirst("User-Agent"));
            exchange.getResponseHeaders().add("Set-Cookie", "PHPSESSID=next; path=/");
            byte[] out = "<div>ok</div>".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, out.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(out);
            }
        });
        server.start();

        FetchProperties props = new FetchProperties();
        props.setUserAgent("studio-test");
        JdkHttpTransport transport = new JdkHttpTransport(props);

        Map<String, String> form = new LinkedHashMap<>();
        form.put("si", "12");
        form.put("date", "2025-01-07");
        FetchRequest request = FetchRequest.post(baseUrl() + "/ajax", form).withHeader("Cookie", "PHPSESSID=abc");

        FetchResponse response = transport.exchange(request, Duration.ofSeconds(5));

        assertEquals(200, response.status());
        assertEquals("<div>ok</div>", response.body());
        assertEquals("si=12&date=2025-01-07", body.get());
        assertEquals("PHPSESSID=abc", cookie.get());
        assertEquals("studio-test", agent.get());
        assertEquals("next", response.cookie("PHPSESSID").orElseThrow());
    }

    @Test
    void redirectIsReturnedWithoutFollowing() throws Exception {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/login", exchange -> {
            exchange.getResponseHeaders().add("Set-Cookie", "PHPSESSID=abc; path=/");
            exchange.getResponseHeaders().add("Location", "/landing");
            exchange.sendResponseHeaders(302, -1);
            exchange.close();
        });
        server.start();

        FetchResponse response = new JdkHttpTransport(new FetchProperties())
                .exchange(FetchRequest.get(baseUrl() + "/login"), Duration.ofSeconds(5));

        assertEquals(302, response.status());
        assertTrue(response.isRedirect());
        assertEquals("/landing", response.location().orElseThrow());
        assertEquals("abc", response.cookie("PHPSESSID").orElseThrow());
    }

    @Test
    void formValuesAreUrlEncoded() {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("start", "2025-01-07 00:00:00");
        form.put("month_btn", "");

        String encoded = JdkHttpTransport.encodeForm(form);

        assertEquals("start=2025-01-07+00%3A00%3A00&month_btn=", encoded);
    }

    @Test
    void slowResponseTimesOut() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(1500);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        server.start();

        JdkHttpTransport transport = new JdkHttpTransport(new FetchProperties());

        assertThrows(HttpTimeoutException.class,
                () -> transport.exchange(FetchRequest.get(baseUrl() + "/slow"), Duration.ofMillis(200)));
        assertTrue(server.getAddress().getPort() > 0);
    }

    private String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }
}
