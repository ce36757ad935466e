package io.marketsync.financial;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.marketsync.error.NotFoundException;
import io.marketsync.error.ThrottledException;
import io.marketsync.error.TransientFetchException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class HttpYahooClientTest {
    HttpServer server;
    HttpYahooClient client;
    final AtomicReference<String> lastQuery = new AtomicReference<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/v8/finance/chart/", this::handle);
        server.start();
        URI base = URI.create("http://127.0.0.1:" + server.getAddress().getPort());
        client = new HttpYahooClient(base, Duration.ofSeconds(2), Duration.ofSeconds(2));
    }

    @AfterEach
    void stopServer() { server.stop(0); }

    private void handle(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        lastQuery.set(exchange.getRequestURI().getQuery());
        String ticker = path.substring(path.lastIndexOf('/') + 1);
        int status;
        String body = "";
        switch (ticker) {
            case "OK": status = 200; body = "{\"chart\":{\"result\":[],\"error\":null}}"; break;
            case "BUSY": status = 429; exchange.getResponseHeaders().add("Retry-After", "7"); break;
            case "DOWN": status = 503; break;
            case "NOPE": status = 404; break;
            default: status = 500;
        }
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Test
    void returns_body_and_sends_range() throws Exception {
        String body = client.fetchChart("OK", 100, 200, "1d");
        assertTrue(body.contains("\"chart\""));
        assertEquals("interval=1d&period1=100&period2=200", lastQuery.get());
    }

    @Test
    void maps_status_codes() {
        ThrottledException busy = assertThrows(ThrottledException.class, () -> client.fetchChart("BUSY", 0, 1, "1d"));
        assertEquals(Optional.of(Duration.ofSeconds(7)), busy.retryAfter());

        ThrottledException down = assertThrows(ThrottledException.class, () -> client.fetchChart("DOWN", 0, 1, "1d"));
        assertEquals(Optional.empty(), down.retryAfter());

        assertThrows(NotFoundException.class, () -> client.fetchChart("NOPE", 0, 1, "1d"));
        assertThrows(TransientFetchException.class, () -> client.fetchChart("BROKEN", 0, 1, "1d"));
    }

    @Test
    void unreachable_host_is_transient() {
        HttpYahooClient nowhere = new HttpYahooClient(URI.create("http://127.0.0.1:1"), Duration.ofSeconds(1), Duration.ofSeconds(1));
        assertThrows(TransientFetchException.class, () -> nowhere.fetchChart("OK", 0, 1, "1d"));
    }

    @Test
    void retry_after_header_forms() {
        assertEquals(Optional.of(Duration.ofSeconds(120)), HttpYahooClient.retryAfter(Optional.of(" 120 ")));
        assertEquals(Optional.empty(), HttpYahooClient.retryAfter(Optional.of("soon")));
        assertEquals(Optional.of(Duration.ZERO), HttpYahooClient.retryAfter(Optional.of("Wed, 21 Oct 2015 07:28:00 GMT")));
        assertEquals(Optional.empty(), HttpYahooClient.retryAfter(Optional.empty()));
    }
}
