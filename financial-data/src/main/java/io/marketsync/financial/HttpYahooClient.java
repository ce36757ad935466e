package io.marketsync.financial;

import io.marketsync.error.FetchException;
import io.marketsync.error.NotFoundException;
import io.marketsync.error.ThrottledException;
import io.marketsync.error.TransientFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * {@link YahooClient} over java.net.http. Makes exactly one request per call; retries are the caller's business.
 * Status codes are mapped onto the fetch error taxonomy: 429/503 throttled, 404 not found, anything else non-2xx
 * transient.
 */
public final class HttpYahooClient implements YahooClient {
    private static final Logger log = LoggerFactory.getLogger(HttpYahooClient.class);
    public static final URI DEFAULT_BASE = URI.create("https://query1.finance.yahoo.com");

    private final HttpClient http;
    private final URI base;
    private final Duration requestTimeout;

    public HttpYahooClient() { this(DEFAULT_BASE, Duration.ofSeconds(10), Duration.ofSeconds(30)); }

    public HttpYahooClient(URI base, Duration connectTimeout, Duration requestTimeout) {
        this.base = base;
        this.requestTimeout = requestTimeout;
        this.http = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public String fetchChart(String ticker, long period1, long period2, String interval) throws FetchException {
        String url = String.format("%s/v8/finance/chart/%s?interval=%s&period1=%d&period2=%d",
                base.toString().replaceAll("/+$", ""),
                URLEncoder.encode(ticker, StandardCharsets.UTF_8),
                URLEncoder.encode(interval, StandardCharsets.UTF_8),
                period1, period2);
        HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                .header("User-Agent", "Mozilla/5.0")
                .header("Accept", "application/json")
                .timeout(requestTimeout)
                .GET()
                .build();
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransientFetchException("yahoo request for " + ticker + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientFetchException("yahoo request for " + ticker + " interrupted", e);
        }
        int status = resp.statusCode();
        if (status / 100 == 2) return resp.body();
        log.debug("yahoo answered {} for {}", status, ticker);
        switch (status) {
            case 429:
            case 503:
                throw new ThrottledException("yahoo throttled " + ticker + " (HTTP " + status + ")",
                        retryAfter(resp.headers().firstValue("Retry-After")).orElse(null));
            case 404:
                throw new NotFoundException("yahoo has no chart for " + ticker);
            default:
                throw new TransientFetchException("yahoo fetch for " + ticker + " failed with HTTP " + status);
        }
    }

    /** Retry-After is either delta-seconds or an HTTP date. */
    static Optional<Duration> retryAfter(Optional<String> header) {
        if (header.isEmpty()) return Optional.empty();
        String v = header.get().trim();
        try {
            return Optional.of(Duration.ofSeconds(Math.max(0, Long.parseLong(v))));
        } catch (NumberFormatException notSeconds) {
            try {
                ZonedDateTime at = ZonedDateTime.parse(v, DateTimeFormatter.RFC_1123_DATE_TIME);
                Duration d = Duration.between(ZonedDateTime.now(at.getZone()), at);
                return Optional.of(d.isNegative() ? Duration.ZERO : d);
            } catch (DateTimeParseException e) {
                log.debug("ignoring unparseable Retry-After '{}'", v);
                return Optional.empty();
            }
        }
    }
}
