package io.marketsync.financial;

import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.marketsync.core.DataSource;
import io.marketsync.core.SeriesRow;
import io.marketsync.error.FetchException;
import io.marketsync.error.NotFoundException;
import io.marketsync.error.TransientFetchException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Daily, weekly or monthly price bars from Yahoo Finance chart data.
 * Rows carry the columns open, high, low, close, adj_close and volume; bars without a close are skipped.
 */
public class YahooDataSource implements DataSource {
    public static final List<String> COLUMNS = List.of("open", "high", "low", "close", "adj_close", "volume");
    private static final Map<String, String> INTERVALS = Map.of("daily", "1d", "weekly", "1wk", "monthly", "1mo");

    private final YahooClient client;
    private final Clock clock;
    private final MetricRegistry registry;
    private final ObjectMapper json = new ObjectMapper();

    public YahooDataSource(YahooClient client) { this(client, Clock.systemUTC(), null); }

    public YahooDataSource(YahooClient client, Clock clock, MetricRegistry registry) {
        this.client = client;
        this.clock = clock;
        this.registry = registry;
    }

    @Override
    public List<SeriesRow> fetch(String subjectId, String category, LocalDate rangeStart, LocalDate rangeEnd) throws FetchException {
        String interval = INTERVALS.get(category);
        if (interval == null) throw new FetchException("unsupported category '" + category + "', expected one of " + INTERVALS.keySet());
        LocalDate start = rangeStart == null ? LocalDate.of(1970, 1, 1) : rangeStart;
        long p1 = start.atStartOfDay().toEpochSecond(ZoneOffset.UTC);
        long p2 = rangeEnd == null
                ? clock.instant().getEpochSecond()
                : rangeEnd.plusDays(1).atStartOfDay().toEpochSecond(ZoneOffset.UTC) - 1; // inclusive end
        if (registry != null) registry.counter("yahoo.fetch.windows").inc();
        String body = client.fetchChart(subjectId, p1, p2, interval);
        List<SeriesRow> rows = parse(subjectId, body, start, rangeEnd);
        if (registry != null) registry.counter("yahoo.rows").inc(rows.size());
        return rows;
    }

    List<SeriesRow> parse(String ticker, String body, LocalDate start, LocalDate end) throws FetchException {
        JsonNode root;
        try {
            root = json.readTree(body);
        } catch (JsonProcessingException e) {
            throw new TransientFetchException("unreadable chart for " + ticker + ": " + e.getOriginalMessage(), e);
        }
        JsonNode chart = root.path("chart");
        JsonNode error = chart.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            String code = error.path("code").asText("");
            if ("Not Found".equalsIgnoreCase(code)) throw new NotFoundException(ticker + ": " + error.path("description").asText(code));
            throw new TransientFetchException("yahoo error for " + ticker + ": " + code);
        }
        JsonNode result = chart.path("result");
        if (!result.isArray() || result.isEmpty()) throw new NotFoundException("empty chart for " + ticker);
        JsonNode series = result.get(0);
        JsonNode timestamps = series.path("timestamp");
        if (!timestamps.isArray()) return List.of();

        JsonNode quote = series.path("indicators").path("quote").path(0);
        JsonNode adj = series.path("indicators").path("adjclose").path(0).path("adjclose");
        List<SeriesRow> rows = new ArrayList<>(timestamps.size());
        for (int i = 0; i < timestamps.size(); i++) {
            LocalDate d = Instant.ofEpochSecond(timestamps.get(i).asLong()).atZone(ZoneOffset.UTC).toLocalDate();
            if (d.isBefore(start) || (end != null && d.isAfter(end))) continue;
            Double close = number(quote.path("close").path(i));
            if (close == null) continue;
            Map<String, Double> values = new LinkedHashMap<>();
            put(values, "open", number(quote.path("open").path(i)));
            put(values, "high", number(quote.path("high").path(i)));
            put(values, "low", number(quote.path("low").path(i)));
            values.put("close", close);
            put(values, "adj_close", adj.isArray() ? number(adj.path(i)) : close);
            put(values, "volume", number(quote.path("volume").path(i)));
            rows.add(new SeriesRow(ticker, d, values));
        }
        return rows;
    }

    private static Double number(JsonNode n) {
        return n.isNumber() ? n.asDouble() : null;
    }

    private static void put(Map<String, Double> values, String column, Double v) {
        if (v != null) values.put(column, v);
    }
}
