package io.marketsync.financial;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.ProvisionException;
import com.google.inject.util.Modules;
import io.marketsync.config.CachePolicy;
import io.marketsync.config.SyncConfig;
import io.marketsync.core.TradingCalendar;
import io.marketsync.error.FailureLog;
import io.marketsync.error.SyncFailedException;
import io.marketsync.metrics.SyncMetrics;
import io.marketsync.sync.SyncEngine;
import io.marketsync.sync.SyncRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * CLI: bring the price history of the given tickers up to date in a local database.
 * Exit code 0 when every ticker synced, 1 when some failed, 2 on bad arguments, an unusable database or a failed run.
 */
@CommandLine.Command(name = "market-sync", mixinStandardHelpOptions = true,
        description = "Synchronize Yahoo Finance price history into a local database")
public final class MarketSyncMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(MarketSyncMain.class);

    @CommandLine.Option(names = {"-t", "--ticker"}, split = ",", required = true, description = "Tickers (comma-separated or repeat option)")
    List<String> tickers = new ArrayList<>();

    @CommandLine.Option(names = "--db", description = "JDBC URL of the price database (default from MARKETSYNC_DB_URL or ./market-sync-db)")
    String jdbcUrl;

    @CommandLine.Option(names = "--cache-dir", description = "Directory of the durable fetch cache")
    Path cacheDir;

    @CommandLine.Option(names = {"-b", "--batch-size"}, description = "Rows per database transaction")
    Integer batchSize;

    @CommandLine.Option(names = {"-w", "--workers"}, description = "Concurrent fetches")
    Integer workers;

    @CommandLine.Option(names = "--force-full", description = "Refetch full history even for up-to-date tickers")
    boolean forceFull;

    @CommandLine.Option(names = "--category", description = "daily, weekly or monthly bars")
    String category;

    @CommandLine.Option(names = "--calendar", defaultValue = "weekdays", description = "Trading calendar: weekdays or nyse")
    String calendar;

    @CommandLine.Option(names = "--volatile-cache", description = "Keep the fetch cache in memory only")
    boolean volatileCache;

    @CommandLine.Option(names = "--compact-cache", description = "Drop expired cache files before syncing")
    boolean compactCache;

    @CommandLine.Option(names = "--failure-log", description = "Append failed tickers as JSON lines to this file")
    Path failureLog;

    Module overrides = Modules.EMPTY_MODULE;
    PrintStream out = System.out;
    PrintStream err = System.err;

    public static void main(String[] args) {
        int code = new CommandLine(new MarketSyncMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        SyncConfig config = SyncConfig.fromEnv();
        if (jdbcUrl != null) config = config.withJdbcUrl(jdbcUrl);
        if (cacheDir != null) config = config.withCacheDir(cacheDir);
        if (category != null) config = config.withCategory(category);
        if (volatileCache) config = config.withCachePolicy(CachePolicy.volatileOnly(config.cachePolicy().ttl()));
        int batch = batchSize == null ? config.batchSize() : batchSize;
        int threads = workers == null ? config.workers() : workers;
        if (batch < 1 || threads < 1) {
            err.println("--batch-size and --workers must be at least 1");
            return 2;
        }
        TradingCalendar tradingCalendar = calendarFor(calendar);
        if (tradingCalendar == null) {
            err.println("Unknown calendar '" + calendar + "', expected weekdays or nyse");
            return 2;
        }

        Injector injector;
        SyncEngine engine;
        FailureLog failures;
        try {
            injector = Guice.createInjector(
                    Modules.override(new SyncModule(config, tradingCalendar, failureLog)).with(overrides));
            engine = injector.getInstance(SyncEngine.class);
            failures = injector.getInstance(FailureLog.class);
        } catch (CreationException | ProvisionException e) {
            log.error("startup failed", e);
            err.println("Sync could not start: " + describe(e.getCause() == null ? e : e.getCause()));
            return 2;
        }
        MetricRegistry registry = injector.getInstance(MetricRegistry.class);
        if (compactCache) log.info("cache compaction removed {} expired entries", engine.cache().compact());

        try (failures) {
            SyncRun run = engine.runSync(tickers, batch, threads, forceFull);
            printRun(run);
            printOnce(registry);
            return run.hasFailures() ? 1 : 0;
        } catch (SyncFailedException e) {
            err.println("Sync failed: " + e.getMessage());
            printRun(e.partialRun());
            printOnce(registry);
            return 2;
        }
    }

    private static String describe(Throwable t) {
        Throwable root = t.getCause();
        return root == null ? t.getMessage() : t.getMessage() + " (" + root.getMessage() + ")";
    }

    static TradingCalendar calendarFor(String name) {
        String n = name == null ? "" : name.toLowerCase(Locale.ROOT);
        if (n.equals("weekdays")) return TradingCalendar.WEEKDAYS;
        if (n.equals("nyse") || n.equals("us")) return UsEquityCalendar.INSTANCE;
        return null;
    }

    private void printRun(SyncRun run) {
        out.println("Sync: " + run.summary() + " (" + run.notFound() + " without data, "
                + run.rowsPersisted() + " rows persisted, " + run.elapsed().toMillis() + "ms"
                + (run.cancelled() ? ", cancelled" : "") + ")");
        if (!run.failedSubjects().isEmpty()) out.println("  failed: " + run.failedSubjects());
        for (String f : run.flushFailures()) out.println("  flush failure: " + f);
    }

    private void printOnce(MetricRegistry r) {
        Timer fetch = r.timer(SyncMetrics.FETCH_TIME);
        Object interval = r.getGauges().containsKey(SyncMetrics.LIMITER_INTERVAL_MS)
                ? r.getGauges().get(SyncMetrics.LIMITER_INTERVAL_MS).getValue() : "-";
        out.println("metrics:" +
                " cacheHits=" + count(r, SyncMetrics.CACHE_HITS_VOLATILE) + "/" + count(r, SyncMetrics.CACHE_HITS_DURABLE) +
                " misses=" + count(r, SyncMetrics.CACHE_MISSES) +
                " | fetches=" + fetch.getCount() + " p50(ms)=" + nsToMs(fetch.getSnapshot().getMedian()) +
                " retries=" + count(r, SyncMetrics.FETCH_RETRIES) +
                " throttled=" + count(r, SyncMetrics.FETCH_THROTTLED) +
                " failures=" + count(r, SyncMetrics.FETCH_FAILURES) +
                " | interval(ms)=" + interval +
                " | flushes=" + count(r, SyncMetrics.BATCH_FLUSHES) + " rows=" + count(r, SyncMetrics.BATCH_RECORDS));
    }

    private static long count(MetricRegistry r, String name) { return r.counter(name).getCount(); }

    private static String nsToMs(double nanos) { return String.format(Locale.ROOT, "%.3f", nanos / 1_000_000.0); }
}
