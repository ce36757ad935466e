package io.marketsync.financial;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.marketsync.budget.AdaptiveRateLimiter;
import io.marketsync.cache.TwoTierCache;
import io.marketsync.config.SyncConfig;
import io.marketsync.core.DataSource;
import io.marketsync.core.PersistentStore;
import io.marketsync.core.TradingCalendar;
import io.marketsync.error.FailureLog;
import io.marketsync.error.FileFailureLog;
import io.marketsync.error.PersistenceException;
import io.marketsync.metrics.SyncMetrics;
import io.marketsync.retry.RetryController;
import io.marketsync.sync.SyncEngine;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires one {@link SyncEngine} per process from a {@link SyncConfig}: Yahoo as the source, H2/JDBC as the store.
 */
public class SyncModule extends AbstractModule {
    private final SyncConfig config;
    private final TradingCalendar calendar;
    private final Path failureLogFile;

    public SyncModule(SyncConfig config) { this(config, TradingCalendar.WEEKDAYS, null); }

    public SyncModule(SyncConfig config, TradingCalendar calendar, Path failureLogFile) {
        this.config = config;
        this.calendar = calendar;
        this.failureLogFile = failureLogFile;
    }

    @Override
    protected void configure() {
        bind(SyncConfig.class).toInstance(config);
        bind(TradingCalendar.class).toInstance(calendar);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton SyncMetrics syncMetrics(MetricRegistry registry) { return new SyncMetrics(registry); }

    @Provides @Singleton Clock clock() { return Clock.systemDefaultZone(); }

    @Provides @Singleton YahooClient yahooClient() {
        return new HttpYahooClient(HttpYahooClient.DEFAULT_BASE, Duration.ofSeconds(10), config.fetchTimeout());
    }

    @Provides @Singleton DataSource dataSource(YahooClient client, Clock clock, MetricRegistry registry) {
        return new YahooDataSource(client, clock, registry);
    }

    @Provides @Singleton JdbcPriceStore priceStore() throws PersistenceException {
        JdbcPriceStore store = new JdbcPriceStore(config.jdbcUrl(), config.table());
        store.ensureSchema();
        return store;
    }

    @Provides @Singleton PersistentStore persistentStore(JdbcPriceStore store) { return store; }

    @Provides @Singleton TwoTierCache cache(Clock clock, SyncMetrics metrics) {
        if (!config.cachePolicy().durable()) return new TwoTierCache(config.volatileMaxEntries(), null, clock, metrics);
        return TwoTierCache.withDirectory(config.cacheDir(), config.volatileMaxEntries(), clock, metrics);
    }

    @Provides @Singleton AdaptiveRateLimiter rateLimiter(SyncMetrics metrics) {
        return new AdaptiveRateLimiter(config.rateLimit(), metrics);
    }

    @Provides @Singleton RetryController retryController() { return new RetryController(config.retry()); }

    @Provides @Singleton FailureLog failureLog(Clock clock) throws IOException {
        return failureLogFile == null ? FailureLog.NONE : new FileFailureLog(failureLogFile, clock);
    }

    @Provides @Singleton SyncEngine syncEngine(DataSource source, PersistentStore store, TwoTierCache cache,
                                               AdaptiveRateLimiter limiter, RetryController retry, FailureLog failureLog,
                                               SyncMetrics metrics, Clock clock) {
        return new SyncEngine(config, source, store, cache, limiter, retry, calendar, failureLog, metrics, clock);
    }
}
