package io.marketsync.config;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;

public record SyncConfig(
        Path cacheDir,
        String jdbcUrl,
        String table,
        String category,
        int workers,
        int batchSize,
        LocalDate historyStart,
        Duration fetchTimeout,
        long volatileMaxEntries,
        RetryConfig retry,
        RateLimiterConfig rateLimit,
        CachePolicy cachePolicy
) {
    public static final String DEFAULT_TABLE = "daily_bars";
    public static final String DEFAULT_CATEGORY = "daily";

    public static SyncConfig defaults() {
        return new SyncConfig(
                Path.of(System.getProperty("user.home"), ".cache", "market-sync"),
                "jdbc:h2:./market-sync-db",
                DEFAULT_TABLE,
                DEFAULT_CATEGORY,
                10,
                100,
                LocalDate.of(1970, 1, 1),
                Duration.ofSeconds(30),
                10_000,
                RetryConfig.defaults(),
                RateLimiterConfig.defaults(),
                CachePolicy.historical());
    }

    public static SyncConfig fromEnv() {
        SyncConfig d = defaults();
        Path cacheDir = Path.of(setting("marketsync.cache.dir", "MARKETSYNC_CACHE_DIR", d.cacheDir().toString()));
        String url = setting("marketsync.db.url", "MARKETSYNC_DB_URL", d.jdbcUrl());
        String table = setting("marketsync.db.table", "MARKETSYNC_DB_TABLE", d.table());
        String category = setting("marketsync.category", "MARKETSYNC_CATEGORY", d.category());
        int workers = Integer.parseInt(setting("marketsync.workers", "MARKETSYNC_WORKERS", String.valueOf(d.workers())));
        int batch = Integer.parseInt(setting("marketsync.batch", "MARKETSYNC_BATCH", String.valueOf(d.batchSize())));
        LocalDate start = LocalDate.parse(setting("marketsync.history.start", "MARKETSYNC_HISTORY_START", d.historyStart().toString()));
        Duration timeout = Duration.ofSeconds(Long.parseLong(setting("marketsync.fetch.timeout", "MARKETSYNC_FETCH_TIMEOUT", "30")));
        int retries = Integer.parseInt(setting("marketsync.retries", "MARKETSYNC_RETRIES", String.valueOf(d.retry().maxRetries())));
        long ttlHours = Long.parseLong(setting("marketsync.cache.ttl.hours", "MARKETSYNC_CACHE_TTL_HOURS", String.valueOf(d.cachePolicy().ttl().toHours())));
        boolean durable = Boolean.parseBoolean(setting("marketsync.cache.durable", "MARKETSYNC_CACHE_DURABLE", "true"));
        return new SyncConfig(cacheDir, url, table, category, workers, batch, start, timeout, d.volatileMaxEntries(),
                d.retry().withMaxRetries(retries), d.rateLimit(), new CachePolicy(Duration.ofHours(ttlHours), durable));
    }

    public SyncConfig withCacheDir(Path dir) {
        return new SyncConfig(dir, jdbcUrl, table, category, workers, batchSize, historyStart, fetchTimeout, volatileMaxEntries, retry, rateLimit, cachePolicy);
    }

    public SyncConfig withJdbcUrl(String url) {
        return new SyncConfig(cacheDir, url, table, category, workers, batchSize, historyStart, fetchTimeout, volatileMaxEntries, retry, rateLimit, cachePolicy);
    }

    public SyncConfig withRetry(RetryConfig r) {
        return new SyncConfig(cacheDir, jdbcUrl, table, category, workers, batchSize, historyStart, fetchTimeout, volatileMaxEntries, r, rateLimit, cachePolicy);
    }

    public SyncConfig withRateLimit(RateLimiterConfig r) {
        return new SyncConfig(cacheDir, jdbcUrl, table, category, workers, batchSize, historyStart, fetchTimeout, volatileMaxEntries, retry, r, cachePolicy);
    }

    public SyncConfig withCachePolicy(CachePolicy p) {
        return new SyncConfig(cacheDir, jdbcUrl, table, category, workers, batchSize, historyStart, fetchTimeout, volatileMaxEntries, retry, rateLimit, p);
    }

    public SyncConfig withCategory(String c) {
        return new SyncConfig(cacheDir, jdbcUrl, table, c, workers, batchSize, historyStart, fetchTimeout, volatileMaxEntries, retry, rateLimit, cachePolicy);
    }

    private static String setting(String property, String env, String fallback) {
        return System.getProperty(property, System.getenv().getOrDefault(env, fallback));
    }
}
