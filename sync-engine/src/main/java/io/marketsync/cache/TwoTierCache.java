package io.marketsync.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.marketsync.config.CachePolicy;
import io.marketsync.core.SeriesRow;
import io.marketsync.metrics.SyncMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fetch-result cache with an in-process tier in front of an optional durable tier.
 * <p>
 * Lookups try the in-process tier first, then the durable one; durable hits are copied back into memory.
 * Expired entries are dropped when a lookup finds them. If the durable tier fails, the cache logs once and keeps
 * working from memory only; callers never see durable-tier errors.
 */
public class TwoTierCache {
    private static final Logger log = LoggerFactory.getLogger(TwoTierCache.class);

    private final Cache<String, CacheEntry> memory;
    private final DurableTier durable;
    private final Clock clock;
    private final SyncMetrics metrics;
    private final AtomicBoolean degraded = new AtomicBoolean(false);

    public TwoTierCache(long maxVolatileEntries, DurableTier durable, Clock clock, SyncMetrics metrics) {
        this.memory = Caffeine.newBuilder()
                .maximumSize(Math.max(1, maxVolatileEntries))
                .build();
        this.durable = durable;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.metrics = metrics == null ? new SyncMetrics() : metrics;
    }

    /** In-memory only cache. */
    public static TwoTierCache volatileOnly(long maxEntries, SyncMetrics metrics) {
        return new TwoTierCache(maxEntries, null, Clock.systemUTC(), metrics);
    }

    /**
     * Cache backed by JSON files under {@code dir}. If the directory cannot be prepared the cache starts
     * in memory-only mode.
     */
    public static TwoTierCache withDirectory(Path dir, long maxVolatileEntries, Clock clock, SyncMetrics metrics) {
        try {
            return new TwoTierCache(maxVolatileEntries, new FileDurableTier(dir), clock, metrics);
        } catch (IOException e) {
            log.warn("cache directory {} unusable ({}); caching in memory only", dir, e.toString());
            if (metrics != null) metrics.counter(SyncMetrics.CACHE_DURABLE_FAILURES).inc();
            TwoTierCache cache = new TwoTierCache(maxVolatileEntries, null, clock, metrics);
            cache.degraded.set(true);
            return cache;
        }
    }

    public Optional<List<SeriesRow>> get(String fingerprint) {
        Instant now = clock.instant();
        CacheEntry hit = memory.getIfPresent(fingerprint);
        if (hit != null) {
            if (!hit.isExpired(now)) {
                metrics.counter(SyncMetrics.CACHE_HITS_VOLATILE).inc();
                return Optional.of(hit.payload());
            }
            memory.asMap().remove(fingerprint, hit);
            metrics.counter(SyncMetrics.CACHE_EXPIRED).inc();
        }
        if (durableUsable()) {
            try {
                Optional<CacheEntry> stored = durable.read(fingerprint);
                if (stored.isPresent()) {
                    CacheEntry e = stored.get();
                    if (!e.isExpired(now)) {
                        memory.put(fingerprint, e);
                        metrics.counter(SyncMetrics.CACHE_HITS_DURABLE).inc();
                        return Optional.of(e.payload());
                    }
                    durable.delete(fingerprint);
                    metrics.counter(SyncMetrics.CACHE_EXPIRED).inc();
                }
            } catch (IOException | UncheckedIOException e) {
                degrade("read", e);
            }
        }
        metrics.counter(SyncMetrics.CACHE_MISSES).inc();
        return Optional.empty();
    }

    /** Stores in both tiers. */
    public void set(String fingerprint, List<SeriesRow> payload, Duration ttl) {
        put(fingerprint, payload, ttl, CacheTier.DURABLE);
    }

    /** Stores in the in-process tier only, for short-lived categories. */
    public void setVolatile(String fingerprint, List<SeriesRow> payload, Duration ttl) {
        put(fingerprint, payload, ttl, CacheTier.VOLATILE);
    }

    public void set(String fingerprint, List<SeriesRow> payload, Duration ttl, CacheTier tier) {
        put(fingerprint, payload, ttl, tier);
    }

    public void set(String fingerprint, List<SeriesRow> payload, CachePolicy policy) {
        put(fingerprint, payload, policy.ttl(), policy.durable() ? CacheTier.DURABLE : CacheTier.VOLATILE);
    }

    private void put(String fingerprint, List<SeriesRow> payload, Duration ttl, CacheTier tier) {
        CacheEntry entry = new CacheEntry(fingerprint, payload, clock.instant(), ttl, tier);
        memory.put(fingerprint, entry);
        if (tier == CacheTier.DURABLE && durableUsable()) {
            try {
                durable.write(entry);
            } catch (IOException | UncheckedIOException e) {
                degrade("write", e);
            }
        }
    }

    /** Drops expired durable entries. Safe to call from a background schedule. */
    public int compact() {
        memory.asMap().values().removeIf(e -> e.isExpired(clock.instant()));
        if (!durableUsable()) return 0;
        try {
            int removed = durable.compact(clock.instant());
            if (removed > 0) log.debug("cache compaction removed {} durable entries", removed);
            return removed;
        } catch (IOException | UncheckedIOException e) {
            degrade("compact", e);
            return 0;
        }
    }

    public void clear() {
        memory.invalidateAll();
        if (!durableUsable()) return;
        try {
            durable.clear();
        } catch (IOException | UncheckedIOException e) {
            degrade("clear", e);
        }
    }

    public boolean isDegraded() { return degraded.get(); }

    public long volatileSize() {
        memory.cleanUp();
        return memory.estimatedSize();
    }

    private boolean durableUsable() {
        return durable != null && !degraded.get();
    }

    private void degrade(String op, Exception e) {
        metrics.counter(SyncMetrics.CACHE_DURABLE_FAILURES).inc();
        if (degraded.compareAndSet(false, true)) {
            log.warn("durable cache tier failed on {} ({}); continuing with the in-memory tier only", op, e.toString());
        }
    }
}
