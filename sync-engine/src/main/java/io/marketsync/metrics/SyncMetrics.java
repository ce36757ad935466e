package io.marketsync.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

import java.util.function.Supplier;

/**
 * Named metrics shared by the sync components. One instance per registry.
 */
public class SyncMetrics {
    public static final String CACHE_HITS_VOLATILE = "cache.hits.volatile";
    public static final String CACHE_HITS_DURABLE = "cache.hits.durable";
    public static final String CACHE_MISSES = "cache.misses";
    public static final String CACHE_EXPIRED = "cache.expired";
    public static final String CACHE_DURABLE_FAILURES = "cache.durable.failures";
    public static final String FETCH_TIME = "fetch.time";
    public static final String FETCH_RETRIES = "fetch.retries";
    public static final String FETCH_FAILURES = "fetch.failures";
    public static final String FETCH_THROTTLED = "fetch.throttled";
    public static final String FETCH_NOT_FOUND = "fetch.notFound";
    public static final String LIMITER_WAIT = "ratelimit.wait";
    public static final String LIMITER_INTERVAL_MS = "ratelimit.interval.ms";
    public static final String BATCH_FLUSHES = "batch.flushes";
    public static final String BATCH_RECORDS = "batch.records";
    public static final String BATCH_FLUSH_FAILURES = "batch.flush.failures";
    public static final String BATCH_FLUSH_TIME = "batch.flush.time";

    private final MetricRegistry registry;

    public SyncMetrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public SyncMetrics() { this(new MetricRegistry()); }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Timer timer(String name) { return registry.timer(name); }

    public long count(String name) { return registry.counter(name).getCount(); }

    /** Registers the gauge once; later calls with the same name keep the first supplier. */
    public <T> void gauge(String name, Supplier<T> value) {
        registry.gauge(name, () -> (Gauge<T>) value::get);
    }
}
