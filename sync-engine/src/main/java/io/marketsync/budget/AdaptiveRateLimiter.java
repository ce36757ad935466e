package io.marketsync.budget;

import io.marketsync.config.RateLimiterConfig;
import io.marketsync.metrics.SyncMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Spaces upstream requests by a minimum interval that shrinks after sustained success and grows on throttling.
 * <p>
 * {@link #acquire()} reserves the next grant slot inside the lock and sleeps outside it, so grants are strictly
 * serialized while reports from other workers are never stuck behind a sleeping caller.
 * Invariant: floor &lt;= minInterval &lt;= ceiling.
 */
public class AdaptiveRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(AdaptiveRateLimiter.class);
    private static final long MIN_GROWTH_NANOS = TimeUnit.MILLISECONDS.toNanos(1);

    private final RateLimiterConfig config;
    private final long floorNanos;
    private final long ceilingNanos;
    private final SyncMetrics metrics;
    private final LongSupplier nanoTime;

    // guarded by this
    private long minIntervalNanos;
    private boolean granted;
    private long lastGrantNanos;
    private long notBeforeNanos = Long.MIN_VALUE;
    private int consecutiveSuccesses;
    private int consecutiveThrottles;

    public AdaptiveRateLimiter(RateLimiterConfig config) { this(config, new SyncMetrics()); }

    public AdaptiveRateLimiter(RateLimiterConfig config, SyncMetrics metrics) {
        this(config, metrics, System::nanoTime);
    }

    AdaptiveRateLimiter(RateLimiterConfig config, SyncMetrics metrics, LongSupplier nanoTime) {
        this.config = config;
        this.floorNanos = config.floorInterval().toNanos();
        this.ceilingNanos = config.ceilingInterval().toNanos();
        this.minIntervalNanos = config.initialInterval().toNanos();
        this.metrics = metrics;
        this.nanoTime = nanoTime;
        metrics.gauge(SyncMetrics.LIMITER_INTERVAL_MS, () -> currentInterval().toMillis());
    }

    /** Blocks until the caller may send one request. */
    public void acquire() throws InterruptedException {
        long grantAt;
        synchronized (this) {
            long now = nanoTime.getAsLong();
            grantAt = now;
            if (granted && lastGrantNanos + minIntervalNanos - grantAt > 0) grantAt = lastGrantNanos + minIntervalNanos;
            if (notBeforeNanos != Long.MIN_VALUE && notBeforeNanos - grantAt > 0) grantAt = notBeforeNanos;
            lastGrantNanos = grantAt;
            granted = true;
        }
        long waitNanos = grantAt - nanoTime.getAsLong();
        if (waitNanos > 0) {
            metrics.timer(SyncMetrics.LIMITER_WAIT).update(waitNanos, TimeUnit.NANOSECONDS);
            TimeUnit.MILLISECONDS.sleep((waitNanos + 999_999) / 1_000_000);
        }
    }

    public synchronized void reportSuccess() {
        consecutiveThrottles = 0;
        consecutiveSuccesses++;
        if (consecutiveSuccesses >= config.successThreshold()) {
            long relaxed = (long) (minIntervalNanos * config.decreaseFactor());
            minIntervalNanos = clamp(relaxed);
            consecutiveSuccesses = 0;
        }
    }

    public void reportThrottled() { reportThrottled(Optional.empty()); }

    public synchronized void reportThrottled(Optional<Duration> retryAfter) {
        consecutiveSuccesses = 0;
        consecutiveThrottles++;
        long grown = (long) (Math.max(minIntervalNanos, MIN_GROWTH_NANOS) * config.backoffFactor());
        if (retryAfter.isPresent()) {
            long hint = retryAfter.get().toNanos();
            grown = Math.max(grown, hint);
            long until = nanoTime.getAsLong() + hint;
            if (notBeforeNanos == Long.MIN_VALUE || until - notBeforeNanos > 0) notBeforeNanos = until;
        }
        long before = minIntervalNanos;
        minIntervalNanos = clamp(grown);
        log.info("upstream throttled (streak {}), request interval {}ms -> {}ms{}", consecutiveThrottles,
                TimeUnit.NANOSECONDS.toMillis(before), TimeUnit.NANOSECONDS.toMillis(minIntervalNanos),
                retryAfter.map(d -> ", retry-after " + d.toMillis() + "ms").orElse(""));
    }

    public synchronized Duration currentInterval() {
        return Duration.ofNanos(minIntervalNanos);
    }

    public synchronized RateBudget snapshot() {
        Instant last = null;
        if (granted) {
            long agoNanos = nanoTime.getAsLong() - lastGrantNanos;
            last = Instant.now().minusNanos(agoNanos);
        }
        return new RateBudget(Duration.ofNanos(minIntervalNanos), config.floorInterval(), config.ceilingInterval(),
                last, consecutiveSuccesses, consecutiveThrottles);
    }

    public synchronized void reset() {
        minIntervalNanos = config.initialInterval().toNanos();
        granted = false;
        notBeforeNanos = Long.MIN_VALUE;
        consecutiveSuccesses = 0;
        consecutiveThrottles = 0;
    }

    private long clamp(long nanos) {
        return Math.max(floorNanos, Math.min(ceilingNanos, nanos));
    }
}
