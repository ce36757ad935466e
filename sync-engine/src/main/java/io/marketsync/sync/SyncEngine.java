package io.marketsync.sync;

import io.marketsync.batch.BatchAccumulator;
import io.marketsync.budget.AdaptiveRateLimiter;
import io.marketsync.cache.TwoTierCache;
import io.marketsync.config.SyncConfig;
import io.marketsync.core.DataSource;
import io.marketsync.core.PersistentStore;
import io.marketsync.core.TradingCalendar;
import io.marketsync.error.FailureLog;
import io.marketsync.error.SyncFailedException;
import io.marketsync.metrics.SyncMetrics;
import io.marketsync.retry.RetryController;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Entry point of a synchronization. Holds the long-lived collaborators (cache, limiter, retry controller,
 * source, store) and creates a fresh accumulator and orchestrator for every run.
 */
public class SyncEngine {
    private final SyncConfig config;
    private final DataSource source;
    private final PersistentStore store;
    private final TwoTierCache cache;
    private final AdaptiveRateLimiter limiter;
    private final RetryController retry;
    private final TradingCalendar calendar;
    private final FailureLog failureLog;
    private final SyncMetrics metrics;
    private final Clock clock;

    private volatile SyncListener listener = SyncListener.NONE;
    private volatile SyncOrchestrator current;

    public SyncEngine(SyncConfig config,
                      DataSource source,
                      PersistentStore store,
                      TwoTierCache cache,
                      AdaptiveRateLimiter limiter,
                      RetryController retry,
                      TradingCalendar calendar,
                      FailureLog failureLog,
                      SyncMetrics metrics,
                      Clock clock) {
        this.config = Objects.requireNonNull(config);
        this.source = Objects.requireNonNull(source);
        this.store = Objects.requireNonNull(store);
        this.cache = Objects.requireNonNull(cache);
        this.limiter = Objects.requireNonNull(limiter);
        this.retry = Objects.requireNonNull(retry);
        this.calendar = calendar == null ? TradingCalendar.WEEKDAYS : calendar;
        this.failureLog = failureLog == null ? FailureLog.NONE : failureLog;
        this.metrics = metrics == null ? new SyncMetrics() : metrics;
        this.clock = clock == null ? Clock.systemDefaultZone() : clock;
    }

    public SyncRun runSync(List<String> subjects) throws SyncFailedException {
        return runSync(subjects, config.batchSize(), config.workers(), false);
    }

    /**
     * Brings every subject up to the expected trading date.
     *
     * @param forceFull refetch full history even for subjects that are current
     * @throws SyncFailedException if the final flush failed; carries the counts reached so far
     */
    public SyncRun runSync(List<String> subjects, int batchSize, int maxWorkers, boolean forceFull) throws SyncFailedException {
        BatchAccumulator batch = new BatchAccumulator(store, config.table(), batchSize, metrics);
        FreshnessClassifier classifier = new FreshnessClassifier(store, calendar, clock, config.historyStart());
        SyncOrchestrator orchestrator = new SyncOrchestrator(source, cache, limiter, retry, batch, classifier,
                config.category(), config.cachePolicy(), config.fetchTimeout(), maxWorkers, failureLog, listener,
                metrics, clock);
        current = orchestrator;
        try {
            return orchestrator.run(subjects, forceFull);
        } finally {
            current = null;
        }
    }

    /** Cancels the run in progress, if any. */
    public void cancel() {
        SyncOrchestrator o = current;
        if (o != null) o.cancel();
    }

    public void setListener(SyncListener listener) {
        this.listener = listener == null ? SyncListener.NONE : listener;
    }

    public TwoTierCache cache() { return cache; }
    public AdaptiveRateLimiter limiter() { return limiter; }
    public SyncMetrics metrics() { return metrics; }
    public SyncConfig config() { return config; }
}
