package io.marketsync.sync;

import com.codahale.metrics.Timer;
import io.marketsync.batch.BatchAccumulator;
import io.marketsync.budget.AdaptiveRateLimiter;
import io.marketsync.cache.Fingerprint;
import io.marketsync.cache.TwoTierCache;
import io.marketsync.config.CachePolicy;
import io.marketsync.core.DataSource;
import io.marketsync.core.SeriesRow;
import io.marketsync.error.FailureLog;
import io.marketsync.error.FetchErrors;
import io.marketsync.error.FetchTimeoutException;
import io.marketsync.error.NotFoundException;
import io.marketsync.error.PersistenceException;
import io.marketsync.error.SyncFailedException;
import io.marketsync.error.ThrottledException;
import io.marketsync.error.TransientFetchException;
import io.marketsync.metrics.SyncMetrics;
import io.marketsync.retry.RetryController;
import io.marketsync.retry.RetryListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one synchronization pass: classify subjects, fetch what is missing or stale, persist in batches.
 * <p>
 * A single dispatcher (the calling thread) hands items to a fixed pool in priority order and never has more than
 * {@code maxWorkers} items in flight. A priority group is dispatched only after the previous group has completed,
 * so every MISSING subject is done before the first STALE one starts. One subject's failure never stops the run.
 * Instances are single-use.
 */
public class SyncOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

    private final DataSource source;
    private final TwoTierCache cache;
    private final AdaptiveRateLimiter limiter;
    private final RetryController retry;
    private final BatchAccumulator batch;
    private final FreshnessClassifier classifier;
    private final String category;
    private final CachePolicy cachePolicy;
    private final Duration fetchTimeout;
    private final int maxWorkers;
    private final FailureLog failureLog;
    private final SyncListener listener;
    private final SyncMetrics metrics;
    private final Clock clock;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile SyncState state = SyncState.IDLE;

    private final AtomicInteger succeeded = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger skippedCached = new AtomicInteger();
    private final AtomicInteger notFound = new AtomicInteger();
    private final Queue<String> failedSubjects = new ConcurrentLinkedQueue<>();
    private final Queue<String> flushFailures = new ConcurrentLinkedQueue<>();

    private ExecutorService fetchExecutor;

    public SyncOrchestrator(DataSource source,
                            TwoTierCache cache,
                            AdaptiveRateLimiter limiter,
                            RetryController retry,
                            BatchAccumulator batch,
                            FreshnessClassifier classifier,
                            String category,
                            CachePolicy cachePolicy,
                            Duration fetchTimeout,
                            int maxWorkers,
                            FailureLog failureLog,
                            SyncListener listener,
                            SyncMetrics metrics,
                            Clock clock) {
        if (maxWorkers < 1) throw new IllegalArgumentException("maxWorkers must be >= 1");
        this.source = Objects.requireNonNull(source);
        this.cache = Objects.requireNonNull(cache);
        this.limiter = Objects.requireNonNull(limiter);
        this.retry = Objects.requireNonNull(retry);
        this.batch = Objects.requireNonNull(batch);
        this.classifier = Objects.requireNonNull(classifier);
        this.category = Objects.requireNonNull(category);
        this.cachePolicy = Objects.requireNonNull(cachePolicy);
        this.fetchTimeout = Objects.requireNonNull(fetchTimeout);
        this.maxWorkers = maxWorkers;
        this.failureLog = failureLog == null ? FailureLog.NONE : failureLog;
        this.listener = listener == null ? SyncListener.NONE : listener;
        this.metrics = metrics == null ? new SyncMetrics() : metrics;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public SyncRun run(List<String> subjects, boolean forceFull) throws SyncFailedException {
        if (!started.compareAndSet(false, true)) throw new IllegalStateException("orchestrator already used");
        Instant startedAt = clock.instant();

        state = SyncState.ENUMERATING;
        LocalDate asOf = classifier.expectedTradingDate();
        List<WorkItem> items = new ArrayList<>();
        int unclassified = 0;
        for (String subject : new LinkedHashSet<>(subjects)) {
            try {
                classifier.classify(subject, forceFull, asOf).ifPresent(items::add);
            } catch (PersistenceException e) {
                unclassified++;
                failed.incrementAndGet();
                failedSubjects.add(subject);
                log.warn("could not determine stored state of {}: {}", subject, e.getMessage());
            }
        }
        items.sort(Comparator.comparing(WorkItem::priority));
        log.info("sync of {} subjects as of {}: {}", subjects.size(), asOf, countByPriority(items));

        state = SyncState.FETCHING;
        int dispatched = 0;
        boolean interrupted = false;
        ExecutorService workers = Executors.newFixedThreadPool(maxWorkers, daemonThreads("sync-worker-"));
        fetchExecutor = Executors.newCachedThreadPool(daemonThreads("sync-fetch-"));
        Semaphore inFlight = new Semaphore(maxWorkers);
        try {
            Priority group = null;
            for (WorkItem item : items) {
                if (cancelled.get()) break;
                if (group != null && item.priority() != group) {
                    inFlight.acquire(maxWorkers);
                    inFlight.release(maxWorkers);
                }
                group = item.priority();
                inFlight.acquire();
                if (cancelled.get()) {
                    inFlight.release();
                    break;
                }
                dispatched++;
                listener.onDispatch(item);
                workers.execute(() -> {
                    try {
                        process(item, asOf);
                    } finally {
                        inFlight.release();
                    }
                });
            }
        } catch (InterruptedException e) {
            interrupted = true;
            cancel();
        } finally {
            workers.shutdown();
            interrupted |= awaitTermination(workers);
            fetchExecutor.shutdownNow();
        }
        if (cancelled.get()) log.info("sync cancelled after dispatching {} of {} items", dispatched, items.size());

        state = SyncState.DRAINING;
        int attempted = dispatched + unclassified;
        try {
            batch.finish();
        } catch (PersistenceException e) {
            flushFailures.add(e.getMessage());
            state = SyncState.FAILED;
            SyncRun partial = summarize(attempted, startedAt);
            log.error("final flush failed; {}", partial.summary());
            if (interrupted) Thread.currentThread().interrupt();
            throw new SyncFailedException("final flush failed: " + e.getMessage(), partial, e);
        }
        state = SyncState.COMPLETE;
        SyncRun run = summarize(attempted, startedAt);
        log.info("sync finished in {}ms: {}, {} rows persisted", run.elapsed().toMillis(), run.summary(), run.rowsPersisted());
        if (interrupted) Thread.currentThread().interrupt();
        return run;
    }

    /** Stops dispatching new items. Items already running finish and the buffered rows are still flushed. */
    public void cancel() { cancelled.set(true); }

    public boolean isCancelled() { return cancelled.get(); }

    public SyncState state() { return state; }

    private void process(WorkItem item, LocalDate asOf) {
        try {
            String fingerprint = Fingerprint.of(item.subjectId(), category, item.rangeStart(),
                    item.isOpenEnded() ? asOf : item.rangeEnd());
            Optional<List<SeriesRow>> cached = cache.get(fingerprint);
            if (cached.isPresent()) {
                // the entry may predate a failed commit, so cached rows are upserted again
                if (!cached.get().isEmpty()) persist(item, cached.get());
                skippedCached.incrementAndGet();
                listener.onCacheHit(item);
                return;
            }
            List<SeriesRow> rows;
            try {
                rows = retry.execute(() -> attempt(item), FetchErrors::isRetryable, throttleFeedback());
            } catch (NotFoundException e) {
                rows = List.of();
            }
            cache.set(fingerprint, rows, cachePolicy);
            limiter.reportSuccess();
            if (rows.isEmpty()) {
                notFound.incrementAndGet();
                metrics.counter(SyncMetrics.FETCH_NOT_FOUND).inc();
                log.debug("{} has no data for {}..{}", item.subjectId(), item.rangeStart(), asOf);
                listener.onNotFound(item);
            } else {
                persist(item, rows);
                listener.onFetched(item, rows);
            }
            succeeded.incrementAndGet();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(item, e);
        } catch (Exception e) {
            fail(item, e);
        }
    }

    private List<SeriesRow> attempt(WorkItem item) throws Exception {
        limiter.acquire();
        item.recordAttempt();
        Future<List<SeriesRow>> fetch = fetchExecutor.submit(
                () -> source.fetch(item.subjectId(), category, item.rangeStart(), item.rangeEnd()));
        try (Timer.Context ignored = metrics.timer(SyncMetrics.FETCH_TIME).time()) {
            List<SeriesRow> rows = fetch.get(fetchTimeout.toNanos(), TimeUnit.NANOSECONDS);
            return rows == null ? List.of() : rows;
        } catch (TimeoutException e) {
            fetch.cancel(true);
            throw new FetchTimeoutException(item.subjectId(), fetchTimeout);
        } catch (InterruptedException e) {
            fetch.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) throw (Exception) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new TransientFetchException("fetch for " + item.subjectId() + " failed", cause);
        }
    }

    private RetryListener throttleFeedback() {
        return new RetryListener() {
            @Override
            public void onRetry(int attempt, Exception error, Duration delay) {
                metrics.counter(SyncMetrics.FETCH_RETRIES).inc();
                throttled(error);
            }

            @Override
            public void onGiveUp(int attempts, Exception error) {
                throttled(error);
            }
        };
    }

    private void throttled(Exception error) {
        if (FetchErrors.isThrottle(error)) {
            metrics.counter(SyncMetrics.FETCH_THROTTLED).inc();
            limiter.reportThrottled(((ThrottledException) error).retryAfter());
        }
    }

    private void persist(WorkItem item, List<SeriesRow> rows) {
        try {
            batch.add(item.subjectId(), rows);
        } catch (PersistenceException e) {
            // rows stay buffered; the next flush or the final one retries them
            flushFailures.add(e.getMessage());
        }
    }

    private void fail(WorkItem item, Exception error) {
        failed.incrementAndGet();
        failedSubjects.add(item.subjectId());
        metrics.counter(SyncMetrics.FETCH_FAILURES).inc();
        log.warn("sync of {} failed after {} attempt(s): {}", item.subjectId(), item.attemptCount(), error.toString());
        failureLog.record(item, error);
        listener.onFailure(item, error);
    }

    private SyncRun summarize(int attempted, Instant startedAt) {
        return new SyncRun(attempted, succeeded.get(), failed.get(), skippedCached.get(), notFound.get(),
                batch.rowsWritten(), new ArrayList<>(failedSubjects), new ArrayList<>(flushFailures),
                cancelled.get(), startedAt, clock.instant());
    }

    private static Map<Priority, Integer> countByPriority(List<WorkItem> items) {
        Map<Priority, Integer> counts = new EnumMap<>(Priority.class);
        for (WorkItem i : items) counts.merge(i.priority(), 1, Integer::sum);
        return counts;
    }

    /** Waits for the pool to drain; returns true if the wait was interrupted. */
    private static boolean awaitTermination(ExecutorService pool) {
        boolean interrupted = false;
        while (true) {
            try {
                if (pool.awaitTermination(1, TimeUnit.SECONDS)) return interrupted;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
