package io.marketsync.sync;

import io.marketsync.batch.BatchAccumulator;
import io.marketsync.budget.AdaptiveRateLimiter;
import io.marketsync.cache.TwoTierCache;
import io.marketsync.config.CachePolicy;
import io.marketsync.config.RateLimiterConfig;
import io.marketsync.config.RetryConfig;
import io.marketsync.core.TradingCalendar;
import io.marketsync.error.FailureLog;
import io.marketsync.error.FetchTimeoutException;
import io.marketsync.error.NotFoundException;
import io.marketsync.error.SyncFailedException;
import io.marketsync.error.ThrottledException;
import io.marketsync.error.TransientFetchException;
import io.marketsync.metrics.SyncMetrics;
import io.marketsync.retry.RetryController;
import io.marketsync.testsupport.InMemoryStore;
import io.marketsync.testsupport.ScriptedSource;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class SyncOrchestratorTest {
    // Monday
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-17T20:00:00Z"), ZoneOffset.UTC);

    private final SyncMetrics metrics = new SyncMetrics();
    private RetryConfig retryConfig = new RetryConfig(2, Duration.ofMillis(1), Duration.ofMillis(1), 2.0, false);
    private AdaptiveRateLimiter limiter = new AdaptiveRateLimiter(RateLimiterConfig.fixed(Duration.ZERO), metrics);
    private Duration fetchTimeout = Duration.ofSeconds(5);
    private FailureLog failureLog = FailureLog.NONE;
    private TwoTierCache cache = TwoTierCache.volatileOnly(1_000, metrics);

    private SyncOrchestrator orchestrator(ScriptedSource source, InMemoryStore store, int workers, int batchSize, SyncListener listener) {
        return new SyncOrchestrator(source, cache, limiter, new RetryController(retryConfig, d -> {}),
                new BatchAccumulator(store, "daily_bars", batchSize, metrics),
                new FreshnessClassifier(store, TradingCalendar.WEEKDAYS, CLOCK, LocalDate.of(1970, 1, 1)),
                "daily", CachePolicy.historical(), fetchTimeout, workers, failureLog, listener, metrics, CLOCK);
    }

    private static void assertCountsAddUp(SyncRun run) {
        assertEquals(run.attempted(), run.succeeded() + run.failed() + run.skippedCached(), run.toString());
    }

    @Test
    void missing_subjects_complete_before_stale_ones_start() throws Exception {
        InMemoryStore store = new InMemoryStore();
        List<String> subjects = List.of("S1", "M1", "S2", "M2", "S3", "M3", "M4", "S4", "M5", "M6");
        for (String s : subjects) if (s.startsWith("S")) store.seed(s, LocalDate.of(2024, 6, 10));
        ScriptedSource source = new ScriptedSource(3, 30);

        SyncRun run = orchestrator(source, store, 3, 100, null).run(subjects, false);

        assertEquals(10, run.attempted());
        assertEquals(10, run.succeeded());
        List<String> order = List.copyOf(source.calls);
        for (int i = 0; i < 6; i++) assertTrue(order.get(i).startsWith("M"), "call order " + order);
        for (int i = 6; i < 10; i++) assertTrue(order.get(i).startsWith("S"), "call order " + order);
        assertTrue(source.maxConcurrent() <= 3, "concurrency " + source.maxConcurrent());
        assertCountsAddUp(run);
    }

    @Test
    void current_subjects_are_left_alone_unless_forced() throws Exception {
        InMemoryStore store = new InMemoryStore();
        store.seed("UP", LocalDate.of(2024, 6, 17));
        ScriptedSource source = new ScriptedSource(2);

        SyncRun run = orchestrator(source, store, 2, 100, null).run(List.of("UP"), false);
        assertEquals(0, run.attempted());
        assertEquals(0, source.calls.size());

        SyncRun forced = orchestrator(source, store, 2, 100, null).run(List.of("UP"), true);
        assertEquals(1, forced.attempted());
        assertEquals(1, source.callsFor("UP"));
    }

    @Test
    void cached_results_skip_the_source_but_are_still_stored() throws Exception {
        ScriptedSource source = new ScriptedSource(5);
        List<String> subjects = List.of("A", "B", "C");
        orchestrator(source, new InMemoryStore(), 2, 100, null).run(subjects, false);
        assertEquals(3, source.calls.size());

        InMemoryStore fresh = new InMemoryStore();
        SyncRun second = orchestrator(source, fresh, 2, 100, null).run(subjects, false);

        assertEquals(3, second.attempted());
        assertEquals(3, second.skippedCached());
        assertEquals(0, second.succeeded());
        assertEquals(3, source.calls.size());
        assertEquals(15, fresh.rowCount());
        assertEquals(15, second.rowsPersisted());
        assertCountsAddUp(second);
    }

    @Test
    void not_found_is_a_successful_no_op() throws Exception {
        ScriptedSource source = new ScriptedSource(5)
                .script("GONE", s -> { throw new NotFoundException(s + " delisted"); })
                .script("EMPTY", s -> List.of());
        InMemoryStore store = new InMemoryStore();

        SyncRun run = orchestrator(source, store, 2, 100, null).run(List.of("GONE", "EMPTY", "OK"), false);

        assertEquals(3, run.succeeded());
        assertEquals(2, run.notFound());
        assertEquals(0, run.failed());
        assertEquals(1, source.callsFor("GONE"));
        assertEquals(5, store.rowCount());

        SyncRun again = orchestrator(source, store, 2, 100, null).run(List.of("GONE"), false);
        assertEquals(1, again.skippedCached());
        assertEquals(1, source.callsFor("GONE"));
    }

    @Test
    void one_failing_subject_does_not_stop_the_run() throws Exception {
        ScriptedSource source = new ScriptedSource(4)
                .script("BAD", s -> { throw new TransientFetchException("connection reset"); });
        InMemoryStore store = new InMemoryStore();
        List<WorkItem> logged = new CopyOnWriteArrayList<>();
        failureLog = (item, error) -> logged.add(item);

        SyncRun run = orchestrator(source, store, 2, 100, null).run(List.of("A", "BAD", "B"), false);

        assertEquals(3, run.attempted());
        assertEquals(2, run.succeeded());
        assertEquals(1, run.failed());
        assertEquals(List.of("BAD"), run.failedSubjects());
        assertEquals(3, source.callsFor("BAD"));
        assertEquals(1, logged.size());
        assertEquals(3, logged.get(0).attemptCount());
        assertEquals(8, store.rowCount());
        assertEquals(1, metrics.count(SyncMetrics.FETCH_FAILURES));
        assertCountsAddUp(run);
    }

    @Test
    void throttling_slows_the_limiter_and_is_retried() throws Exception {
        limiter = new AdaptiveRateLimiter(new RateLimiterConfig(Duration.ofMillis(1), Duration.ZERO,
                Duration.ofSeconds(1), 100, 0.9, 2.0), metrics);
        ScriptedSource source = new ScriptedSource(2)
                .script("HOT", s -> { throw new ThrottledException("429"); }, s -> ScriptedSource.rows(s, LocalDate.of(2024, 6, 3), 2));

        SyncRun run = orchestrator(source, new InMemoryStore(), 1, 100, null).run(List.of("HOT"), false);

        assertEquals(1, run.succeeded());
        assertEquals(2, source.callsFor("HOT"));
        assertEquals(Duration.ofMillis(2), limiter.currentInterval());
        assertEquals(1, metrics.count(SyncMetrics.FETCH_THROTTLED));
        assertEquals(1, metrics.count(SyncMetrics.FETCH_RETRIES));
    }

    @Test
    void slow_fetch_times_out_as_a_failure() throws Exception {
        retryConfig = retryConfig.withMaxRetries(0);
        fetchTimeout = Duration.ofMillis(100);
        ScriptedSource source = new ScriptedSource(1)
                .script("SLOW", s -> { Thread.sleep(2_000); return List.of(); });
        Map<String, Exception> errors = new ConcurrentHashMap<>();
        SyncListener listener = new SyncListener() {
            @Override public void onFailure(WorkItem item, Exception error) { errors.put(item.subjectId(), error); }
        };

        long t0 = System.nanoTime();
        SyncRun run = orchestrator(source, new InMemoryStore(), 2, 100, listener).run(List.of("SLOW", "FAST"), false);
        long ms = (System.nanoTime() - t0) / 1_000_000;

        assertEquals(1, run.failed());
        assertEquals(1, run.succeeded());
        assertInstanceOf(FetchTimeoutException.class, errors.get("SLOW"));
        assertTrue(ms < 1_500, "run waited for the slow fetch: " + ms + "ms");
    }

    @Test
    void cancel_stops_dispatching_but_drains() throws Exception {
        InMemoryStore store = new InMemoryStore();
        ScriptedSource source = new ScriptedSource(3);
        AtomicReference<SyncOrchestrator> ref = new AtomicReference<>();
        List<String> dispatched = new CopyOnWriteArrayList<>();
        SyncListener listener = new SyncListener() {
            @Override public void onDispatch(WorkItem item) {
                dispatched.add(item.subjectId());
                if (dispatched.size() == 2) ref.get().cancel();
            }
        };
        SyncOrchestrator o = orchestrator(source, store, 1, 100, listener);
        ref.set(o);

        SyncRun run = o.run(List.of("A", "B", "C", "D", "E"), false);

        assertTrue(run.cancelled());
        assertEquals(2, run.attempted());
        assertEquals(List.of("A", "B"), dispatched);
        assertEquals(6, store.rowCount());
        assertEquals(SyncState.COMPLETE, o.state());
        assertCountsAddUp(run);
    }

    @Test
    void failed_intermediate_flush_is_reported_and_retried() throws Exception {
        InMemoryStore store = new InMemoryStore();
        store.failNextCommits(1);
        ScriptedSource source = new ScriptedSource(5);

        SyncRun run = orchestrator(source, store, 1, 5, null).run(List.of("A", "B", "C"), false);

        assertEquals(3, run.succeeded());
        assertEquals(1, run.flushFailures().size());
        assertEquals(15, store.rowCount());
        assertEquals(15, run.rowsPersisted());
    }

    @Test
    void failed_final_flush_fails_the_run_with_partial_counts() {
        InMemoryStore store = new InMemoryStore();
        store.failNextCommits(1);
        ScriptedSource source = new ScriptedSource(5);
        SyncOrchestrator o = orchestrator(source, store, 2, 1_000, null);

        SyncFailedException e = assertThrows(SyncFailedException.class, () -> o.run(List.of("A", "B"), false));

        assertEquals(2, e.partialRun().succeeded());
        assertEquals(0, e.partialRun().rowsPersisted());
        assertFalse(e.partialRun().flushFailures().isEmpty());
        assertEquals(SyncState.FAILED, o.state());
        assertEquals(0, store.rowCount());
    }

    @Test
    void rows_lost_to_a_failed_final_flush_are_stored_by_the_next_run() throws Exception {
        InMemoryStore store = new InMemoryStore();
        store.failNextCommits(1);
        ScriptedSource source = new ScriptedSource(5);
        assertThrows(SyncFailedException.class, () -> orchestrator(source, store, 2, 1_000, null).run(List.of("A", "B"), false));
        assertEquals(0, store.rowCount());

        SyncRun rerun = orchestrator(source, store, 2, 1_000, null).run(List.of("A", "B"), false);

        assertEquals(2, rerun.skippedCached());
        assertEquals(2, source.calls.size());
        assertEquals(10, rerun.rowsPersisted());
        assertEquals(5, store.rowCount("A"));
        assertEquals(5, store.rowCount("B"));
    }

    @Test
    void orchestrator_is_single_use() throws Exception {
        SyncOrchestrator o = orchestrator(new ScriptedSource(1), new InMemoryStore(), 1, 10, null);
        o.run(List.of("A"), false);
        assertThrows(IllegalStateException.class, () -> o.run(List.of("A"), false));
    }
}
