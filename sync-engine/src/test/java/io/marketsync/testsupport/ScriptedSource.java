package io.marketsync.testsupport;

import io.marketsync.core.DataSource;
import io.marketsync.core.SeriesRow;
import io.marketsync.error.FetchException;

import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Data source answering from per-subject scripts. Subjects without a script get {@code defaultRows} rows.
 * Records the order of calls and the highest number of concurrent fetches.
 */
public class ScriptedSource implements DataSource {
    @FunctionalInterface
    public interface Step {
        List<SeriesRow> run(String subjectId) throws Exception;
    }

    private final Map<String, Deque<Step>> scripts = new ConcurrentHashMap<>();
    private final int defaultRows;
    private final long latencyMillis;
    public final List<String> calls = new CopyOnWriteArrayList<>();
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger maxActive = new AtomicInteger();

    public ScriptedSource(int defaultRows) { this(defaultRows, 0); }

    public ScriptedSource(int defaultRows, long latencyMillis) {
        this.defaultRows = defaultRows;
        this.latencyMillis = latencyMillis;
    }

    /** Steps run in order on consecutive fetches of the subject; the last one repeats. */
    public ScriptedSource script(String subjectId, Step... steps) {
        scripts.put(subjectId, new ArrayDeque<>(List.of(steps)));
        return this;
    }

    public int maxConcurrent() { return maxActive.get(); }

    public int callsFor(String subjectId) {
        return (int) calls.stream().filter(subjectId::equals).count();
    }

    @Override
    public List<SeriesRow> fetch(String subjectId, String category, LocalDate rangeStart, LocalDate rangeEnd) throws FetchException {
        calls.add(subjectId);
        int now = active.incrementAndGet();
        maxActive.accumulateAndGet(now, Math::max);
        try {
            if (latencyMillis > 0) Thread.sleep(latencyMillis);
            Step step = nextStep(subjectId);
            if (step == null) return rows(subjectId, LocalDate.of(2024, 1, 1), defaultRows);
            return step.run(subjectId);
        } catch (FetchException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("interrupted", e);
        } catch (Exception e) {
            throw new FetchException("script failed", e);
        } finally {
            active.decrementAndGet();
        }
    }

    private Step nextStep(String subjectId) {
        Deque<Step> steps = scripts.get(subjectId);
        if (steps == null) return null;
        synchronized (steps) {
            return steps.size() > 1 ? steps.poll() : steps.peek();
        }
    }

    public static List<SeriesRow> rows(String subjectId, LocalDate from, int count) {
        List<SeriesRow> rows = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            rows.add(new SeriesRow(subjectId, from.plusDays(i), Map.of("close", 10.0 + i, "volume", 1000.0)));
        }
        return rows;
    }
}
