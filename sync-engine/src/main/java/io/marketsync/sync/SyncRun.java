package io.marketsync.sync;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Summary of one orchestration pass. {@code attempted == succeeded + failed + skippedCached};
 * {@code notFound} subjects are counted as succeeded.
 */
public record SyncRun(
        int attempted,
        int succeeded,
        int failed,
        int skippedCached,
        int notFound,
        long rowsPersisted,
        List<String> failedSubjects,
        List<String> flushFailures,
        boolean cancelled,
        Instant startedAt,
        Instant finishedAt
) {
    public SyncRun {
        failedSubjects = List.copyOf(failedSubjects);
        flushFailures = List.copyOf(flushFailures);
    }

    public Duration elapsed() { return Duration.between(startedAt, finishedAt); }

    public boolean hasFailures() { return failed > 0 || !flushFailures.isEmpty(); }

    public String summary() {
        return attempted + " attempted, " + succeeded + " succeeded, " + failed + " failed, "
                + skippedCached + " skipped via cache";
    }
}
