package io.marketsync.sync;

import java.time.LocalDate;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One subject to synchronize during a run. rangeEnd is null for "through the latest available date".
 */
public final class WorkItem {
    private final String subjectId;
    private final LocalDate rangeStart;
    private final LocalDate rangeEnd;
    private final Priority priority;
    private final AtomicInteger attemptCount = new AtomicInteger();

    public WorkItem(String subjectId, LocalDate rangeStart, LocalDate rangeEnd, Priority priority) {
        this.subjectId = Objects.requireNonNull(subjectId, "subjectId");
        this.rangeStart = rangeStart;
        this.rangeEnd = rangeEnd;
        this.priority = Objects.requireNonNull(priority, "priority");
    }

    public String subjectId() { return subjectId; }
    public LocalDate rangeStart() { return rangeStart; }
    public LocalDate rangeEnd() { return rangeEnd; }
    public Priority priority() { return priority; }
    public int attemptCount() { return attemptCount.get(); }

    boolean isOpenEnded() { return rangeEnd == null; }

    void recordAttempt() { attemptCount.incrementAndGet(); }

    @Override
    public String toString() {
        return subjectId + "[" + priority + " " + rangeStart + ".." + (rangeEnd == null ? "" : rangeEnd) + "]";
    }
}
