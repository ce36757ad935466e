package io.marketsync.sync;

import io.marketsync.core.PersistentStore;
import io.marketsync.core.TradingCalendar;
import io.marketsync.error.PersistenceException;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Decides what a subject needs, based on what the store already holds.
 */
public class FreshnessClassifier {
    private final PersistentStore store;
    private final TradingCalendar calendar;
    private final Clock clock;
    private final LocalDate historyStart;

    public FreshnessClassifier(PersistentStore store, TradingCalendar calendar, Clock clock, LocalDate historyStart) {
        this.store = store;
        this.calendar = calendar == null ? TradingCalendar.WEEKDAYS : calendar;
        this.clock = clock == null ? Clock.systemDefaultZone() : clock;
        this.historyStart = historyStart;
    }

    /** Today if it trades, else the most recent trading day before it. */
    public LocalDate expectedTradingDate() {
        return calendar.onOrBefore(LocalDate.now(clock));
    }

    /**
     * @return the work for the subject, or empty if it is current and no full refresh was asked for
     */
    public Optional<WorkItem> classify(String subjectId, boolean forceFull, LocalDate expected) throws PersistenceException {
        Optional<LocalDate> latest = store.hasAnyData(subjectId) ? store.latestDateFor(subjectId) : Optional.empty();
        if (latest.isEmpty()) {
            return Optional.of(new WorkItem(subjectId, historyStart, null, Priority.MISSING));
        }
        if (forceFull) {
            Priority p = latest.get().isBefore(expected) ? Priority.STALE : Priority.CURRENT;
            return Optional.of(new WorkItem(subjectId, historyStart, null, p));
        }
        if (latest.get().isBefore(expected)) {
            return Optional.of(new WorkItem(subjectId, latest.get().plusDays(1), null, Priority.STALE));
        }
        return Optional.empty();
    }
}
