package io.marketsync.batch;

import io.marketsync.core.SeriesRow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered buffer of rows waiting for the next flush. Not thread-safe; {@link BatchAccumulator} guards it.
 */
public final class Batch {
    private final int threshold;
    private final List<SeriesRow> records = new ArrayList<>();
    private final Set<String> subjects = new LinkedHashSet<>();

    Batch(int threshold) {
        if (threshold < 1) throw new IllegalArgumentException("threshold must be >= 1");
        this.threshold = threshold;
    }

    void append(String subjectId, List<SeriesRow> rows) {
        if (rows.isEmpty()) return;
        records.addAll(rows);
        subjects.add(subjectId);
    }

    boolean isFull() { return records.size() >= threshold; }

    void clear() {
        records.clear();
        subjects.clear();
    }

    List<SeriesRow> view() { return Collections.unmodifiableList(records); }

    public int threshold() { return threshold; }
    public int size() { return records.size(); }
    public int subjectCount() { return subjects.size(); }
    public boolean isEmpty() { return records.isEmpty(); }
}
