package io.marketsync.core;

import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;

/**
 * One dated row of a subject's time series. values holds the numeric columns (open, close, volume, ...).
 */
public record SeriesRow(String subjectId, LocalDate date, Map<String, Double> values) {
    public SeriesRow {
        Objects.requireNonNull(subjectId, "subjectId");
        Objects.requireNonNull(date, "date");
        values = values == null ? Map.of() : Map.copyOf(values);
    }

    public Double value(String column) { return values.get(column); }
}
