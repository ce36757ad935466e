package io.marketsync.core;

import io.marketsync.error.FetchException;

import java.time.LocalDate;
import java.util.List;

/**
 * Remote provider of time-series rows.
 * <p>
 * Implementations signal rate limiting with {@link io.marketsync.error.ThrottledException}, a subject or range
 * without data with {@link io.marketsync.error.NotFoundException}, and network trouble with
 * {@link io.marketsync.error.TransientFetchException}.
 */
public interface DataSource {
    /**
     * @param rangeEnd inclusive end, or null for "through the latest available"
     */
    List<SeriesRow> fetch(String subjectId, String category, LocalDate rangeStart, LocalDate rangeEnd) throws FetchException;
}
