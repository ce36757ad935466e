package io.marketsync.sync;

import io.marketsync.core.SeriesRow;

import java.util.List;

/**
 * Progress callbacks from the workers of a run. Implementations must be thread-safe.
 */
public interface SyncListener {
    default void onDispatch(WorkItem item) {}
    default void onCacheHit(WorkItem item) {}
    default void onFetched(WorkItem item, List<SeriesRow> rows) {}
    default void onNotFound(WorkItem item) {}
    default void onFailure(WorkItem item, Exception error) {}

    SyncListener NONE = new SyncListener() {};
}
