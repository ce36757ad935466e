package io.marketsync.error;

import io.marketsync.sync.WorkItem;

/**
 * Receives subjects whose synchronization failed, so they can be inspected or re-run.
 */
public interface FailureLog extends AutoCloseable {
    void record(WorkItem item, Exception error);

    @Override default void close() {}

    FailureLog NONE = (item, error) -> {};
}
