package io.marketsync.sync;

/**
 * Dispatch order of work items; declaration order is the order in which groups are fetched.
 */
public enum Priority {
    /** Subject has no stored rows at all. */
    MISSING,
    /** Subject has rows, but not up to the expected trading date. */
    STALE,
    /** Subject is up to date; only fetched when a full refresh is forced. */
    CURRENT
}
