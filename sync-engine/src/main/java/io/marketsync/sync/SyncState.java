package io.marketsync.sync;

public enum SyncState {
    IDLE,
    ENUMERATING,
    FETCHING,
    DRAINING,
    COMPLETE,
    FAILED
}
