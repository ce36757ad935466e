package io.marketsync.error;

import io.marketsync.sync.SyncRun;

/**
 * The run as a whole could not complete (e.g. the final flush failed). Carries what was achieved before that.
 */
public class SyncFailedException extends Exception {
    private final transient SyncRun partialRun;

    public SyncFailedException(String message, SyncRun partialRun, Throwable cause) {
        super(message, cause);
        this.partialRun = partialRun;
    }

    public SyncRun partialRun() { return partialRun; }
}
