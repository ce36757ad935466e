package io.marketsync.error;

import java.time.Duration;

public class FetchTimeoutException extends TransientFetchException {
    public FetchTimeoutException(String subjectId, Duration timeout) {
        super("fetch for " + subjectId + " timed out after " + timeout.toMillis() + "ms");
    }
}
