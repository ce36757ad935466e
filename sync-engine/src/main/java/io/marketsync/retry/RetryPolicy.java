package io.marketsync.retry;

import java.time.Duration;

public interface RetryPolicy {
    /** @param attempt number of attempts made so far, starting at 1 */
    boolean shouldRetry(int attempt, Exception e);

    /** Delay to wait after attempt {@code attempt} failed and before the next one. */
    Duration backoff(int attempt);
}
