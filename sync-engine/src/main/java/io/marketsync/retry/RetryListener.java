package io.marketsync.retry;

import java.time.Duration;

/**
 * Observes a single {@link RetryController#execute} call.
 */
public interface RetryListener {
    /** Attempt {@code attempt} failed with a retryable error; the next one starts after {@code delay}. */
    default void onRetry(int attempt, Exception error, Duration delay) {}

    /** No further attempts will be made; {@code error} is about to propagate. */
    default void onGiveUp(int attempts, Exception error) {}

    RetryListener NONE = new RetryListener() {};
}
