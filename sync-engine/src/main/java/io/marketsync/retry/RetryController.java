package io.marketsync.retry;

import io.marketsync.config.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * Runs an operation until it succeeds, fails with a non-retryable error, or runs out of attempts.
 * The first attempt is immediate. The last error is rethrown unchanged.
 */
public class RetryController {
    private static final Logger log = LoggerFactory.getLogger(RetryController.class);

    private final RetryPolicy policy;
    private final Sleeper sleeper;

    public RetryController(RetryConfig config) {
        this(new ExponentialBackoffRetryPolicy(config), Sleeper.SYSTEM);
    }

    public RetryController(RetryConfig config, Sleeper sleeper) {
        this(new ExponentialBackoffRetryPolicy(config), sleeper);
    }

    public RetryController(RetryPolicy policy, Sleeper sleeper) {
        this.policy = policy;
        this.sleeper = sleeper;
    }

    public <T> T execute(Callable<T> operation, Predicate<Exception> isRetryable) throws Exception {
        return execute(operation, isRetryable, RetryListener.NONE);
    }

    public <T> T execute(Callable<T> operation, Predicate<Exception> isRetryable, RetryListener listener) throws Exception {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return operation.call();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                listener.onGiveUp(attempt, ie);
                throw ie;
            } catch (Exception e) {
                if (!isRetryable.test(e) || !policy.shouldRetry(attempt, e)) {
                    listener.onGiveUp(attempt, e);
                    throw e;
                }
                Duration delay = policy.backoff(attempt);
                log.debug("attempt {} failed ({}), retrying in {}ms", attempt, e.toString(), delay.toMillis());
                listener.onRetry(attempt, e, delay);
                sleeper.sleep(delay);
            }
        }
    }
}
