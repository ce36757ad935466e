package io.marketsync.retry;

import io.marketsync.config.RetryConfig;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Delay before attempt n (n >= 2) is min(initial * multiplier^(n-2), max), plus up to half of that again
 * when jitter is enabled.
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final RetryConfig config;
    private final DoubleSupplier random;

    public ExponentialBackoffRetryPolicy(RetryConfig config) {
        this(config, () -> ThreadLocalRandom.current().nextDouble());
    }

    public ExponentialBackoffRetryPolicy(RetryConfig config, DoubleSupplier random) {
        this.config = config;
        this.random = random;
    }

    @Override
    public boolean shouldRetry(int attempt, Exception e) {
        return attempt <= config.maxRetries();
    }

    @Override
    public Duration backoff(int attempt) {
        long base = baseDelayNanos(attempt);
        if (!config.jitter() || base == 0) return Duration.ofNanos(base);
        long extra = (long) (random.getAsDouble() * base * 0.5);
        return Duration.ofNanos(base + extra);
    }

    long baseDelayNanos(int attempt) {
        double nanos = config.initialBackoff().toNanos() * Math.pow(config.backoffMultiplier(), Math.max(0, attempt - 1));
        return (long) Math.min(nanos, (double) config.maxBackoff().toNanos());
    }
}
