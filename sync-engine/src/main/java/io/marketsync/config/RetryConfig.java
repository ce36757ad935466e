package io.marketsync.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry settings.
 *
 * @param maxRetries        attempts allowed after the first one (default 5)
 * @param initialBackoff    delay before the second attempt (default 1s)
 * @param maxBackoff        cap for any single delay (default 60s)
 * @param backoffMultiplier growth per further attempt (default 2.0)
 * @param jitter            add uniform [0, delay/2] on top of each delay (default true)
 */
public record RetryConfig(int maxRetries, Duration initialBackoff, Duration maxBackoff, double backoffMultiplier, boolean jitter) {
    public RetryConfig {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (initialBackoff.isNegative()) throw new IllegalArgumentException("initialBackoff must be >= 0");
        if (maxBackoff.compareTo(initialBackoff) < 0) maxBackoff = initialBackoff;
        if (backoffMultiplier < 1.0) throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
    }

    public static RetryConfig defaults() {
        return new RetryConfig(5, Duration.ofSeconds(1), Duration.ofSeconds(60), 2.0, true);
    }

    public RetryConfig withJitter(boolean enabled) {
        return new RetryConfig(maxRetries, initialBackoff, maxBackoff, backoffMultiplier, enabled);
    }

    public RetryConfig withMaxRetries(int retries) {
        return new RetryConfig(retries, initialBackoff, maxBackoff, backoffMultiplier, jitter);
    }
}
