package io.marketsync.config;

import java.time.Duration;

/**
 * Settings of the adaptive limiter. Intervals are minimum gaps between two granted requests.
 */
public record RateLimiterConfig(
        Duration initialInterval,
        Duration floorInterval,
        Duration ceilingInterval,
        int successThreshold,
        double decreaseFactor,
        double backoffFactor
) {
    public RateLimiterConfig {
        if (floorInterval.isNegative()) throw new IllegalArgumentException("floorInterval must be >= 0");
        if (ceilingInterval.compareTo(floorInterval) < 0) throw new IllegalArgumentException("ceilingInterval < floorInterval");
        if (initialInterval.compareTo(floorInterval) < 0) initialInterval = floorInterval;
        if (initialInterval.compareTo(ceilingInterval) > 0) initialInterval = ceilingInterval;
        if (successThreshold < 1) throw new IllegalArgumentException("successThreshold must be >= 1");
        if (decreaseFactor <= 0 || decreaseFactor > 1.0) throw new IllegalArgumentException("decreaseFactor must be in (0, 1]");
        if (backoffFactor < 1.0) throw new IllegalArgumentException("backoffFactor must be >= 1.0");
    }

    public static RateLimiterConfig defaults() {
        return new RateLimiterConfig(Duration.ofMillis(500), Duration.ofMillis(200), Duration.ofSeconds(30), 10, 0.9, 2.0);
    }

    /** Fixed spacing, never adapts. */
    public static RateLimiterConfig fixed(Duration interval) {
        return new RateLimiterConfig(interval, interval, interval, 1, 1.0, 1.0);
    }
}
