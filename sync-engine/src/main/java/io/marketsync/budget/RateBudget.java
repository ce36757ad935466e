package io.marketsync.budget;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time copy of the limiter state. lastRequestAt is null before the first grant and may lie slightly
 * in the future when a grant has been reserved but its caller is still waiting.
 */
public record RateBudget(
        Duration minInterval,
        Duration floorInterval,
        Duration ceilingInterval,
        Instant lastRequestAt,
        int consecutiveSuccesses,
        int consecutiveThrottles
) {}
