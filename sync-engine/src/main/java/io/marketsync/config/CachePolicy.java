package io.marketsync.config;

import java.time.Duration;

/**
 * How long fetched payloads stay cached and whether they survive restarts.
 * Historical bars are long-lived and durable; near-real-time categories should be volatile-only.
 */
public record CachePolicy(Duration ttl, boolean durable) {
    public CachePolicy {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) throw new IllegalArgumentException("ttl must be positive");
    }

    public static CachePolicy historical() { return new CachePolicy(Duration.ofDays(7), true); }

    public static CachePolicy volatileOnly(Duration ttl) { return new CachePolicy(ttl, false); }
}
