package io.marketsync.cache;

import io.marketsync.core.SeriesRow;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A cached fetch result. The payload is copied on construction and never changes afterwards.
 */
public record CacheEntry(String fingerprint, List<SeriesRow> payload, Instant createdAt, Duration ttl, CacheTier tier) {
    public CacheEntry {
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(ttl, "ttl");
        Objects.requireNonNull(tier, "tier");
        payload = payload == null ? List.of() : List.copyOf(payload);
    }

    public boolean isExpired(Instant now) {
        return Duration.between(createdAt, now).compareTo(ttl) > 0;
    }
}
