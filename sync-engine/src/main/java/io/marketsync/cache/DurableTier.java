package io.marketsync.cache;

import java.io.IOException;
import java.time.Instant;
import java.util.Optional;

/**
 * Storage for cache entries that outlives the process.
 */
public interface DurableTier {
    Optional<CacheEntry> read(String fingerprint) throws IOException;

    void write(CacheEntry entry) throws IOException;

    void delete(String fingerprint) throws IOException;

    /** Removes entries expired at {@code now}. Returns how many were removed. */
    int compact(Instant now) throws IOException;

    void clear() throws IOException;
}
