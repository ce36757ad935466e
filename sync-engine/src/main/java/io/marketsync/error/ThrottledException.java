package io.marketsync.error;

import java.time.Duration;
import java.util.Optional;

/**
 * Upstream rate-limit response (HTTP 429/503 and similar). Retryable; also feeds the adaptive limiter.
 */
public class ThrottledException extends FetchException {
    private final Duration retryAfter;

    public ThrottledException(String message) { this(message, null); }

    public ThrottledException(String message, Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter;
    }

    public Optional<Duration> retryAfter() { return Optional.ofNullable(retryAfter); }
}
