package io.marketsync.error;

/**
 * Base of everything a {@link io.marketsync.core.DataSource} may throw.
 */
public class FetchException extends Exception {
    public FetchException(String message) { super(message); }
    public FetchException(String message, Throwable cause) { super(message, cause); }
}
