package io.marketsync.error;

/**
 * Network failure, connection reset, upstream 5xx. Retryable.
 */
public class TransientFetchException extends FetchException {
    public TransientFetchException(String message) { super(message); }
    public TransientFetchException(String message, Throwable cause) { super(message, cause); }
}
