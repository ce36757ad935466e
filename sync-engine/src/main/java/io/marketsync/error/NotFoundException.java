package io.marketsync.error;

/**
 * The subject or range genuinely has no data. Never retried.
 */
public class NotFoundException extends FetchException {
    public NotFoundException(String message) { super(message); }
}
