package io.marketsync.error;

/**
 * Failure of the persistent store (connection, statement or commit).
 */
public class PersistenceException extends Exception {
    public PersistenceException(String message) { super(message); }
    public PersistenceException(String message, Throwable cause) { super(message, cause); }
}
