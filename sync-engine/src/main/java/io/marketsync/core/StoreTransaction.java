package io.marketsync.core;

/**
 * Handle for one open transaction of a {@link PersistentStore}. Only meaningful to the store that created it.
 */
public interface StoreTransaction {
}
