package io.marketsync.core;

import io.marketsync.error.PersistenceException;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Durable home of synchronized rows. bulkUpsert must be idempotent for the same input.
 */
public interface PersistentStore {
    StoreTransaction beginTransaction() throws PersistenceException;

    /** Insert or replace rows keyed by (subjectId, date). Returns the number of rows written. */
    int bulkUpsert(StoreTransaction txn, String table, List<SeriesRow> rows) throws PersistenceException;

    void commit(StoreTransaction txn) throws PersistenceException;

    void rollback(StoreTransaction txn) throws PersistenceException;

    Optional<LocalDate> latestDateFor(String subjectId) throws PersistenceException;

    boolean hasAnyData(String subjectId) throws PersistenceException;
}
