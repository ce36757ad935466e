package io.marketsync.batch;

import com.codahale.metrics.Timer;
import io.marketsync.core.PersistentStore;
import io.marketsync.core.SeriesRow;
import io.marketsync.core.StoreTransaction;
import io.marketsync.error.PersistenceException;
import io.marketsync.metrics.SyncMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Buffers fetched rows and writes them to the store in transactional batches.
 * <p>
 * Appending, the threshold check and the flush happen under one lock, so a batch is never flushed twice and
 * never flushed while half-appended. Each flush is one transaction: on failure it is rolled back and the rows
 * stay buffered for the next attempt.
 */
public class BatchAccumulator {
    private static final Logger log = LoggerFactory.getLogger(BatchAccumulator.class);

    private final PersistentStore store;
    private final String table;
    private final SyncMetrics metrics;
    private final Object lock = new Object();
    private final Batch batch;
    private int flushCount;
    private long rowsWritten;

    public BatchAccumulator(PersistentStore store, String table, int threshold, SyncMetrics metrics) {
        this.store = Objects.requireNonNull(store, "store");
        this.table = Objects.requireNonNull(table, "table");
        this.batch = new Batch(threshold);
        this.metrics = metrics == null ? new SyncMetrics() : metrics;
    }

    /**
     * Buffers the rows of one subject and flushes if the threshold is reached.
     *
     * @return true if this call flushed the buffer
     */
    public boolean add(String subjectId, List<SeriesRow> records) throws PersistenceException {
        synchronized (lock) {
            batch.append(subjectId, records);
            if (!batch.isFull()) return false;
            flushLocked();
            return true;
        }
    }

    /** Writes whatever is buffered. Returns the number of rows written; 0 if the buffer was empty. */
    public int flush() throws PersistenceException {
        synchronized (lock) {
            return flushLocked();
        }
    }

    /** Final flush at the end of a run. */
    public int finish() throws PersistenceException {
        int written = flush();
        log.debug("batch accumulator finished: {} flushes, {} rows", flushCount(), rowsWritten());
        return written;
    }

    private int flushLocked() throws PersistenceException {
        if (batch.isEmpty()) return 0;
        int size = batch.size();
        int subjects = batch.subjectCount();
        int written;
        try (Timer.Context ignored = metrics.timer(SyncMetrics.BATCH_FLUSH_TIME).time()) {
            written = writeInTransaction(batch.view());
        } catch (PersistenceException e) {
            metrics.counter(SyncMetrics.BATCH_FLUSH_FAILURES).inc();
            log.warn("flush of {} rows for {} subjects into {} failed: {}", size, subjects, table, e.getMessage());
            throw e;
        }
        batch.clear();
        flushCount++;
        rowsWritten += size;
        metrics.counter(SyncMetrics.BATCH_FLUSHES).inc();
        metrics.counter(SyncMetrics.BATCH_RECORDS).inc(size);
        log.debug("flushed {} rows for {} subjects into {}", size, subjects, table);
        return written;
    }

    private int writeInTransaction(List<SeriesRow> rows) throws PersistenceException {
        StoreTransaction txn = store.beginTransaction();
        try {
            int written = store.bulkUpsert(txn, table, rows);
            store.commit(txn);
            return written;
        } catch (PersistenceException | RuntimeException e) {
            try {
                store.rollback(txn);
            } catch (PersistenceException | RuntimeException re) {
                e.addSuppressed(re);
            }
            if (e instanceof PersistenceException) throw (PersistenceException) e;
            throw new PersistenceException("bulk upsert into " + table + " failed", e);
        }
    }

    public int pendingRecords() {
        synchronized (lock) { return batch.size(); }
    }

    public int pendingSubjects() {
        synchronized (lock) { return batch.subjectCount(); }
    }

    public int flushCount() {
        synchronized (lock) { return flushCount; }
    }

    public long rowsWritten() {
        synchronized (lock) { return rowsWritten; }
    }

    public int threshold() { return batch.threshold(); }
}
