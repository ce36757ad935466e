package io.marketsync.financial;

import io.marketsync.core.PersistentStore;
import io.marketsync.core.SeriesRow;
import io.marketsync.core.StoreTransaction;
import io.marketsync.error.PersistenceException;

import java.sql.Connection;
import java.sql.Date;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * JDBC price store with schema (subject_id, trade_date, open, high, low, close, adj_close, volume) keyed by
 * (subject_id, trade_date). Writes use H2's {@code MERGE INTO ... KEY}, so replaying a batch is harmless.
 * One connection per transaction; use a pooled DataSource in production.
 */
public class JdbcPriceStore implements PersistentStore {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String jdbcUrl;
    private final String user;
    private final String password;
    private final String table;

    public JdbcPriceStore(String jdbcUrl, String table) { this(jdbcUrl, null, null, table); }

    public JdbcPriceStore(String jdbcUrl, String user, String password, String table) {
        this.jdbcUrl = jdbcUrl;
        this.user = user;
        this.password = password;
        this.table = checkTable(table);
    }

    static final class JdbcTransaction implements StoreTransaction {
        private final Connection connection;

        JdbcTransaction(Connection connection) { this.connection = connection; }
    }

    public void ensureSchema() throws PersistenceException {
        String ddl = "CREATE TABLE IF NOT EXISTS " + table + " ("
                + "subject_id VARCHAR(32) NOT NULL, "
                + "trade_date DATE NOT NULL, "
                + "open DOUBLE PRECISION, high DOUBLE PRECISION, low DOUBLE PRECISION, close DOUBLE PRECISION, "
                + "adj_close DOUBLE PRECISION, volume DOUBLE PRECISION, "
                + "PRIMARY KEY (subject_id, trade_date))";
        try (Connection c = getConnection(); Statement s = c.createStatement()) {
            s.execute(ddl);
        } catch (SQLException e) {
            throw new PersistenceException("could not create table " + table, e);
        }
    }

    @Override
    public StoreTransaction beginTransaction() throws PersistenceException {
        Connection c;
        try {
            c = getConnection();
        } catch (SQLException e) {
            throw new PersistenceException("could not open transaction on " + jdbcUrl, e);
        }
        try {
            c.setAutoCommit(false);
            return new JdbcTransaction(c);
        } catch (SQLException e) {
            try {
                c.close();
            } catch (SQLException closeError) {
                e.addSuppressed(closeError);
            }
            throw new PersistenceException("could not open transaction on " + jdbcUrl, e);
        }
    }

    @Override
    public int bulkUpsert(StoreTransaction txn, String table, List<SeriesRow> rows) throws PersistenceException {
        if (rows.isEmpty()) return 0;
        String sql = "MERGE INTO " + checkTable(table)
                + " (subject_id, trade_date, open, high, low, close, adj_close, volume) KEY (subject_id, trade_date)"
                + " VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement ps = connection(txn).prepareStatement(sql)) {
            for (SeriesRow r : rows) {
                ps.setString(1, r.subjectId());
                ps.setDate(2, Date.valueOf(r.date()));
                int i = 3;
                for (String column : YahooDataSource.COLUMNS) setDouble(ps, i++, r.value(column));
                ps.addBatch();
            }
            ps.executeBatch();
            return rows.size();
        } catch (SQLException e) {
            throw new PersistenceException("upsert of " + rows.size() + " rows into " + table + " failed", e);
        }
    }

    @Override
    public void commit(StoreTransaction txn) throws PersistenceException {
        Connection c = connection(txn);
        try {
            c.commit();
        } catch (SQLException e) {
            throw new PersistenceException("commit failed", e);
        } finally {
            close(c);
        }
    }

    @Override
    public void rollback(StoreTransaction txn) throws PersistenceException {
        Connection c = connection(txn);
        try {
            c.rollback();
        } catch (SQLException e) {
            throw new PersistenceException("rollback failed", e);
        } finally {
            close(c);
        }
    }

    @Override
    public Optional<LocalDate> latestDateFor(String subjectId) throws PersistenceException {
        String sql = "SELECT MAX(trade_date) FROM " + table + " WHERE subject_id = ?";
        try (Connection c = getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, subjectId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                Date d = rs.getDate(1);
                return d == null ? Optional.empty() : Optional.of(d.toLocalDate());
            }
        } catch (SQLException e) {
            throw new PersistenceException("could not read latest date of " + subjectId, e);
        }
    }

    @Override
    public boolean hasAnyData(String subjectId) throws PersistenceException {
        String sql = "SELECT 1 FROM " + table + " WHERE subject_id = ? FETCH FIRST 1 ROWS ONLY";
        try (Connection c = getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, subjectId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new PersistenceException("could not look up " + subjectId, e);
        }
    }

    public int countRows(String subjectId) throws PersistenceException {
        String sql = "SELECT COUNT(*) FROM " + table + " WHERE subject_id = ?";
        try (Connection c = getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, subjectId);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        } catch (SQLException e) {
            throw new PersistenceException("could not count rows of " + subjectId, e);
        }
    }

    public String table() { return table; }

    private static void setDouble(PreparedStatement ps, int index, Double v) throws SQLException {
        if (v == null) ps.setNull(index, Types.DOUBLE);
        else ps.setDouble(index, v);
    }

    private static Connection connection(StoreTransaction txn) {
        if (!(txn instanceof JdbcTransaction)) throw new IllegalArgumentException("not a JDBC transaction: " + txn);
        return ((JdbcTransaction) txn).connection;
    }

    private static void close(Connection c) throws PersistenceException {
        try {
            c.close();
        } catch (SQLException e) {
            throw new PersistenceException("could not close connection", e);
        }
    }

    private static String checkTable(String table) {
        if (table == null || !IDENTIFIER.matcher(table).matches()) {
            throw new IllegalArgumentException("invalid table name: " + table);
        }
        return table;
    }

    Connection getConnection() throws SQLException {
        return (user == null) ? DriverManager.getConnection(jdbcUrl) : DriverManager.getConnection(jdbcUrl, user, password);
    }
}
