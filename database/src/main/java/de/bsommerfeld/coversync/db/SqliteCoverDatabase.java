package de.bsommerfeld.coversync.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SQLite-backed {@link CoverDatabase}.
 *
 * <h3>Connection strategy</h3>
 * Exactly one {@link Connection} is opened for the lifetime of this object
 * and shared by every caller. A single {@link ReentrantLock} serializes access
 * to it; callers obtain the lock through {@link #acquire()} and give it back
 * by closing the returned {@link StoreLease}. Waiting is bounded by the
 * configured timeout so a stuck holder surfaces as a
 * {@link StoreUnavailableException} instead of a hang.
 *
 * <h3>Startup</h3>
 * The connection is switched to WAL journaling, an integrity check is run
 * (a failing check is logged, not fatal), and {@code schema.sql} is applied.
 * Every DDL statement uses {@code IF NOT EXISTS} so re-running is safe.
 *
 * @see SqlLoader
 * @see CoverQueries
 */
public class SqliteCoverDatabase implements CoverDatabase {

    private static final Logger LOG = LoggerFactory.getLogger(SqliteCoverDatabase.class);

    private final String dbUrl;
    private final Duration lockTimeout;
    private final ReentrantLock lock = new ReentrantLock();
    private final Connection connection;
    private volatile boolean closed;

    public SqliteCoverDatabase(Path dbFile, Duration lockTimeout) throws StoreException {
        this("jdbc:sqlite:" + dbFile.toAbsolutePath(), lockTimeout);
    }

    public SqliteCoverDatabase(String dbUrl, Duration lockTimeout) throws StoreException {
        this.dbUrl = dbUrl;
        this.lockTimeout = lockTimeout;
        LOG.info("Opening library database at {}", dbUrl);
        try {
            this.connection = DriverManager.getConnection(dbUrl);
        } catch (SQLException e) {
            throw new StoreException("Failed to open library database at " + dbUrl + ": " + e.getMessage(), e);
        }
        try {
            configure();
            applySchema();
        } catch (SQLException e) {
            try {
                connection.close();
            } catch (SQLException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw new StoreException("Database initialization failed: " + e.getMessage(), e);
        }
    }

    @Override
    public StoreLease acquire() throws StoreUnavailableException {
        if (closed) {
            throw new StoreUnavailableException("Library database is closed");
        }
        try {
            if (!lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new StoreUnavailableException("Timed out after " + lockTimeout.toSeconds()
                        + "s waiting for the library database lock");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException("Interrupted while waiting for the library database lock", e);
        }
        if (closed) {
            lock.unlock();
            throw new StoreUnavailableException("Library database is closed");
        }
        return new JdbcStoreLease(connection, lock::unlock);
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            connection.close();
            LOG.info("Closed library database at {}", dbUrl);
        } catch (SQLException e) {
            LOG.warn("Failed to close library database at {}", dbUrl, e);
        } finally {
            lock.unlock();
        }
    }

    private void configure() throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("PRAGMA journal_mode = WAL");
            stmt.execute("PRAGMA synchronous = NORMAL");
            try (ResultSet rs = stmt.executeQuery("PRAGMA integrity_check")) {
                String status = rs.next() ? rs.getString(1) : "no result";
                if (!"ok".equalsIgnoreCase(status)) {
                    LOG.warn("Database integrity check failed: {}", status);
                }
            }
        }
    }

    /**
     * Applies the DDL from {@code schema.sql}, one statement at a time inside a
     * single transaction.
     */
    private void applySchema() throws SQLException {
        String schemaSql;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("schema.sql")) {
            if (in == null) {
                throw new SQLException("schema.sql not found in classpath");
            }
            schemaSql = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (java.io.IOException e) {
            throw new SQLException("Failed to read schema.sql", e);
        }

        connection.setAutoCommit(false);
        try (Statement stmt = connection.createStatement()) {
            for (String sql : schemaSql.split(";\\s*(\\r?\\n|$)")) {
                if (sql.trim().isEmpty())
                    continue;
                stmt.execute(sql.trim());
            }
            connection.commit();
            LOG.info("Database schema applied.");
        } catch (SQLException e) {
            connection.rollback();
            throw e;
        } finally {
            connection.setAutoCommit(true);
        }
    }
}
