package de.bsommerfeld.coversync.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * {@link StoreTransaction} over a JDBC connection that has been switched out
 * of auto-commit by the owning lease. Auto-commit is restored on commit or
 * close.
 */
final class JdbcStoreTransaction implements StoreTransaction {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcStoreTransaction.class);

    private final Connection connection;
    private boolean committed;
    private boolean closed;

    JdbcStoreTransaction(Connection connection) {
        this.connection = connection;
    }

    @Override
    public int execute(String sql, Object... params) throws StoreException {
        ensureActive();
        return JdbcStoreLease.executeUpdate(connection, sql, params);
    }

    @Override
    public void commit() throws StoreException {
        ensureActive();
        try {
            connection.commit();
        } catch (SQLException e) {
            throw new StoreException("Transaction commit failed: " + e.getMessage(), e);
        }
        committed = true;
        restoreAutoCommit();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (committed) {
            return;
        }
        try {
            connection.rollback();
        } catch (SQLException e) {
            LOG.warn("Rollback failed", e);
        }
        restoreAutoCommit();
    }

    boolean isActive() {
        return !closed && !committed;
    }

    private void ensureActive() {
        if (!isActive()) {
            throw new IllegalStateException("Transaction is no longer active");
        }
    }

    private void restoreAutoCommit() {
        try {
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            LOG.warn("Failed to restore auto-commit", e);
        }
    }
}
