package de.bsommerfeld.coversync.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link StoreLease} over a raw JDBC connection. Not thread-safe; a lease
 * belongs to the thread that acquired it.
 */
final class JdbcStoreLease implements StoreLease {

    private final Connection connection;
    private final Runnable release;
    private JdbcStoreTransaction transaction;
    private boolean released;

    JdbcStoreLease(Connection connection, Runnable release) {
        this.connection = connection;
        this.release = release;
    }

    @Override
    public <T> List<T> query(String sql, RowMapper<T> mapper, Object... params) throws StoreException {
        ensureHeld();
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            bind(ps, params);
            List<T> rows = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(mapper.map(rs));
                }
            }
            return rows;
        } catch (SQLException e) {
            throw new StoreException(e.getMessage(), e);
        }
    }

    @Override
    public int execute(String sql, Object... params) throws StoreException {
        ensureHeld();
        return executeUpdate(connection, sql, params);
    }

    @Override
    public StoreTransaction beginTransaction() throws StoreException {
        ensureHeld();
        if (transaction != null && transaction.isActive()) {
            throw new IllegalStateException("A transaction is already open on this lease");
        }
        try {
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            throw new StoreException("Failed to begin transaction: " + e.getMessage(), e);
        }
        transaction = new JdbcStoreTransaction(connection);
        return transaction;
    }

    @Override
    public void close() {
        if (released) {
            return;
        }
        released = true;
        try {
            if (transaction != null) {
                transaction.close();
            }
        } finally {
            release.run();
        }
    }

    private void ensureHeld() {
        if (released) {
            throw new IllegalStateException("Lease has already been released");
        }
    }

    static int executeUpdate(Connection connection, String sql, Object... params) throws StoreException {
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            bind(ps, params);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException(e.getMessage(), e);
        }
    }

    private static void bind(PreparedStatement ps, Object... params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            ps.setObject(i + 1, params[i]);
        }
    }
}
