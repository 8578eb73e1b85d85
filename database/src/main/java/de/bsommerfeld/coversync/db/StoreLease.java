package de.bsommerfeld.coversync.db;

import java.util.List;
import java.util.Optional;

/**
 * Exclusive, scoped access to the shared library connection. Obtained from
 * {@link CoverDatabase#acquire()} and released by {@link #close()}; use it in
 * a try-with-resources block so the lock is released on every exit path.
 *
 * <p>
 * Holders must keep the lease short: read one bounded batch or run one
 * transaction, then close. File I/O never happens while a lease is open.
 */
public interface StoreLease extends SqlExecutor, AutoCloseable {

    /**
     * Runs a query and maps every row.
     */
    <T> List<T> query(String sql, RowMapper<T> mapper, Object... params) throws StoreException;

    /**
     * Runs a query and maps the first row, if any.
     */
    default <T> Optional<T> queryFirst(String sql, RowMapper<T> mapper, Object... params) throws StoreException {
        List<T> rows = query(sql, mapper, params);
        return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
    }

    /**
     * Switches the connection out of auto-commit until the returned
     * transaction is committed or closed. At most one transaction may be open
     * per lease.
     */
    StoreTransaction beginTransaction() throws StoreException;

    /**
     * Releases the lock. Idempotent.
     */
    @Override
    void close();
}
