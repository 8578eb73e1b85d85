package de.bsommerfeld.coversync.db;

/**
 * An explicit transaction on the shared connection. Statements executed
 * through it become visible only after {@link #commit()}. Closing without a
 * successful commit rolls back, so a crash or early return between statements
 * never leaves a partially applied batch.
 *
 * <p>
 * A failing statement does not poison the transaction: the caller may record
 * the failure, continue with the next statement and still commit the rest.
 */
public interface StoreTransaction extends SqlExecutor, AutoCloseable {

    void commit() throws StoreException;

    @Override
    void close();
}
