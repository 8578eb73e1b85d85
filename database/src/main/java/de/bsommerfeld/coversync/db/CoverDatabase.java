package de.bsommerfeld.coversync.db;

/**
 * The library database as seen by the cover engines: one shared connection
 * behind one lock. Every access goes through a {@link StoreLease}.
 *
 * <pre>
 * try (StoreLease lease = database.acquire()) {
 *     rows = lease.query(...);
 * } // lock released here, before any file I/O
 * </pre>
 */
public interface CoverDatabase extends AutoCloseable {

    /**
     * Blocks until the lock is free or the configured timeout elapses.
     *
     * @throws StoreUnavailableException if the lock could not be acquired
     */
    StoreLease acquire() throws StoreUnavailableException;

    @Override
    void close();
}
