package de.bsommerfeld.coversync.db;

/**
 * The database lock could not be acquired: the wait timed out, the thread was
 * interrupted, or the database was already closed. Unlike other
 * {@link StoreException}s this is never recorded per item; it aborts the
 * whole operation.
 */
public class StoreUnavailableException extends StoreException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
