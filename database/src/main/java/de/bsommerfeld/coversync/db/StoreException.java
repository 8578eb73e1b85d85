package de.bsommerfeld.coversync.db;

/**
 * Thrown when a query, statement or transaction against the library database
 * fails. The message is meant to be copied verbatim into a result record's
 * error list.
 */
public class StoreException extends Exception {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
