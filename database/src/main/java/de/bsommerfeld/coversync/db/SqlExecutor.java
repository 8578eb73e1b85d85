package de.bsommerfeld.coversync.db;

/**
 * Anything that can run a parameterized DML statement: a {@link StoreLease}
 * in auto-commit mode or an open {@link StoreTransaction}.
 */
public interface SqlExecutor {

    /**
     * Executes an {@code INSERT}, {@code UPDATE} or {@code DELETE}.
     *
     * @param sql    statement with {@code ?} placeholders
     * @param params values bound in order; {@code null} binds SQL NULL
     * @return number of rows affected
     */
    int execute(String sql, Object... params) throws StoreException;
}
