package de.bsommerfeld.coversync.core.domain;

/**
 * Storage state of a single track or album row. A row can carry its cover as
 * an inline payload, as a path pointer to a file, as both, or not at all. The
 * two representations are never synchronized automatically, so the migration
 * and merge engines check the state explicitly before touching a row.
 *
 * <pre>
 *   INLINE_ONLY ── migrate ──▶ BOTH ── clear inline ──▶ PATH_ONLY
 *        ▲                       ▲
 *        └──── ingestion         └──── path sync (file placed externally)
 * </pre>
 */
public enum CoverState {

    INLINE_ONLY,
    PATH_ONLY,
    BOTH,
    NEITHER;

    /**
     * Derives the state from the two columns. An empty path string counts as
     * absent.
     */
    public static CoverState of(boolean hasInline, String path) {
        boolean hasPath = path != null && !path.isEmpty();
        if (hasInline && hasPath) {
            return BOTH;
        }
        if (hasInline) {
            return INLINE_ONLY;
        }
        return hasPath ? PATH_ONLY : NEITHER;
    }

    /**
     * Rows that still need their inline payload written to a file. Rows in
     * {@link #BOTH} already have a file and are skipped, which makes re-runs
     * retry only the remainder.
     */
    public boolean needsMigration() {
        return this == INLINE_ONLY;
    }

    public boolean isMergeCandidate() {
        return this == PATH_ONLY || this == BOTH;
    }
}
