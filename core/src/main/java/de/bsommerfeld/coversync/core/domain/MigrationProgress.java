package de.bsommerfeld.coversync.core.domain;

import java.util.List;

/**
 * Outcome of a migration or path-sync run. For path sync, "migrated" means
 * "synced".
 *
 * @param total          rows selected at the start of the run
 * @param processed      rows attempted, successful or not
 * @param tracksMigrated tracks whose path pointer was written
 * @param albumsMigrated albums whose path pointer was written
 * @param errors         one human-readable entry per failed item
 */
public record MigrationProgress(
        int total,
        int processed,
        int tracksMigrated,
        int albumsMigrated,
        List<String> errors) {

    public MigrationProgress {
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
