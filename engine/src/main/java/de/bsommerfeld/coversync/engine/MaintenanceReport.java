package de.bsommerfeld.coversync.engine;

import de.bsommerfeld.coversync.core.domain.MergeResult;
import de.bsommerfeld.coversync.core.domain.MigrationProgress;

/**
 * Results of a full maintenance pass: migrate, sync, merge.
 */
public record MaintenanceReport(MigrationProgress migration, MigrationProgress sync, MergeResult merge) {

    public boolean hasErrors() {
        return migration.hasErrors() || sync.hasErrors() || merge.hasErrors();
    }
}
