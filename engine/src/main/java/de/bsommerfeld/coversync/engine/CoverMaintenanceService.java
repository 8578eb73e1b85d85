package de.bsommerfeld.coversync.engine;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.coversync.core.domain.MergeResult;
import de.bsommerfeld.coversync.core.domain.MigrationProgress;
import de.bsommerfeld.coversync.db.StoreException;
import de.bsommerfeld.coversync.engine.cleanup.InlineCoverCleaner;
import de.bsommerfeld.coversync.engine.cleanup.OrphanCoverSweeper;
import de.bsommerfeld.coversync.engine.lookup.CoverLookupService;
import de.bsommerfeld.coversync.engine.merge.DuplicateMergeEngine;
import de.bsommerfeld.coversync.engine.migration.MigrationEngine;
import de.bsommerfeld.coversync.engine.migration.PathSynchronizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Single entry point for callers outside the engine module: the command-line
 * runner and the player's command layer. Every method runs synchronously on
 * the calling thread.
 */
@Singleton
public class CoverMaintenanceService {

    private static final Logger LOG = LoggerFactory.getLogger(CoverMaintenanceService.class);

    private final MigrationEngine migrationEngine;
    private final PathSynchronizer pathSynchronizer;
    private final DuplicateMergeEngine mergeEngine;
    private final InlineCoverCleaner inlineCleaner;
    private final OrphanCoverSweeper orphanSweeper;
    private final CoverLookupService lookupService;

    @Inject
    public CoverMaintenanceService(MigrationEngine migrationEngine,
                                   PathSynchronizer pathSynchronizer,
                                   DuplicateMergeEngine mergeEngine,
                                   InlineCoverCleaner inlineCleaner,
                                   OrphanCoverSweeper orphanSweeper,
                                   CoverLookupService lookupService) {
        this.migrationEngine = migrationEngine;
        this.pathSynchronizer = pathSynchronizer;
        this.mergeEngine = mergeEngine;
        this.inlineCleaner = inlineCleaner;
        this.orphanSweeper = orphanSweeper;
        this.lookupService = lookupService;
    }

    public MigrationProgress migrateInlineToFiles() throws StoreException {
        return migrationEngine.migrateInlineToFiles();
    }

    public MigrationProgress syncPathsFromFiles() throws StoreException {
        return pathSynchronizer.syncPathsFromFiles();
    }

    public MigrationProgress syncPathsFromFiles(Path coversRoot) throws StoreException {
        return pathSynchronizer.syncPathsFromFiles(coversRoot);
    }

    public MergeResult mergeDuplicateCovers() throws StoreException {
        return mergeEngine.mergeDuplicateCovers();
    }

    public int clearInlineAfterMigration() throws StoreException {
        return inlineCleaner.clearInlineAfterMigration();
    }

    public int cleanupOrphanedCovers() throws StoreException {
        return orphanSweeper.sweep();
    }

    public Optional<String> trackCoverPath(long trackId) throws StoreException {
        return lookupService.trackCoverPath(trackId);
    }

    public Optional<String> albumArtPath(long albumId) throws StoreException {
        return lookupService.albumArtPath(albumId);
    }

    public Map<Long, String> batchCoverPaths(Collection<Long> trackIds) throws StoreException {
        return lookupService.batchCoverPaths(trackIds);
    }

    /**
     * Migrates, then syncs, then merges. Inline payloads are left in place;
     * clearing them is a separate, explicit step.
     */
    public MaintenanceReport runAll() throws StoreException {
        LOG.info("Running full cover maintenance");
        MigrationProgress migration = migrateInlineToFiles();
        MigrationProgress sync = syncPathsFromFiles();
        MergeResult merge = mergeDuplicateCovers();
        return new MaintenanceReport(migration, sync, merge);
    }
}
