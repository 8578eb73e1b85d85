package de.bsommerfeld.coversync.engine.migration;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.coversync.core.domain.CoverKind;
import de.bsommerfeld.coversync.core.domain.InlineCover;
import de.bsommerfeld.coversync.core.domain.MigrationProgress;
import de.bsommerfeld.coversync.db.CoverDatabase;
import de.bsommerfeld.coversync.db.CoverQueries;
import de.bsommerfeld.coversync.db.StoreException;
import de.bsommerfeld.coversync.db.StoreLease;
import de.bsommerfeld.coversync.db.StoreUnavailableException;
import de.bsommerfeld.coversync.engine.ErrorCollector;
import de.bsommerfeld.coversync.engine.storage.CoverFileStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Moves inline cover payloads out of the database into files and records
 * the resulting path on the row.
 *
 * <p>
 * The pending rows are read under one lease which is released before any
 * file is written. Each row then gets its own short lease for the pointer
 * update. A row whose write or update fails keeps its inline payload and no
 * path, so the next run picks it up again.
 */
@Singleton
public class MigrationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(MigrationEngine.class);

    private final CoverDatabase database;
    private final CoverFileStorage storage;

    @Inject
    public MigrationEngine(CoverDatabase database, CoverFileStorage storage) {
        this.database = database;
        this.storage = storage;
    }

    /**
     * @throws StoreException if the database lock cannot be acquired or the
     *                        pending rows cannot be read
     */
    public MigrationProgress migrateInlineToFiles() throws StoreException {
        long start = System.currentTimeMillis();

        List<InlineCover> tracks;
        List<InlineCover> albums;
        try (StoreLease lease = database.acquire()) {
            tracks = CoverQueries.pendingMigration(lease, CoverKind.TRACK);
            albums = CoverQueries.pendingMigration(lease, CoverKind.ALBUM);
        }

        int total = tracks.size() + albums.size();
        LOG.info("Migrating inline covers to files: {} tracks, {} albums", tracks.size(), albums.size());

        ErrorCollector errors = new ErrorCollector(LOG);
        int processed = 0;
        int tracksMigrated = 0;
        for (InlineCover cover : tracks) {
            processed++;
            if (migrate(cover, errors)) {
                tracksMigrated++;
            }
        }
        int albumsMigrated = 0;
        for (InlineCover cover : albums) {
            processed++;
            if (migrate(cover, errors)) {
                albumsMigrated++;
            }
        }

        LOG.info("Migration finished in {} ms: {}/{} tracks, {}/{} albums, {} errors",
                System.currentTimeMillis() - start, tracksMigrated, tracks.size(),
                albumsMigrated, albums.size(), errors.size());
        return new MigrationProgress(total, processed, tracksMigrated, albumsMigrated, errors.toList());
    }

    boolean migrate(InlineCover cover, ErrorCollector errors) throws StoreUnavailableException {
        String label = cover.kind().label();
        long id = cover.ownerId();

        if (!cover.state().needsMigration()) {
            LOG.debug("Skipping {} {}: already points at {}", label, id, cover.coverPath());
            return false;
        }

        if (!cover.isDecodable()) {
            errors.add("Failed to decode " + label + " " + id + " cover: " + cover.decodeFailure());
            return false;
        }

        String path;
        try {
            path = storage.save(cover.kind(), id, cover.payload());
        } catch (IOException e) {
            errors.add("Failed to save " + label + " " + id + " cover: " + e.getMessage());
            return false;
        }

        try (StoreLease lease = database.acquire()) {
            int updated = CoverQueries.updateCoverPath(lease, cover.kind(), id, path);
            if (updated == 0) {
                LOG.debug("{} {} vanished before its cover path could be recorded", label, id);
                return false;
            }
        } catch (StoreUnavailableException e) {
            throw e;
        } catch (StoreException e) {
            errors.add("Failed to update " + label + " " + id + " path: " + e.getMessage());
            return false;
        }
        LOG.debug("Migrated {} {} cover to {}", label, id, path);
        return true;
    }
}
