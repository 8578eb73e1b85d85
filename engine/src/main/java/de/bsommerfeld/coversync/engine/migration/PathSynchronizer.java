package de.bsommerfeld.coversync.engine.migration;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.coversync.core.domain.CoverKind;
import de.bsommerfeld.coversync.core.domain.MigrationProgress;
import de.bsommerfeld.coversync.db.CoverDatabase;
import de.bsommerfeld.coversync.db.CoverQueries;
import de.bsommerfeld.coversync.db.StoreException;
import de.bsommerfeld.coversync.db.StoreLease;
import de.bsommerfeld.coversync.db.StoreTransaction;
import de.bsommerfeld.coversync.engine.ErrorCollector;
import de.bsommerfeld.coversync.engine.storage.CoverFileStorage;
import de.bsommerfeld.coversync.engine.storage.ImageFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Points rows at cover files that already exist on disk, e.g. after a
 * migration whose pointer updates were lost or after files were copied in
 * from another machine.
 *
 * <p>
 * A file qualifies when it sits directly in {@code tracks/} or
 * {@code albums/}, has a cover extension and its stem is a numeric id. All
 * updates of one directory run in a single transaction. An id without a
 * matching row is logged and skipped; a failing statement is recorded and the
 * transaction carries on.
 */
@Singleton
public class PathSynchronizer {

    private static final Logger LOG = LoggerFactory.getLogger(PathSynchronizer.class);

    private final CoverDatabase database;
    private final CoverFileStorage storage;

    @Inject
    public PathSynchronizer(CoverDatabase database, CoverFileStorage storage) {
        this.database = database;
        this.storage = storage;
    }

    /**
     * Syncs against the configured covers root.
     */
    public MigrationProgress syncPathsFromFiles() throws StoreException {
        return syncPathsFromFiles(storage.root());
    }

    /**
     * @throws StoreException if the database lock cannot be acquired or a
     *                        transaction cannot be opened
     */
    public MigrationProgress syncPathsFromFiles(Path coversRoot) throws StoreException {
        long start = System.currentTimeMillis();
        LOG.info("Syncing cover paths from {}", coversRoot);

        ErrorCollector errors = new ErrorCollector(LOG);
        List<CoverFile> trackFiles = scan(coversRoot, CoverKind.TRACK, errors);
        List<CoverFile> albumFiles = scan(coversRoot, CoverKind.ALBUM, errors);

        int tracksSynced = apply(CoverKind.TRACK, trackFiles, errors);
        int albumsSynced = apply(CoverKind.ALBUM, albumFiles, errors);

        int synced = tracksSynced + albumsSynced;
        LOG.info("Path sync finished in {} ms: {} tracks, {} albums, {} errors",
                System.currentTimeMillis() - start, tracksSynced, albumsSynced, errors.size());
        return new MigrationProgress(synced, synced, tracksSynced, albumsSynced, errors.toList());
    }

    private List<CoverFile> scan(Path coversRoot, CoverKind kind, ErrorCollector errors) {
        Path dir = coversRoot.resolve(kind.directoryName());
        List<CoverFile> files = new ArrayList<>();
        if (!Files.exists(dir)) {
            LOG.info("No {} directory at {}", kind.directoryName(), dir);
            return files;
        }

        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path entry : stream) {
                if (!Files.isRegularFile(entry)) {
                    continue;
                }
                String name = entry.getFileName().toString();
                if (!ImageFormat.hasCoverExtension(name)) {
                    continue;
                }
                String stem = name.substring(0, name.lastIndexOf('.'));
                try {
                    files.add(new CoverFile(Long.parseLong(stem), entry.toAbsolutePath().normalize().toString()));
                } catch (NumberFormatException e) {
                    LOG.debug("Skipping {}: not named after an id", entry);
                }
            }
        } catch (IOException | DirectoryIteratorException e) {
            errors.add("Failed to read " + kind.directoryName() + " directory: " + e.getMessage());
        }

        files.sort(Comparator.comparingLong(CoverFile::id));
        LOG.debug("Found {} {} cover files", files.size(), kind.label());
        return files;
    }

    private int apply(CoverKind kind, List<CoverFile> files, ErrorCollector errors) throws StoreException {
        if (files.isEmpty()) {
            return 0;
        }
        int synced = 0;
        try (StoreLease lease = database.acquire();
             StoreTransaction tx = lease.beginTransaction()) {
            for (CoverFile file : files) {
                try {
                    int updated = CoverQueries.updateCoverPath(tx, kind, file.id(), file.path());
                    if (updated > 0) {
                        synced++;
                    } else {
                        LOG.debug("{} {} not found in database, skipping {}", kind.label(), file.id(), file.path());
                    }
                } catch (StoreException e) {
                    errors.add("Failed to update " + kind.label() + " " + file.id() + ": " + e.getMessage());
                }
            }
            try {
                tx.commit();
            } catch (StoreException e) {
                errors.add(e.getMessage());
                // rolled back on close, nothing was synced
                synced = 0;
            }
        }
        return synced;
    }

    private record CoverFile(long id, String path) {
    }
}
