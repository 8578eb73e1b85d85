package de.bsommerfeld.coversync.engine.cleanup;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.coversync.core.domain.CoverKind;
import de.bsommerfeld.coversync.db.CoverDatabase;
import de.bsommerfeld.coversync.db.CoverQueries;
import de.bsommerfeld.coversync.db.StoreException;
import de.bsommerfeld.coversync.db.StoreLease;
import de.bsommerfeld.coversync.engine.storage.CoverFileStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Deletes files in the cover directories that no track or album points at,
 * typically the redundant copies left behind when a merge was interrupted or
 * leftovers of rows deleted by the library scanner.
 */
@Singleton
public class OrphanCoverSweeper {

    private static final Logger LOG = LoggerFactory.getLogger(OrphanCoverSweeper.class);

    private final CoverDatabase database;
    private final CoverFileStorage storage;

    @Inject
    public OrphanCoverSweeper(CoverDatabase database, CoverFileStorage storage) {
        this.database = database;
        this.storage = storage;
    }

    /**
     * @return number of files deleted
     * @throws StoreException if the referenced paths cannot be read
     */
    public int sweep() throws StoreException {
        Set<String> stored;
        try (StoreLease lease = database.acquire()) {
            stored = CoverQueries.referencedCoverPaths(lease);
        }

        Set<Path> referenced = new HashSet<>();
        for (String path : stored) {
            try {
                referenced.add(Path.of(path).toAbsolutePath().normalize());
            } catch (InvalidPathException e) {
                LOG.warn("Ignoring unparseable cover path {}", path);
            }
        }

        int deleted = 0;
        for (CoverKind kind : CoverKind.values()) {
            deleted += sweep(storage.root().resolve(kind.directoryName()), referenced);
        }
        LOG.info("Orphan sweep deleted {} files ({} paths referenced)", deleted, referenced.size());
        return deleted;
    }

    private int sweep(Path dir, Set<Path> referenced) {
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        int deleted = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, Files::isRegularFile)) {
            for (Path file : stream) {
                if (referenced.contains(file.toAbsolutePath().normalize())) {
                    continue;
                }
                try {
                    storage.deleteFile(file.toString());
                    deleted++;
                    LOG.debug("Deleted orphaned cover {}", file);
                } catch (NoSuchFileException e) {
                    LOG.debug("Already deleted: {}", file);
                } catch (IOException e) {
                    LOG.warn("Failed to delete orphaned cover {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException | DirectoryIteratorException e) {
            LOG.warn("Failed to scan {} for orphaned covers", dir, e);
        }
        return deleted;
    }
}
