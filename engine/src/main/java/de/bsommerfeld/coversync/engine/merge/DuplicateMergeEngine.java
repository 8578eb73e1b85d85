package de.bsommerfeld.coversync.engine.merge;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.coversync.core.domain.CoverFileRecord;
import de.bsommerfeld.coversync.core.domain.CoverKind;
import de.bsommerfeld.coversync.core.domain.MergeResult;
import de.bsommerfeld.coversync.core.domain.SizedCoverFile;
import de.bsommerfeld.coversync.core.domain.TrackCoverPointer;
import de.bsommerfeld.coversync.core.hash.ContentHasher;
import de.bsommerfeld.coversync.core.util.ByteFormatter;
import de.bsommerfeld.coversync.db.CoverDatabase;
import de.bsommerfeld.coversync.db.CoverQueries;
import de.bsommerfeld.coversync.db.StoreException;
import de.bsommerfeld.coversync.db.StoreLease;
import de.bsommerfeld.coversync.db.StoreTransaction;
import de.bsommerfeld.coversync.db.StoreUnavailableException;
import de.bsommerfeld.coversync.engine.ErrorCollector;
import de.bsommerfeld.coversync.engine.storage.CoverFileStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collapses byte-identical track covers within each album onto one file.
 *
 * <h3>Per album</h3>
 * <ol>
 * <li>Read the album's tracks that point at a file (short lease).</li>
 * <li>Skip albums with fewer than two such tracks or only one distinct
 * path.</li>
 * <li>Stat every distinct path and bucket by size in KiB
 * ({@link SizeBucketFilter}); hash only buckets with two or more files.</li>
 * <li>For each hash shared by two or more paths, the lexicographically
 * smallest path is kept and every track pointing at another member is
 * re-pointed to it, all in one transaction.</li>
 * <li>After a successful commit the redundant files are deleted, unless one
 * is the canonical file under another spelling or some row outside the
 * album still points at it. A file that is already gone is fine and not
 * counted.</li>
 * </ol>
 * No lease is held while files are stat'ed, hashed or deleted. Albums are
 * keyed by name, so two albums sharing a name are merged as one.
 */
@Singleton
public class DuplicateMergeEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DuplicateMergeEngine.class);

    private final CoverDatabase database;
    private final CoverFileStorage storage;
    private final ContentHasher hasher;

    @Inject
    public DuplicateMergeEngine(CoverDatabase database, CoverFileStorage storage, ContentHasher hasher) {
        this.database = database;
        this.storage = storage;
        this.hasher = hasher;
    }

    /**
     * @throws StoreException if the database lock cannot be acquired, the
     *                        album list cannot be read or a transaction cannot
     *                        be opened
     */
    public MergeResult mergeDuplicateCovers() throws StoreException {
        long start = System.currentTimeMillis();

        List<String> albums;
        try (StoreLease lease = database.acquire()) {
            albums = CoverQueries.albumNames(lease);
        }
        LOG.info("Merging duplicate covers across {} albums", albums.size());

        MergeRun run = new MergeRun(new ErrorCollector(LOG));
        for (String album : albums) {
            run.albumsProcessed++;
            mergeAlbum(album, run);
        }

        LOG.info("Merge finished in {} ms: {} albums, {} covers merged, {} saved, {} errors",
                System.currentTimeMillis() - start, run.albumsProcessed, run.coversMerged,
                ByteFormatter.format(run.spaceSavedBytes), run.errors.size());
        return new MergeResult(run.coversMerged, run.spaceSavedBytes, run.albumsProcessed, run.errors.toList());
    }

    private void mergeAlbum(String album, MergeRun run) throws StoreException {
        List<TrackCoverPointer> tracks;
        try (StoreLease lease = database.acquire()) {
            tracks = CoverQueries.albumTrackCovers(lease, album);
        } catch (StoreUnavailableException e) {
            throw e;
        } catch (StoreException e) {
            run.errors.add("Failed to read tracks of album " + album + ": " + e.getMessage());
            return;
        }

        Map<String, List<Long>> trackIdsByPath = new LinkedHashMap<>();
        for (TrackCoverPointer track : tracks) {
            if (track.state().isMergeCandidate()) {
                trackIdsByPath.computeIfAbsent(track.coverPath(), p -> new ArrayList<>()).add(track.trackId());
            }
        }
        int candidates = trackIdsByPath.values().stream().mapToInt(List::size).sum();
        if (candidates < 2 || trackIdsByPath.size() < 2) {
            return;
        }

        List<SizedCoverFile> files = new ArrayList<>();
        for (String path : trackIdsByPath.keySet()) {
            try {
                files.add(new SizedCoverFile(path, Files.size(Path.of(path))));
            } catch (IOException | InvalidPathException e) {
                run.errors.add("Failed to get metadata for " + path + ": " + e.getMessage());
            }
        }

        Map<String, List<CoverFileRecord>> byHash = new LinkedHashMap<>();
        for (List<SizedCoverFile> bucket : SizeBucketFilter.hashCandidates(files)) {
            for (SizedCoverFile file : bucket) {
                try {
                    String hash = hasher.hash(Path.of(file.path()));
                    byHash.computeIfAbsent(hash, h -> new ArrayList<>()).add(CoverFileRecord.of(file, hash));
                } catch (IOException e) {
                    run.errors.add("Failed to hash " + file.path() + ": " + e.getMessage());
                }
            }
        }

        for (List<CoverFileRecord> group : byHash.values()) {
            if (group.size() >= 2) {
                mergeGroup(album, group, trackIdsByPath, run);
            }
        }
    }

    private void mergeGroup(String album, List<CoverFileRecord> group,
                            Map<String, List<Long>> trackIdsByPath, MergeRun run) throws StoreException {
        group.sort(Comparator.comparing(CoverFileRecord::path));
        String canonical = group.get(0).path();
        List<CoverFileRecord> redundant = group.subList(1, group.size());

        Set<String> repointFailed = new HashSet<>();
        try (StoreLease lease = database.acquire();
             StoreTransaction tx = lease.beginTransaction()) {
            for (CoverFileRecord file : redundant) {
                for (Long trackId : trackIdsByPath.getOrDefault(file.path(), List.of())) {
                    try {
                        CoverQueries.updateCoverPath(tx, CoverKind.TRACK, trackId, canonical);
                    } catch (StoreException e) {
                        run.errors.add("Failed to update track " + trackId + ": " + e.getMessage());
                        repointFailed.add(file.path());
                    }
                }
            }
            try {
                tx.commit();
            } catch (StoreException e) {
                run.errors.add("Failed to commit merge for album " + album + ": " + e.getMessage());
                return;
            }
        }

        List<CoverFileRecord> deletable = new ArrayList<>();
        for (CoverFileRecord file : redundant) {
            if (repointFailed.contains(file.path())) {
                // a track still points here
                continue;
            }
            if (isSameFile(file.path(), canonical, run)) {
                continue;
            }
            deletable.add(file);
        }
        Set<String> referenced = stillReferenced(deletable, run);

        for (CoverFileRecord file : deletable) {
            if (referenced.contains(file.path())) {
                LOG.info("Keeping {}: still referenced outside album {}", file.path(), album);
                continue;
            }
            try {
                storage.deleteFile(file.path());
                run.coversMerged++;
                run.spaceSavedBytes += file.sizeBytes();
                LOG.debug("Merged {} into {}", file.path(), canonical);
            } catch (NoSuchFileException e) {
                LOG.debug("Already deleted: {}", file.path());
            } catch (IOException e) {
                run.errors.add("Failed to delete " + file.path() + ": " + e.getMessage());
            }
        }
    }

    /**
     * Two path strings may name one file (e.g. {@code covers/./tracks/1.jpg}
     * and {@code covers/tracks/1.jpg}). Such a member must never be deleted.
     * Any doubt counts as the same file.
     */
    private boolean isSameFile(String path, String canonical, MergeRun run) {
        try {
            if (Files.isSameFile(Path.of(path), Path.of(canonical))) {
                LOG.debug("{} is the same file as {}, keeping it", path, canonical);
                return true;
            }
            return false;
        } catch (NoSuchFileException e) {
            LOG.debug("Already deleted: {}", path);
            return true;
        } catch (IOException e) {
            run.errors.add("Failed to compare " + path + " with " + canonical + ": " + e.getMessage());
            return true;
        }
    }

    /**
     * Paths among {@code files} that some track or album still points at
     * after the re-point, e.g. a track of another album. A failed lookup
     * keeps the file.
     */
    private Set<String> stillReferenced(List<CoverFileRecord> files, MergeRun run) throws StoreUnavailableException {
        Set<String> referenced = new HashSet<>();
        if (files.isEmpty()) {
            return referenced;
        }
        try (StoreLease lease = database.acquire()) {
            for (CoverFileRecord file : files) {
                try {
                    if (CoverQueries.coverPathReferences(lease, file.path()) > 0) {
                        referenced.add(file.path());
                    }
                } catch (StoreException e) {
                    run.errors.add("Failed to check references of " + file.path() + ": " + e.getMessage());
                    referenced.add(file.path());
                }
            }
        }
        return referenced;
    }

    private static final class MergeRun {

        private final ErrorCollector errors;
        private int coversMerged;
        private long spaceSavedBytes;
        private int albumsProcessed;

        private MergeRun(ErrorCollector errors) {
            this.errors = errors;
        }
    }
}
