package de.bsommerfeld.coversync.engine.lookup;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.coversync.core.domain.CoverKind;
import de.bsommerfeld.coversync.db.CoverDatabase;
import de.bsommerfeld.coversync.db.CoverQueries;
import de.bsommerfeld.coversync.db.StoreException;
import de.bsommerfeld.coversync.db.StoreLease;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only access to cover pointers for the player and the library views.
 */
@Singleton
public class CoverLookupService {

    static final int BATCH_SIZE = 500;

    private final CoverDatabase database;

    @Inject
    public CoverLookupService(CoverDatabase database) {
        this.database = database;
    }

    public Optional<String> trackCoverPath(long trackId) throws StoreException {
        try (StoreLease lease = database.acquire()) {
            return CoverQueries.coverPath(lease, CoverKind.TRACK, trackId);
        }
    }

    public Optional<String> albumArtPath(long albumId) throws StoreException {
        try (StoreLease lease = database.acquire()) {
            return CoverQueries.coverPath(lease, CoverKind.ALBUM, albumId);
        }
    }

    /**
     * Cover paths of several tracks under one lease, queried in chunks of
     * {@value #BATCH_SIZE} ids to stay below SQLite's bound-parameter limit.
     * Tracks without a cover are missing from the result.
     */
    public Map<Long, String> batchCoverPaths(Collection<Long> trackIds) throws StoreException {
        if (trackIds.isEmpty()) {
            return Collections.emptyMap();
        }
        List<Long> ids = new ArrayList<>(new LinkedHashSet<>(trackIds));
        Map<Long, String> paths = new LinkedHashMap<>();
        try (StoreLease lease = database.acquire()) {
            for (int from = 0; from < ids.size(); from += BATCH_SIZE) {
                List<Long> chunk = ids.subList(from, Math.min(from + BATCH_SIZE, ids.size()));
                paths.putAll(CoverQueries.trackCoverPaths(lease, chunk));
            }
        }
        return paths;
    }
}
