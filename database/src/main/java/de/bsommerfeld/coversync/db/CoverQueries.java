package de.bsommerfeld.coversync.db;

import de.bsommerfeld.coversync.core.domain.CoverKind;
import de.bsommerfeld.coversync.core.domain.InlineCover;
import de.bsommerfeld.coversync.core.domain.TrackCoverPointer;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Typed access to the cover columns of {@code tracks} and {@code albums}.
 * Every method runs on a lease or transaction the caller already holds; none
 * of them acquires the lock itself.
 */
public final class CoverQueries {

    private CoverQueries() {
    }

    /**
     * Rows of the given kind that still carry an inline payload and have no
     * path pointer yet. Undecodable payloads are returned as
     * {@link InlineCover#undecodable} so the caller can report them.
     */
    public static List<InlineCover> pendingMigration(StoreLease lease, CoverKind kind) throws StoreException {
        String sql = SqlLoader.load(kind == CoverKind.TRACK
                ? "select-tracks-pending-migration"
                : "select-albums-pending-migration");
        return lease.query(sql, rs -> {
            long id = rs.getLong(1);
            Object raw = rs.getObject(2);
            String path = rs.getString(3);
            try {
                return InlineCover.decoded(kind, id, path, InlinePayloadDecoder.decode(raw));
            } catch (IllegalArgumentException e) {
                return InlineCover.undecodable(kind, id, path, e.getMessage());
            }
        });
    }

    /**
     * Points a track or album at a cover file.
     *
     * @return rows affected; zero when no row has that id
     */
    public static int updateCoverPath(SqlExecutor executor, CoverKind kind, long id, String path)
            throws StoreException {
        String sql = SqlLoader.load(kind == CoverKind.TRACK
                ? "update-track-cover-path"
                : "update-album-art-path");
        return executor.execute(sql, path, id);
    }

    /**
     * Distinct non-null album names across all tracks, ordered by name.
     */
    public static List<String> albumNames(StoreLease lease) throws StoreException {
        return lease.query(SqlLoader.load("select-album-names"), rs -> rs.getString(1));
    }

    /**
     * Tracks of one album that carry a non-empty cover path.
     */
    public static List<TrackCoverPointer> albumTrackCovers(StoreLease lease, String album) throws StoreException {
        return lease.query(SqlLoader.load("select-album-track-covers"),
                rs -> new TrackCoverPointer(rs.getLong(1), rs.getString(2), rs.getInt(3) != 0),
                album);
    }

    /**
     * Drops the inline payload of every row of the given kind that already has
     * a path pointer.
     *
     * @return rows cleared
     */
    public static int clearInline(SqlExecutor executor, CoverKind kind) throws StoreException {
        return executor.execute(SqlLoader.load(kind == CoverKind.TRACK
                ? "clear-track-inline-covers"
                : "clear-album-inline-art"));
    }

    public static Optional<String> coverPath(StoreLease lease, CoverKind kind, long id) throws StoreException {
        String sql = SqlLoader.load(kind == CoverKind.TRACK
                ? "select-track-cover-path"
                : "select-album-art-path");
        return lease.queryFirst(sql, rs -> rs.getString(1), id);
    }

    /**
     * Cover paths for the given track ids. Ids without a path are absent from
     * the returned map.
     */
    public static Map<Long, String> trackCoverPaths(StoreLease lease, Collection<Long> trackIds)
            throws StoreException {
        if (trackIds.isEmpty()) {
            return Collections.emptyMap();
        }
        String placeholders = trackIds.stream().map(id -> "?").collect(Collectors.joining(", "));
        String sql = String.format(SqlLoader.load("select-track-cover-paths-in"), placeholders);

        List<Map.Entry<Long, String>> rows = lease.query(sql,
                rs -> Map.entry(rs.getLong(1), rs.getString(2)), trackIds.toArray());
        Map<Long, String> paths = new LinkedHashMap<>();
        rows.forEach(row -> paths.put(row.getKey(), row.getValue()));
        return paths;
    }

    /**
     * Number of tracks and albums whose pointer equals {@code path} exactly.
     */
    public static int coverPathReferences(StoreLease lease, String path) throws StoreException {
        return lease.queryFirst(SqlLoader.load("select-cover-path-references"), rs -> rs.getInt(1), path, path)
                .orElse(0);
    }

    /**
     * Every path referenced by any track or album.
     */
    public static Set<String> referencedCoverPaths(StoreLease lease) throws StoreException {
        return new HashSet<>(lease.query(SqlLoader.load("select-referenced-cover-paths"), rs -> rs.getString(1)));
    }
}
