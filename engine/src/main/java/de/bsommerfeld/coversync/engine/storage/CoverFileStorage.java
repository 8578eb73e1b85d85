package de.bsommerfeld.coversync.engine.storage;

import de.bsommerfeld.coversync.core.domain.CoverKind;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Persists cover payloads as files under a deterministic name and deletes
 * them by path. The engines never build file names themselves.
 */
public interface CoverFileStorage {

    /**
     * Directory containing the {@code tracks/} and {@code albums/}
     * subdirectories.
     */
    Path root();

    /**
     * Writes the cover of a track.
     *
     * @return the path string to store as the track's pointer
     */
    String saveTrackCover(long trackId, byte[] bytes) throws IOException;

    /**
     * Writes the art of an album.
     *
     * @return the path string to store as the album's pointer
     */
    String saveAlbumArt(long albumId, byte[] bytes) throws IOException;

    /**
     * Deletes a cover file. {@code null} or empty paths are ignored.
     *
     * @throws java.nio.file.NoSuchFileException if the file is already gone
     */
    void deleteFile(String path) throws IOException;

    default String save(CoverKind kind, long ownerId, byte[] bytes) throws IOException {
        return kind == CoverKind.TRACK
                ? saveTrackCover(ownerId, bytes)
                : saveAlbumArt(ownerId, bytes);
    }
}
