package de.bsommerfeld.coversync.core.domain;

/**
 * A track's cover pointer as seen by the duplicate merge.
 *
 * @param trackId   track id
 * @param coverPath stored {@code track_cover_path}
 * @param hasInline whether the legacy inline payload is still present
 */
public record TrackCoverPointer(long trackId, String coverPath, boolean hasInline) {

    public CoverState state() {
        return CoverState.of(hasInline, coverPath);
    }
}
