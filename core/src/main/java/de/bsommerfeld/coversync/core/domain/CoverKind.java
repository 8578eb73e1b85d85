package de.bsommerfeld.coversync.core.domain;

/**
 * The two owners a cover can belong to. Tracks and albums are handled
 * symmetrically by every engine; this enum carries the per-kind naming so the
 * engines do not have to branch on it.
 */
public enum CoverKind {

    TRACK("track", "tracks"),
    ALBUM("album", "albums");

    private final String label;
    private final String directoryName;

    CoverKind(String label, String directoryName) {
        this.label = label;
        this.directoryName = directoryName;
    }

    /**
     * Singular lower-case name used in log lines and error messages
     * (e.g. {@code "Failed to save track 12 cover"}).
     */
    public String label() {
        return label;
    }

    /**
     * Subdirectory below the covers root that holds files of this kind.
     */
    public String directoryName() {
        return directoryName;
    }
}
