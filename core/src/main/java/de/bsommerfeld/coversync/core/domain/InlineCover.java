package de.bsommerfeld.coversync.core.domain;

/**
 * An inline cover payload read from the store, awaiting migration to a file.
 *
 * <p>
 * Legacy rows may hold text that is not valid base64. Such rows are still
 * returned so the migration can count and report them; {@link #payload()} is
 * {@code null} and {@link #decodeFailure()} names the problem.
 *
 * @param kind          owner kind
 * @param ownerId       track or album id
 * @param coverPath     path pointer as read, {@code null} or empty when the
 *                      row has none
 * @param payload       raw image bytes, {@code null} if undecodable
 * @param decodeFailure reason the payload could not be decoded, {@code null}
 *                      when decodable
 */
public record InlineCover(CoverKind kind, long ownerId, String coverPath, byte[] payload, String decodeFailure) {

    public static InlineCover decoded(CoverKind kind, long ownerId, String coverPath, byte[] payload) {
        return new InlineCover(kind, ownerId, coverPath, payload, null);
    }

    public static InlineCover undecodable(CoverKind kind, long ownerId, String coverPath, String reason) {
        return new InlineCover(kind, ownerId, coverPath, null, reason);
    }

    /**
     * State of the row at selection time. The payload is present either way;
     * an undecodable one is still an inline payload.
     */
    public CoverState state() {
        return CoverState.of(true, coverPath);
    }

    public boolean isDecodable() {
        return payload != null;
    }
}
