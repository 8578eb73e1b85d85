package de.bsommerfeld.coversync.core.domain;

/**
 * A cover file whose size has been read from disk but which has not been
 * hashed yet.
 *
 * @param path      path string exactly as stored in the database
 * @param sizeBytes file size at the time of the stat call
 */
public record SizedCoverFile(String path, long sizeBytes) {
}
