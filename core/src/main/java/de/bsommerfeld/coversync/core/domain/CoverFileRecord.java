package de.bsommerfeld.coversync.core.domain;

/**
 * A hashed cover file. Computed on demand while merging duplicates and never
 * persisted.
 *
 * @param path        path string exactly as stored in the database
 * @param sizeBytes   file size in bytes
 * @param contentHash hex SHA-256 of the file content
 */
public record CoverFileRecord(String path, long sizeBytes, String contentHash) {

    public static CoverFileRecord of(SizedCoverFile file, String contentHash) {
        return new CoverFileRecord(file.path(), file.sizeBytes(), contentHash);
    }
}
