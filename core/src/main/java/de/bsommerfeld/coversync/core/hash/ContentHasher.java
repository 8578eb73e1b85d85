package de.bsommerfeld.coversync.core.hash;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 content fingerprinting for cover files. Reads through a fixed
 * 64 KiB buffer so memory use does not grow with the file size.
 *
 * <p>
 * The digest covers the byte content only. Path, timestamps and permissions
 * never influence it, so two files with identical bytes always hash equal.
 */
public class ContentHasher {

    private static final String ALGORITHM = "SHA-256";
    static final int BUFFER_SIZE = 64 * 1024;

    /**
     * Computes the lower-case hex SHA-256 of the given file.
     *
     * @throws IOException if the file cannot be opened or read
     */
    public String hash(Path file) throws IOException {
        MessageDigest digest = newDigest();
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // every JVM ships SHA-256
            throw new AssertionError(ALGORITHM + " not available", e);
        }
    }
}
