package de.bsommerfeld.coversync.engine.storage;

import de.bsommerfeld.coversync.core.domain.CoverKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes covers to {@code <root>/tracks/<id>.<ext>} and
 * {@code <root>/albums/<id>.<ext>}. The payload is written to a temporary
 * file next to the target and then moved over it, so a reader never sees a
 * half-written cover.
 */
public class FileSystemCoverStorage implements CoverFileStorage {

    private static final Logger LOG = LoggerFactory.getLogger(FileSystemCoverStorage.class);

    private final Path root;

    public FileSystemCoverStorage(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public Path root() {
        return root;
    }

    @Override
    public String saveTrackCover(long trackId, byte[] bytes) throws IOException {
        return write(CoverKind.TRACK, trackId, bytes);
    }

    @Override
    public String saveAlbumArt(long albumId, byte[] bytes) throws IOException {
        return write(CoverKind.ALBUM, albumId, bytes);
    }

    @Override
    public void deleteFile(String path) throws IOException {
        if (path == null || path.isEmpty()) {
            return;
        }
        Files.delete(Path.of(path));
        LOG.debug("Deleted cover file {}", path);
    }

    private String write(CoverKind kind, long ownerId, byte[] bytes) throws IOException {
        if (bytes == null || bytes.length == 0) {
            throw new IOException("Refusing to write empty " + kind.label() + " cover for id " + ownerId);
        }
        Path dir = root.resolve(kind.directoryName());
        Files.createDirectories(dir);

        Path target = dir.resolve(ownerId + "." + ImageFormat.sniff(bytes).extension());
        Path tmp = Files.createTempFile(dir, ownerId + "-", ".tmp");
        try {
            Files.write(tmp, bytes);
            move(tmp, target);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanupFailure) {
                e.addSuppressed(cleanupFailure);
            }
            throw e;
        }
        LOG.debug("Wrote {} cover {} ({} bytes)", kind.label(), target, bytes.length);
        return target.toString();
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
