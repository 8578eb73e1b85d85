package de.bsommerfeld.coversync.engine.cleanup;

import de.bsommerfeld.coversync.db.SqliteCoverDatabase;
import de.bsommerfeld.coversync.db.StoreException;
import de.bsommerfeld.coversync.engine.TestLibrary;
import de.bsommerfeld.coversync.engine.storage.FileSystemCoverStorage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class OrphanCoverSweeperTest {

    private static final byte[] COVER = TestLibrary.content(64, 9);

    @TempDir
    Path tempDir;

    private SqliteCoverDatabase db;
    private FileSystemCoverStorage storage;

    @BeforeEach
    void setUp() throws StoreException {
        db = TestLibrary.open(tempDir);
        storage = new FileSystemCoverStorage(tempDir.resolve("covers"));
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void sweep_shouldDeleteOnlyUnreferencedFiles() throws Exception {
        Path kept = TestLibrary.writeFile(storage.root().resolve("tracks/1.jpg"), COVER);
        Path keptAlbum = TestLibrary.writeFile(storage.root().resolve("albums/1.png"), COVER);
        Path orphan = TestLibrary.writeFile(storage.root().resolve("tracks/2.jpg"), COVER);
        Path orphanAlbum = TestLibrary.writeFile(storage.root().resolve("albums/9.jpg"), COVER);
        Path outside = TestLibrary.writeFile(storage.root().resolve("notes.txt"), COVER);
        TestLibrary.track(db, 1, "A", null, kept.toString());
        TestLibrary.album(db, 1, "A", null, keptAlbum.toString());

        int deleted = new OrphanCoverSweeper(db, storage).sweep();

        assertEquals(2, deleted);
        assertTrue(Files.exists(kept));
        assertTrue(Files.exists(keptAlbum));
        assertFalse(Files.exists(orphan));
        assertFalse(Files.exists(orphanAlbum));
        assertTrue(Files.exists(outside));
    }

    @Test
    void sweep_shouldMatchReferencesThatAreNotNormalized() throws Exception {
        Path kept = TestLibrary.writeFile(storage.root().resolve("tracks/1.jpg"), COVER);
        TestLibrary.track(db, 1, "A", null, storage.root().resolve("tracks/../tracks/1.jpg").toString());

        assertEquals(0, new OrphanCoverSweeper(db, storage).sweep());
        assertTrue(Files.exists(kept));
    }

    @Test
    void sweep_shouldReturnZeroWithoutCoverDirectories() throws StoreException {
        assertEquals(0, new OrphanCoverSweeper(db, storage).sweep());
    }
}
