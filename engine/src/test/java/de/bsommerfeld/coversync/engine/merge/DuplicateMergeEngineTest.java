package de.bsommerfeld.coversync.engine.merge;

import de.bsommerfeld.coversync.core.domain.MergeResult;
import de.bsommerfeld.coversync.core.hash.ContentHasher;
import de.bsommerfeld.coversync.db.SqliteCoverDatabase;
import de.bsommerfeld.coversync.db.StoreException;
import de.bsommerfeld.coversync.engine.CommitFailingDatabase;
import de.bsommerfeld.coversync.engine.TestLibrary;
import de.bsommerfeld.coversync.engine.storage.CoverFileStorage;
import de.bsommerfeld.coversync.engine.storage.FileSystemCoverStorage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class DuplicateMergeEngineTest {

    private static final byte[] SHARED = TestLibrary.content(500001, 1);
    private static final byte[] OTHER = TestLibrary.content(500050, 2);

    @TempDir
    Path tempDir;

    private SqliteCoverDatabase db;
    private FileSystemCoverStorage storage;
    private ContentHasher hasher;
    private Path one;
    private Path two;
    private Path three;

    @BeforeEach
    void setUp() throws StoreException {
        db = TestLibrary.open(tempDir);
        storage = new FileSystemCoverStorage(tempDir.resolve("covers"));
        hasher = spy(new ContentHasher());
        Path tracks = storage.root().resolve("tracks");
        one = tracks.resolve("1.jpg");
        two = tracks.resolve("2.jpg");
        three = tracks.resolve("3.jpg");
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    /**
     * Tracks 1 and 2 share identical 500001-byte covers, track 3 has a
     * different 500050-byte cover in the same size bucket.
     */
    private void seedAlbumX() throws Exception {
        TestLibrary.writeFile(one, SHARED);
        TestLibrary.writeFile(two, SHARED);
        TestLibrary.writeFile(three, OTHER);
        TestLibrary.track(db, 1, "X", null, one.toString());
        TestLibrary.track(db, 2, "X", null, two.toString());
        TestLibrary.track(db, 3, "X", null, three.toString());
    }

    @Test
    void merge_shouldCollapseIdenticalCoversOntoSmallestPath() throws Exception {
        seedAlbumX();

        MergeResult result = new DuplicateMergeEngine(db, storage, hasher).mergeDuplicateCovers();

        assertEquals(1, result.coversMerged());
        assertEquals(500001, result.spaceSavedBytes());
        assertEquals(1, result.albumsProcessed());
        assertTrue(result.errors().isEmpty());
        assertEquals(one.toString(), TestLibrary.trackPath(db, 1).orElseThrow());
        assertEquals(one.toString(), TestLibrary.trackPath(db, 2).orElseThrow());
        assertEquals(three.toString(), TestLibrary.trackPath(db, 3).orElseThrow());
        assertTrue(Files.exists(one));
        assertFalse(Files.exists(two));
        assertTrue(Files.exists(three));
    }

    @Test
    void merge_shouldBeQuietOnRerun() throws Exception {
        seedAlbumX();
        DuplicateMergeEngine engine = new DuplicateMergeEngine(db, storage, hasher);
        engine.mergeDuplicateCovers();

        MergeResult second = engine.mergeDuplicateCovers();

        assertEquals(0, second.coversMerged());
        assertEquals(0, second.spaceSavedBytes());
        assertTrue(second.errors().isEmpty());
    }

    @Test
    void merge_shouldRepointEveryTrackSharingARedundantPath() throws Exception {
        seedAlbumX();
        TestLibrary.track(db, 4, "X", null, two.toString());

        MergeResult result = new DuplicateMergeEngine(db, storage, hasher).mergeDuplicateCovers();

        assertEquals(1, result.coversMerged());
        assertEquals(one.toString(), TestLibrary.trackPath(db, 4).orElseThrow());
    }

    @Test
    void merge_shouldNotHashFilesAloneInTheirSizeBucket() throws Exception {
        Path small = storage.root().resolve("tracks/10.jpg");
        Path large = storage.root().resolve("tracks/11.jpg");
        TestLibrary.writeFile(small, TestLibrary.content(1000, 5));
        TestLibrary.writeFile(large, TestLibrary.content(5000, 6));
        TestLibrary.track(db, 10, "Y", null, small.toString());
        TestLibrary.track(db, 11, "Y", null, large.toString());

        MergeResult result = new DuplicateMergeEngine(db, storage, hasher).mergeDuplicateCovers();

        assertEquals(0, result.coversMerged());
        verify(hasher, never()).hash(any(Path.class));
    }

    @Test
    void merge_shouldSkipAlbumsWithOneDistinctPath() throws Exception {
        TestLibrary.writeFile(one, SHARED);
        TestLibrary.track(db, 1, "Z", null, one.toString());
        TestLibrary.track(db, 2, "Z", null, one.toString());
        TestLibrary.track(db, 3, "Solo", null, one.toString());
        TestLibrary.track(db, 4, null, null, one.toString());

        MergeResult result = new DuplicateMergeEngine(db, storage, hasher).mergeDuplicateCovers();

        assertEquals(2, result.albumsProcessed());
        assertEquals(0, result.coversMerged());
        verify(hasher, never()).hash(any(Path.class));
    }

    @Test
    void merge_shouldSkipAlbumWithOneCoveredTrack() throws Exception {
        TestLibrary.writeFile(one, SHARED);
        TestLibrary.track(db, 1, "W", null, one.toString());
        TestLibrary.track(db, 2, "W", SHARED, null);
        TestLibrary.track(db, 3, "W", null, "");

        MergeResult result = new DuplicateMergeEngine(db, storage, hasher).mergeDuplicateCovers();

        assertEquals(1, result.albumsProcessed());
        assertEquals(0, result.coversMerged());
        verify(hasher, never()).hash(any(Path.class));
    }

    @Test
    void merge_shouldNeverDeleteTheKeptFileUnderAnotherSpelling() throws Exception {
        TestLibrary.writeFile(one, SHARED);
        Path sameFile = storage.root().resolve(".").resolve("tracks").resolve("1.jpg");
        TestLibrary.track(db, 1, "X", null, one.toString());
        TestLibrary.track(db, 2, "X", null, sameFile.toString());

        MergeResult result = new DuplicateMergeEngine(db, storage, hasher).mergeDuplicateCovers();

        assertEquals(0, result.coversMerged());
        assertEquals(0, result.spaceSavedBytes());
        assertTrue(result.errors().isEmpty());
        assertTrue(Files.exists(one));
        assertTrue(Files.exists(Path.of(TestLibrary.trackPath(db, 1).orElseThrow())));
        assertTrue(Files.exists(Path.of(TestLibrary.trackPath(db, 2).orElseThrow())));
    }

    @Test
    void merge_shouldKeepFileStillReferencedByAnotherAlbum() throws Exception {
        seedAlbumX();
        TestLibrary.track(db, 4, "Y", null, two.toString());

        MergeResult result = new DuplicateMergeEngine(db, storage, hasher).mergeDuplicateCovers();

        assertEquals(2, result.albumsProcessed());
        assertEquals(0, result.coversMerged());
        assertTrue(result.errors().isEmpty());
        assertEquals(one.toString(), TestLibrary.trackPath(db, 2).orElseThrow());
        assertEquals(two.toString(), TestLibrary.trackPath(db, 4).orElseThrow());
        assertTrue(Files.exists(two));
    }

    @Test
    void merge_shouldKeepFileStillReferencedByTrackWithoutAlbum() throws Exception {
        seedAlbumX();
        TestLibrary.track(db, 5, null, null, two.toString());

        MergeResult result = new DuplicateMergeEngine(db, storage, hasher).mergeDuplicateCovers();

        assertEquals(0, result.coversMerged());
        assertTrue(Files.exists(two));
        assertEquals(two.toString(), TestLibrary.trackPath(db, 5).orElseThrow());
    }

    @Test
    void merge_shouldKeepFileStillUsedAsAlbumArt() throws Exception {
        seedAlbumX();
        TestLibrary.album(db, 1, "X", null, two.toString());

        MergeResult result = new DuplicateMergeEngine(db, storage, hasher).mergeDuplicateCovers();

        assertEquals(0, result.coversMerged());
        assertTrue(Files.exists(two));
    }

    @Test
    void merge_shouldRecordMissingFileAndContinue() throws Exception {
        seedAlbumX();
        Files.delete(three);

        MergeResult result = new DuplicateMergeEngine(db, storage, hasher).mergeDuplicateCovers();

        assertEquals(1, result.coversMerged());
        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).startsWith("Failed to get metadata for " + three));
    }

    @Test
    void merge_shouldRecordHashFailureAndDropTheFile() throws Exception {
        seedAlbumX();
        doThrow(new IOException("read error")).when(hasher).hash(two);

        MergeResult result = new DuplicateMergeEngine(db, storage, hasher).mergeDuplicateCovers();

        assertEquals(0, result.coversMerged());
        assertEquals("Failed to hash " + two + ": read error", result.errors().get(0));
        assertTrue(Files.exists(two));
        assertEquals(two.toString(), TestLibrary.trackPath(db, 2).orElseThrow());
    }

    @Test
    void merge_shouldNotDeleteAnythingWhenCommitFails() throws Exception {
        seedAlbumX();
        CoverFileStorage files = spy(storage);

        MergeResult result = new DuplicateMergeEngine(new CommitFailingDatabase(db), files, hasher)
                .mergeDuplicateCovers();

        assertEquals(0, result.coversMerged());
        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).startsWith("Failed to commit merge for album X"));
        verify(files, never()).deleteFile(any());
        assertTrue(Files.exists(two));
        assertEquals(two.toString(), TestLibrary.trackPath(db, 2).orElseThrow());
    }

    @Test
    void merge_shouldKeepFileWhoseTrackCouldNotBeRepointed() throws Exception {
        seedAlbumX();
        TestLibrary.failUpdatesOfTrack(db, 2);

        MergeResult result = new DuplicateMergeEngine(db, storage, hasher).mergeDuplicateCovers();

        assertEquals(0, result.coversMerged());
        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).startsWith("Failed to update track 2"));
        assertTrue(Files.exists(two));
    }

    @Test
    void merge_shouldTreatAlreadyDeletedFileAsSuccessWithoutCounting() throws Exception {
        seedAlbumX();
        CoverFileStorage files = spy(storage);
        doThrow(new NoSuchFileException(two.toString())).when(files).deleteFile(two.toString());

        MergeResult result = new DuplicateMergeEngine(db, files, hasher).mergeDuplicateCovers();

        assertEquals(0, result.coversMerged());
        assertEquals(0, result.spaceSavedBytes());
        assertTrue(result.errors().isEmpty());
        assertEquals(one.toString(), TestLibrary.trackPath(db, 2).orElseThrow());
    }

    @Test
    void merge_shouldRecordOtherDeleteFailures() throws Exception {
        seedAlbumX();
        CoverFileStorage files = spy(storage);
        doThrow(new AccessDeniedException(two.toString())).when(files).deleteFile(two.toString());

        MergeResult result = new DuplicateMergeEngine(db, files, hasher).mergeDuplicateCovers();

        assertEquals(0, result.coversMerged());
        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).startsWith("Failed to delete " + two));
    }

    @Test
    void merge_shouldKeepAlbumsApart() throws Exception {
        Path a = storage.root().resolve("tracks/20.jpg");
        Path b = storage.root().resolve("tracks/21.jpg");
        TestLibrary.writeFile(a, SHARED);
        TestLibrary.writeFile(b, SHARED);
        TestLibrary.track(db, 20, "First", null, a.toString());
        TestLibrary.track(db, 21, "Second", null, b.toString());

        MergeResult result = new DuplicateMergeEngine(db, storage, hasher).mergeDuplicateCovers();

        assertEquals(2, result.albumsProcessed());
        assertEquals(0, result.coversMerged());
        assertTrue(Files.exists(a));
        assertTrue(Files.exists(b));
    }
}
