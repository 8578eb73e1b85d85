package de.bsommerfeld.coversync.core.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StorageUtilsTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearOverride() {
        System.clearProperty(StorageUtils.HOME_PROPERTY);
    }

    @Test
    void getAppDataDir_shouldContainAppNameAndBeAbsolute() {
        Path dir = StorageUtils.getAppDataDir("test-app");
        assertTrue(dir.isAbsolute());
        assertTrue(dir.toString().contains("test-app"));
    }

    @Test
    void getAppDataDir_shouldHonourHomeOverride() {
        System.setProperty(StorageUtils.HOME_PROPERTY, tempDir.toString());
        assertEquals(tempDir.toAbsolutePath(), StorageUtils.getAppDataDir());
    }

    @Test
    void getAppDataDir_shouldIgnoreBlankOverride() {
        System.setProperty(StorageUtils.HOME_PROPERTY, "  ");
        assertTrue(StorageUtils.getAppDataDir().toString().contains(StorageUtils.APP_NAME));
    }

    @Test
    void getLogsDir_shouldBeSubdirOfAppDataDir() {
        System.setProperty(StorageUtils.HOME_PROPERTY, tempDir.toString());
        assertEquals(tempDir.toAbsolutePath().resolve("logs"), StorageUtils.getLogsDir());
    }
}
