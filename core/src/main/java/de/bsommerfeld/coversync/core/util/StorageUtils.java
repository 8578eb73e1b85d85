package de.bsommerfeld.coversync.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves where the library database, the cover files and the logs live.
 * Follows each platform's conventions for per-user application data:
 * <ul>
 * <li><strong>macOS</strong>:
 * {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}} (fallback:
 * {@code ~/AppData/Roaming})</li>
 * <li><strong>Linux</strong>: {@code $XDG_DATA_HOME/{appName}} (fallback:
 * {@code ~/.local/share})</li>
 * </ul>
 * The system property {@value #HOME_PROPERTY} overrides all of the above,
 * which is how the command-line runner is pointed at a different library.
 * Paths are returned but never created.
 */
public final class StorageUtils {

    public static final String APP_NAME = "cover-sync";
    public static final String HOME_PROPERTY = "cover-sync.home";

    private StorageUtils() {
    }

    /**
     * Returns the data directory for {@link #APP_NAME}, honouring the
     * {@value #HOME_PROPERTY} override.
     */
    public static Path getAppDataDir() {
        String override = System.getProperty(HOME_PROPERTY);
        if (override != null && !override.isBlank()) {
            return Paths.get(override).toAbsolutePath();
        }
        return getAppDataDir(APP_NAME);
    }

    /**
     * Returns the platform-specific data directory for the given app name.
     */
    public static Path getAppDataDir(String appName) {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);

        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get(System.getProperty("user.home"), "Library", "Application Support", appName);
        }
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData != null) {
                return Paths.get(appData, appName);
            }
            return Paths.get(System.getProperty("user.home"), "AppData", "Roaming", appName);
        }
        String xdgData = System.getenv("XDG_DATA_HOME");
        if (xdgData != null && !xdgData.isEmpty()) {
            return Paths.get(xdgData, appName);
        }
        return Paths.get(System.getProperty("user.home"), ".local", "share", appName);
    }

    /**
     * Returns {@code {appDataDir}/logs}.
     */
    public static Path getLogsDir() {
        return getAppDataDir().resolve("logs");
    }
}
