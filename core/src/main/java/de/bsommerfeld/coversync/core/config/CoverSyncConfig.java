package de.bsommerfeld.coversync.core.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings for the cover maintenance runner, persisted as {@code config.toml}
 * in the application data directory. Relative paths are resolved against that
 * directory.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CoverSyncConfig {

    @JsonProperty("database-file")
    private String databaseFile = "library.db";

    @JsonProperty("covers-dir")
    private String coversDir = "covers";

    @JsonProperty("lock-timeout-seconds")
    private int lockTimeoutSeconds = 30;

    @JsonProperty("debug-mode")
    private boolean debugMode = false;

    public String getDatabaseFile() {
        return databaseFile;
    }

    public void setDatabaseFile(String databaseFile) {
        this.databaseFile = databaseFile;
    }

    public String getCoversDir() {
        return coversDir;
    }

    public void setCoversDir(String coversDir) {
        this.coversDir = coversDir;
    }

    public int getLockTimeoutSeconds() {
        return lockTimeoutSeconds;
    }

    public void setLockTimeoutSeconds(int lockTimeoutSeconds) {
        this.lockTimeoutSeconds = lockTimeoutSeconds;
    }

    public boolean isDebugMode() {
        return debugMode;
    }

    public void setDebugMode(boolean debugMode) {
        this.debugMode = debugMode;
    }

    @JsonIgnore
    public Path resolveDatabaseFile(Path appDataDir) {
        return appDataDir.resolve(databaseFile).toAbsolutePath().normalize();
    }

    @JsonIgnore
    public Path resolveCoversDir(Path appDataDir) {
        return appDataDir.resolve(coversDir).toAbsolutePath().normalize();
    }

    /**
     * Lock wait as a {@link Duration}. Non-positive values fall back to one
     * second so a misconfigured file cannot turn every run into a fatal
     * lock failure.
     */
    @JsonIgnore
    public Duration lockTimeout() {
        return Duration.ofSeconds(Math.max(1, lockTimeoutSeconds));
    }
}
