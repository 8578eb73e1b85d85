package de.bsommerfeld.coversync.engine;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.coversync.core.config.CoverSyncConfig;
import de.bsommerfeld.coversync.core.config.CoverSyncConfigLoader;
import de.bsommerfeld.coversync.db.CoverDatabase;
import de.bsommerfeld.coversync.db.SqliteCoverDatabase;
import de.bsommerfeld.coversync.db.StoreException;
import de.bsommerfeld.coversync.engine.storage.CoverFileStorage;
import de.bsommerfeld.coversync.engine.storage.FileSystemCoverStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Guice wiring for the cover engines. Loads {@code config.toml} from the
 * application data directory and binds the database and file storage it
 * describes; the engines themselves are just-in-time singletons.
 */
public class CoverSyncModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(CoverSyncModule.class);

    private final Path appDataDir;

    public CoverSyncModule(Path appDataDir) {
        this.appDataDir = appDataDir;
    }

    @Override
    protected void configure() {
        try {
            Files.createDirectories(appDataDir);
            Path configPath = appDataDir.resolve("config.toml");
            LOG.info("Loading configuration from: {}", configPath.toAbsolutePath());
            bind(CoverSyncConfig.class).toInstance(CoverSyncConfigLoader.load(configPath));
        } catch (IOException e) {
            // config is vital, fail fast
            throw new IllegalStateException("Failed to load configuration from " + appDataDir, e);
        }
    }

    @Provides
    @Singleton
    CoverDatabase provideDatabase(CoverSyncConfig config) throws IOException, StoreException {
        Path dbFile = config.resolveDatabaseFile(appDataDir);
        Files.createDirectories(dbFile.getParent());
        return new SqliteCoverDatabase(dbFile, config.lockTimeout());
    }

    @Provides
    @Singleton
    CoverFileStorage provideStorage(CoverSyncConfig config) {
        return new FileSystemCoverStorage(config.resolveCoversDir(appDataDir));
    }
}
