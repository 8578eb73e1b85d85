package de.bsommerfeld.coversync.core.config;

import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link CoverSyncConfig} from a TOML file. A missing file is created
 * with the defaults so users have something to edit.
 */
public final class CoverSyncConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(CoverSyncConfigLoader.class);
    private static final TomlMapper MAPPER = new TomlMapper();

    private CoverSyncConfigLoader() {
    }

    /**
     * @param configFile location of {@code config.toml}
     * @return the parsed configuration, or the defaults if the file did not
     *         exist yet
     * @throws IOException if the file exists but cannot be parsed, or the
     *                     defaults cannot be written
     */
    public static CoverSyncConfig load(Path configFile) throws IOException {
        if (!Files.exists(configFile)) {
            CoverSyncConfig defaults = new CoverSyncConfig();
            Path parent = configFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writeValue(configFile.toFile(), defaults);
            LOG.info("Wrote default configuration to {}", configFile);
            return defaults;
        }
        LOG.info("Loading configuration from {}", configFile);
        return MAPPER.readValue(configFile.toFile(), CoverSyncConfig.class);
    }
}
