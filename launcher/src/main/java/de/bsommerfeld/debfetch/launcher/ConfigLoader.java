package de.bsommerfeld.debfetch.launcher;

import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link FetcherConfig} from a TOML file. A missing file is not an
 * error: the defaults apply.
 */
final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    static final String DEFAULT_FILE_NAME = "debfetch.toml";

    private static final TomlMapper MAPPER = new TomlMapper();

    private ConfigLoader() {
    }

    /**
     * @throws IOException if the file exists but cannot be read or parsed
     */
    static FetcherConfig load(Path configPath) throws IOException {
        if (configPath == null || !Files.exists(configPath)) {
            LOG.debug("No configuration at {}, using defaults", configPath);
            return new FetcherConfig();
        }
        LOG.info("Loading configuration from: {}", configPath.toAbsolutePath());
        FetcherConfig config = MAPPER.readValue(configPath.toFile(), FetcherConfig.class);
        return config != null ? config : new FetcherConfig();
    }

    /** Returns {@code $XDG_CONFIG_HOME/debfetch/debfetch.toml} or its {@code ~/.config} fallback. */
    static Path defaultLocation() {
        String xdg = System.getenv("XDG_CONFIG_HOME");
        Path base = xdg != null && !xdg.isEmpty()
                ? Path.of(xdg)
                : Path.of(System.getProperty("user.home"), ".config");
        return base.resolve("debfetch").resolve(DEFAULT_FILE_NAME);
    }
}
