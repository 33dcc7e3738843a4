package de.bsommerfeld.provisioner.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link ProvisionerConfig} as TOML.
 *
 * <p>
 * A missing file is created with the defaults so the user has something to
 * edit; unknown keys are ignored so older binaries accept newer files.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private ConfigLoader() {
    }

    /**
     * Loads the configuration at {@code path}, writing defaults first if the
     * file does not exist yet.
     *
     * @throws UncheckedIOException if the file exists but cannot be parsed
     */
    public static ProvisionerConfig load(Path path) {
        if (!Files.exists(path)) {
            ProvisionerConfig defaults = new ProvisionerConfig();
            try {
                save(defaults, path);
                LOG.info("Wrote default configuration to {}", path.toAbsolutePath());
            } catch (UncheckedIOException e) {
                LOG.warn("Could not write default configuration to {}: {}", path, e.getMessage());
            }
            return defaults;
        }

        LOG.info("Loading configuration from {}", path.toAbsolutePath());
        try {
            return MAPPER.readValue(path.toFile(), ProvisionerConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse configuration " + path, e);
        }
    }

    public static void save(ProvisionerConfig config, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writeValue(path.toFile(), config);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write configuration " + path, e);
        }
    }
}
