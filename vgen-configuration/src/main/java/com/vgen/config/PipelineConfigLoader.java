package com.vgen.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link PipelineConfig} from a JSON or indented-config file. When the file does not exist, a
 * sample with all defaults is written to that path first and then loaded.
 */
public final class PipelineConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfigLoader.class);

    /** Classpath resource holding the sample configuration. */
    public static final String DEFAULT_CONFIG_RESOURCE = "vgen/default-config.yaml";

    public static final String DEFAULT_CONFIG_PATH = "tool/variants_config.yaml";

    private PipelineConfigLoader() {
    }

    /**
     * @param path config file; created with defaults when missing
     * @return parsed configuration (never null)
     * @throws ConfigParseException when the file exists but cannot be parsed
     */
    public static PipelineConfig load(Path path) {
        if (!Files.exists(path)) {
            log.info("Config not found at {}; writing a sample with defaults", path);
            writeDefaultConfig(path);
        }
        ConfigValue root = ConfigDocuments.read(path);
        if (root.kind() != ConfigValue.Kind.MAP) {
            throw new ConfigParseException(0, "Config root in " + path + " must be a map");
        }
        PipelineConfig config = PipelineConfig.from(root);
        log.info("Pipeline configuration loaded from {} (provider={}, mock={})",
                path, config.getProvider().getName(), config.isMockGeneration());
        return config;
    }

    static void writeDefaultConfig(Path path) {
        try (InputStream in = PipelineConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULT_CONFIG_RESOURCE);
            }
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(path, in.readAllBytes());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write sample config to " + path, e);
        }
    }
}
