package config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves the server configuration: the editable file on disk first, then the
 * copy packed in resources, then built-in defaults. When no file exists on disk
 * the resolved config is written there so operators have something to edit.
 */
public final class ConfigManager {
    private static final Logger log = LoggerFactory.getLogger(ConfigManager.class);

    public static final String FILE_NAME = "serverConfig.json";

    private final Path diskPath;

    public ConfigManager() {
        this(Paths.get(FILE_NAME));
    }

    public ConfigManager(Path diskPath) {
        this.diskPath = diskPath;
    }

    public ServerConfig load() {
        if (Files.exists(diskPath)) {
            try {
                return ConfigLoader.load(diskPath);
            } catch (IOException e) {
                log.warn("Failed to load {} ({}); falling back to packaged defaults", diskPath, e.getMessage());
                return loadFromClasspath();
            }
        }

        ServerConfig cfg = loadFromClasspath();
        try {
            ConfigLoader.save(cfg, diskPath);
            log.info("Created default {}", diskPath.toAbsolutePath());
            log.info("Set max_players to 0 for unlimited players (requires a partnership token file)");
        } catch (IOException e) {
            log.warn("Could not write default config to {}: {}", diskPath, e.getMessage());
        }
        return cfg;
    }

    private static ServerConfig loadFromClasspath() {
        try (InputStream in = resource(FILE_NAME)) {
            if (in != null) return ConfigLoader.load(in);
        } catch (IOException e) {
            log.warn("Packaged {} is unreadable: {}", FILE_NAME, e.getMessage());
        }
        return ServerConfig.defaults();
    }

    private static InputStream resource(String name) {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        InputStream in = (cl != null) ? cl.getResourceAsStream(name) : null;
        return (in != null) ? in : ConfigManager.class.getClassLoader().getResourceAsStream(name);
    }
}
