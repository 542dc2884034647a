// src/main/java/config/ConfigLoader.java
package config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads and writes serverConfig.json. Missing keys fall back to {@link ServerConfig#defaults()}. */
public final class ConfigLoader {
    private static final ObjectMapper M = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

    public static ServerConfig load(Path json) throws IOException {
        return loadFromBytes(Files.readAllBytes(json));
    }

    public static ServerConfig load(InputStream in) throws IOException {
        return loadFromBytes(in.readAllBytes());
    }

    public static void save(ServerConfig cfg, Path out) throws IOException {
        Path parent = out.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.write(out, M.writerWithDefaultPrettyPrinter().writeValueAsBytes(cfg));
    }

    private static ServerConfig loadFromBytes(byte[] data) throws IOException {
        JsonNode root = M.readTree(data);
        if (root == null || !root.isObject()) {
            throw new IOException("config root must be a JSON object");
        }
        // overlay the file onto the defaults so partial files still work
        ObjectNode merged = M.valueToTree(ServerConfig.defaults());
        merged.setAll((ObjectNode) root);
        return M.treeToValue(merged, ServerConfig.class).normalized();
    }

    private ConfigLoader() {}
}
