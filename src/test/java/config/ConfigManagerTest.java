package config;

import common.Difficulty;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigManagerTest {

    @TempDir
    Path dir;

    @Test
    void missingFileIsCreatedFromPackagedDefaults() throws IOException {
        Path file = dir.resolve("serverConfig.json");

        ServerConfig cfg = new ConfigManager(file).load();

        assertTrue(Files.exists(file));
        assertEquals(5555, cfg.port());
        assertEquals(4, cfg.maxPlayers());
        assertEquals(Difficulty.MEDIUM, cfg.initialDifficulty());
        assertEquals(cfg, ConfigLoader.load(file), "written file reads back the same");
        assertTrue(Files.readString(file).contains("\"max_players\""));
    }

    @Test
    void partialFileKeepsDefaultsForMissingKeys() throws IOException {
        Path file = dir.resolve("serverConfig.json");
        Files.writeString(file, "{\"port\": 6000, \"description\": \"Basement\", \"difficulty\": \"hard\"}");

        ServerConfig cfg = new ConfigManager(file).load();

        assertEquals(6000, cfg.port());
        assertEquals("Basement", cfg.description());
        assertEquals(Difficulty.HARD, cfg.initialDifficulty());
        assertEquals(4, cfg.maxPlayers());
        assertEquals(60, cfg.tickRateHz());
        assertEquals(30, cfg.broadcastRateHz());
        assertEquals(60, cfg.heartbeatTimeoutSeconds());
    }

    @Test
    void outOfRangeValuesAreNormalized() throws IOException {
        Path file = dir.resolve("serverConfig.json");
        Files.writeString(file, "{\"max_players\": 12, \"difficulty\": \"NIGHTMARE\", \"tick_rate_hz\": 0, \"host\": \"  \"}");

        ServerConfig cfg = new ConfigManager(file).load();

        assertEquals(ServerConfig.MAX_PLAYERS_LIMIT, cfg.maxPlayers());
        assertEquals(Difficulty.MEDIUM, cfg.initialDifficulty());
        assertEquals(60, cfg.tickRateHz());
        assertEquals("0.0.0.0", cfg.host());
    }

    @Test
    void zeroPlayersMeansUnlimited() throws IOException {
        Path file = dir.resolve("serverConfig.json");
        Files.writeString(file, "{\"max_players\": 0}");

        assertTrue(new ConfigManager(file).load().unlimitedCapacity());
    }

    @Test
    void unreadableFileFallsBackToDefaults() throws IOException {
        Path file = dir.resolve("serverConfig.json");
        Files.writeString(file, "[not, an, object");

        ServerConfig cfg = new ConfigManager(file).load();

        assertEquals(ServerConfig.defaults().normalized(), cfg);
    }

    @Test
    void nonObjectRootIsRejected() {
        assertThrows(IOException.class, () -> ConfigLoader.load(new java.io.ByteArrayInputStream("[1]".getBytes())));
    }
}
