// src/main/java/config/ServerConfig.java
package config;

import common.Difficulty;

/** Contents of serverConfig.json. Keys are snake_case on disk. */
public record ServerConfig(
        String description,
        String host,
        int    port,
        int    maxPlayers,               // 0 = unlimited (needs a partnership token)
        String difficulty,               // EASY / MEDIUM / HARD
        int    tickRateHz,
        int    broadcastRateHz,
        int    heartbeatTimeoutSeconds,
        int    autoStartDelaySeconds,
        String tokenFile,
        String partnershipTokenSha256
) {
    public static final int MAX_PLAYERS_LIMIT = 4;

    public static ServerConfig defaults() {
        return new ServerConfig(
                "Stalked Game Server",
                "0.0.0.0",
                5555,
                4,
                "MEDIUM",
                60,
                30,
                60,
                3,
                "TOKEN",
                "");
    }

    /** Clamp ranges and fill blanks so the rest of the server never re-validates. */
    public ServerConfig normalized() {
        ServerConfig d = defaults();
        return new ServerConfig(
                blankTo(description, d.description),
                blankTo(host, d.host),
                (port > 0 && port <= 65535) ? port : d.port,
                Math.max(0, Math.min(MAX_PLAYERS_LIMIT, maxPlayers)),
                Difficulty.fromName(difficulty, Difficulty.MEDIUM).name(),
                tickRateHz > 0 ? tickRateHz : d.tickRateHz,
                broadcastRateHz > 0 ? broadcastRateHz : d.broadcastRateHz,
                heartbeatTimeoutSeconds > 0 ? heartbeatTimeoutSeconds : d.heartbeatTimeoutSeconds,
                Math.max(0, autoStartDelaySeconds),
                blankTo(tokenFile, d.tokenFile),
                partnershipTokenSha256 == null ? "" : partnershipTokenSha256.trim());
    }

    public Difficulty initialDifficulty() {
        return Difficulty.fromName(difficulty, Difficulty.MEDIUM);
    }

    public boolean unlimitedCapacity() {
        return maxPlayers == 0;
    }

    private static String blankTo(String v, String fallback) {
        return (v == null || v.isBlank()) ? fallback : v.trim();
    }
}
