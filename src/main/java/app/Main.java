// src/main/java/app/Main.java
package app;

import config.ConfigManager;
import config.PartnershipToken;
import config.ServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import server.GameServer;

import java.io.IOException;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.nio.file.Paths;

public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        ServerConfig config = new ConfigManager().load();

        if (config.unlimitedCapacity()
                && !PartnershipToken.verify(Paths.get(config.tokenFile()), config.partnershipTokenSha256())) {
            log.error("max_players = 0 requires a valid partnership token in {}", config.tokenFile());
            System.exit(1);
        }

        GameServer server = new GameServer(config);
        try {
            server.start();
        } catch (IOException e) {
            log.error("Could not bind {}:{}", config.host(), config.port(), e);
            System.exit(1);
        }
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "Shutdown"));

        log.info("Players can connect to {}:{}", localAddress(), server.localPort());
    }

    /** LAN address of this host: the local end of a (never used) UDP route to a public address. */
    static String localAddress() {
        try (DatagramSocket s = new DatagramSocket()) {
            s.connect(new InetSocketAddress("8.8.8.8", 80));
            String ip = s.getLocalAddress().getHostAddress();
            return ip.equals("0.0.0.0") ? "127.0.0.1" : ip;
        } catch (IOException | RuntimeException e) {
            return "127.0.0.1";
        }
    }
}
