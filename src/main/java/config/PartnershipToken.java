package config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Gate for unlimited-capacity mode. The token file's trimmed content must hash
 * (SHA-256) to the digest configured in {@code partnership_token_sha256}.
 */
public final class PartnershipToken {
    private static final Logger log = LoggerFactory.getLogger(PartnershipToken.class);

    private PartnershipToken() {}

    public static boolean verify(Path tokenFile, String expectedSha256Hex) {
        if (expectedSha256Hex == null || expectedSha256Hex.isBlank()) {
            log.error("No partnership_token_sha256 configured");
            return false;
        }
        if (!Files.exists(tokenFile)) {
            log.error("Partnership token file {} not found", tokenFile.toAbsolutePath());
            return false;
        }
        try {
            String token = Files.readString(tokenFile, StandardCharsets.UTF_8).trim();
            byte[] actual = sha256(token);
            byte[] expected = HexFormat.of().parseHex(expectedSha256Hex.trim().toLowerCase());
            if (MessageDigest.isEqual(actual, expected)) {
                log.info("Partnership authenticated");
                return true;
            }
            log.error("Invalid partnership token");
            return false;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Error reading partnership token: {}", e.getMessage());
            return false;
        }
    }

    static byte[] sha256(String s) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(s.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
