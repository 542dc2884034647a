package config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HexFormat;

import static org.junit.jupiter.api.Assertions.*;

class PartnershipTokenTest {

    @TempDir
    Path dir;

    private static String digestOf(String token) {
        return HexFormat.of().formatHex(PartnershipToken.sha256(token));
    }

    @Test
    void matchingTokenIsAccepted() throws Exception {
        Path file = dir.resolve("TOKEN");
        Files.writeString(file, "open-sesame\n");

        assertTrue(PartnershipToken.verify(file, digestOf("open-sesame")));
        assertTrue(PartnershipToken.verify(file, digestOf("open-sesame").toUpperCase()));
    }

    @Test
    void wrongTokenIsRefused() throws Exception {
        Path file = dir.resolve("TOKEN");
        Files.writeString(file, "guess");

        assertFalse(PartnershipToken.verify(file, digestOf("open-sesame")));
    }

    @Test
    void missingFileOrDigestIsRefused() throws Exception {
        assertFalse(PartnershipToken.verify(dir.resolve("absent"), digestOf("x")));

        Path file = dir.resolve("TOKEN");
        Files.writeString(file, "x");
        assertFalse(PartnershipToken.verify(file, ""));
        assertFalse(PartnershipToken.verify(file, "not-hex"));
    }

    @Test
    void knownDigest() {
        assertEquals("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824", digestOf("hello"));
    }
}
