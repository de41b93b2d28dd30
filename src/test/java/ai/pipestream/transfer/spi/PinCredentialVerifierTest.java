package ai.pipestream.transfer.spi;

import ai.pipestream.transfer.util.TransferIdGenerator;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PinCredentialVerifierTest {

    private final PinCredentialVerifier verifier = new PinCredentialVerifier();

    @Test
    void acceptsExactlyFourDigits() {
        assertTrue(verifier.isValid("0000"));
        assertTrue(verifier.isValid("4821"));
        assertFalse(verifier.isValid("482"));
        assertFalse(verifier.isValid("48211"));
        assertFalse(verifier.isValid("48a1"));
        assertFalse(verifier.isValid(" 4821"));
        assertFalse(verifier.isValid(null));
    }

    @Test
    void hashIsStableSha256Hex() {
        String hash = verifier.hash("1234");

        assertEquals("03ac674216f3e15c761ee1a5e255f067953623c8b388b4459e13f978d7c846f4", hash);
        assertEquals(hash, verifier.hash("1234"));
        assertNotEquals(hash, verifier.hash("1235"));
    }

    @Test
    void retentionIsAddedToPublishTime() {
        Instant published = Instant.parse("2025-03-01T12:00:00Z");

        assertEquals(Instant.parse("2025-03-31T12:00:00Z"),
                new RetentionExpiryPolicy(Duration.ofDays(30)).expiresAt(published));
    }

    @Test
    void generatedIdsAreUrlSafeAndDistinct() {
        TransferIdGenerator ids = new TransferIdGenerator();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            String id = ids.newSessionId();
            assertEquals(22, id.length());
            assertTrue(id.matches("[A-Za-z0-9_-]+"), id);
            assertTrue(seen.add(id));
        }
    }
}
