package ai.pipestream.transfer.util;

import jakarta.enterprise.context.ApplicationScoped;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Generates opaque identifiers for sessions and archives.
 * <p>
 * Session ids double as bearer handles for confirm/complete/status, so they carry 128 bits from
 * {@link SecureRandom} and are rendered as URL-safe base64 without padding.
 */
@ApplicationScoped
public class TransferIdGenerator {

    private static final int ID_BYTES = 16;

    private final SecureRandom random = new SecureRandom();
    private final Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();

    public String newSessionId() {
        return next();
    }

    public String newArchiveId() {
        return next();
    }

    private String next() {
        byte[] bytes = new byte[ID_BYTES];
        random.nextBytes(bytes);
        return encoder.encodeToString(bytes);
    }
}
