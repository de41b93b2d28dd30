package ai.pipestream.transfer.spi;

import com.google.common.hash.Hashing;
import jakarta.enterprise.context.ApplicationScoped;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Accepts a four digit PIN and stores its SHA-256 hex digest.
 */
@ApplicationScoped
public class PinCredentialVerifier implements CredentialVerifier {

    private static final Pattern PIN = Pattern.compile("^\\d{4}$");

    @Override
    public boolean isValid(String credential) {
        return credential != null && PIN.matcher(credential).matches();
    }

    @Override
    public String hash(String credential) {
        return Hashing.sha256().hashString(credential, StandardCharsets.UTF_8).toString();
    }
}
