package ai.pipestream.transfer.spi;

/**
 * Checks and hashes the access credential supplied at init.
 */
public interface CredentialVerifier {

    boolean isValid(String credential);

    /**
     * @return a one-way hash suitable for persisting
     */
    String hash(String credential);
}
