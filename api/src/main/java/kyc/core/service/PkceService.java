package kyc.core.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import kyc.core.model.PkcePair;

/**
 * Generates PKCE pairs and the random state and nonce of each verification attempt.
 *
 * <p>Implements RFC 7636 with the S256 method only. Every value comes from
 * {@link SecureRandom} and is never reused across attempts.
 *
 * @see <a href="https://tools.ietf.org/html/rfc7636">RFC 7636</a>
 */
@ApplicationScoped
public class PkceService {

    private static final Logger LOG = Logger.getLogger(PkceService.class);
    public static final String S256_METHOD = "S256";
    private static final int VERIFIER_LENGTH = 64;
    private static final int TOKEN_LENGTH = 32;

    private final SecureRandom secureRandom;

    public PkceService() {
        this(new SecureRandom());
    }

    PkceService(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    /**
     * Generate a verifier and its S256 challenge.
     *
     * @return PKCE pair for one attempt
     */
    public PkcePair generate() {
        final var verifier = generateCodeVerifier();
        return new PkcePair(verifier, generateChallenge(verifier), S256_METHOD);
    }

    /**
     * Generate a cryptographically secure code verifier.
     *
     * <p>64 random bytes encode to 86 URL-safe characters, inside the 43-128
     * range RFC 7636 allows.
     *
     * @return URL-safe base64 encoded random string
     */
    public String generateCodeVerifier() {
        return randomToken(VERIFIER_LENGTH);
    }

    /**
     * Generate S256 challenge from verifier.
     *
     * <p>Computes: BASE64URL(SHA256(ASCII(verifier)))
     *
     * @param verifier The code verifier
     * @return Base64URL encoded SHA-256 hash of the verifier
     */
    public String generateChallenge(String verifier) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(verifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is required by the Java spec, so this should never happen
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Generate an unguessable state parameter.
     *
     * @return URL-safe base64 encoded random string
     */
    public String generateState() {
        return randomToken(TOKEN_LENGTH);
    }

    /**
     * Generate an unguessable nonce.
     *
     * @return URL-safe base64 encoded random string
     */
    public String generateNonce() {
        return randomToken(TOKEN_LENGTH);
    }

    /**
     * Check that the entropy source produces output.
     *
     * <p>Used by the readiness check; a failing source is a deployment fault, not
     * a per-request error.
     *
     * @return true if random bytes could be drawn
     */
    public boolean isEntropyAvailable() {
        try {
            randomToken(1);
            return true;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Secure random source unavailable");
            return false;
        }
    }

    private String randomToken(int length) {
        final var bytes = new byte[length];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
