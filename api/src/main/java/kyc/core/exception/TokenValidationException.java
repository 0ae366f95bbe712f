package kyc.core.exception;

/**
 * Thrown when the ID token fails signature, issuer, audience, expiry or nonce checks.
 */
public class TokenValidationException extends VerificationException {

    public TokenValidationException(String message) {
        super(message);
    }

    public TokenValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
