package kyc.core.exception;

/**
 * Thrown when signing key or provider wiring is missing or malformed.
 *
 * <p>Raised while the application starts; never per request.
 */
public class ConfigurationException extends VerificationException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
