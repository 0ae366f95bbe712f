package kyc.core.exception;

/**
 * Thrown when a verification outcome cannot be written to the user record.
 */
public class PersistenceException extends VerificationException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
