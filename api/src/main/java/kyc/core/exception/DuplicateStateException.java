package kyc.core.exception;

/**
 * Thrown when a session is stored under a state that is already in use.
 */
public class DuplicateStateException extends VerificationException {

    public DuplicateStateException(String message) {
        super(message);
    }

    public DuplicateStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
