package kyc.core.exception;

/**
 * Thrown when a callback's state matches no live verification session.
 */
public class InvalidStateException extends VerificationException {

    public InvalidStateException(String message) {
        super(message);
    }

    public InvalidStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
