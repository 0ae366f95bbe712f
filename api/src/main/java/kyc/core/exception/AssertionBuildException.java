package kyc.core.exception;

/**
 * Thrown when a client assertion cannot be built or signed.
 */
public class AssertionBuildException extends VerificationException {

    public AssertionBuildException(String message) {
        super(message);
    }

    public AssertionBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
