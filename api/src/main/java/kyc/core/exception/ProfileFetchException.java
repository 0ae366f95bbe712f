package kyc.core.exception;

/**
 * Thrown when the userinfo endpoint answers with an error.
 */
public class ProfileFetchException extends VerificationException {

    public ProfileFetchException(String message) {
        super(message);
    }

    public ProfileFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
