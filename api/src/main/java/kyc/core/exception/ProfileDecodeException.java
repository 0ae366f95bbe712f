package kyc.core.exception;

/**
 * Thrown when the userinfo document cannot be decoded or verified.
 */
public class ProfileDecodeException extends VerificationException {

    public ProfileDecodeException(String message) {
        super(message);
    }

    public ProfileDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
