package kyc.core.exception;

/**
 * Base type for failures of the identity verification flow.
 *
 * <p>Subtypes mark which component failed. The callback state machine maps
 * them onto a {@link kyc.core.model.FailureReason}.
 */
public abstract class VerificationException extends RuntimeException {

    protected VerificationException(String message) {
        super(message);
    }

    protected VerificationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether a brand-new verification attempt could succeed without operator action.
     */
    public boolean isRetryable() {
        return false;
    }
}
