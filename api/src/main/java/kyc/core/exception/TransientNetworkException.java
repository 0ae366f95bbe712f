package kyc.core.exception;

/**
 * Thrown when a provider call times out or the connection fails.
 *
 * <p>The caller may offer a new attempt. The authorization code of the failed
 * attempt must never be replayed.
 */
public class TransientNetworkException extends VerificationException {

    public TransientNetworkException(String message) {
        super(message);
    }

    public TransientNetworkException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
