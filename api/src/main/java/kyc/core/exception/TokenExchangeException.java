package kyc.core.exception;

import java.util.Optional;

/**
 * Thrown when the token endpoint rejects the code exchange.
 *
 * <p>Carries the provider's OAuth error code (e.g. {@code invalid_grant}) when
 * the response body was an OAuth error document.
 */
public class TokenExchangeException extends VerificationException {

    private final int status;
    private final String providerError;
    private final String providerErrorDescription;

    public TokenExchangeException(String message) {
        this(message, 0, null, null);
    }

    public TokenExchangeException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
        this.providerError = null;
        this.providerErrorDescription = null;
    }

    public TokenExchangeException(String message, int status, String providerError, String providerErrorDescription) {
        super(message);
        this.status = status;
        this.providerError = providerError;
        this.providerErrorDescription = providerErrorDescription;
    }

    /**
     * HTTP status returned by the token endpoint, 0 when not applicable.
     */
    public int status() {
        return status;
    }

    public Optional<String> providerError() {
        return Optional.ofNullable(providerError);
    }

    public Optional<String> providerErrorDescription() {
        return Optional.ofNullable(providerErrorDescription);
    }
}
