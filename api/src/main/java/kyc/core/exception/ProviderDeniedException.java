package kyc.core.exception;

import java.util.Optional;

/**
 * Thrown when the provider redirects back with an OAuth error instead of a code.
 */
public class ProviderDeniedException extends VerificationException {

    private final String error;

    public ProviderDeniedException(String error, Optional<String> description) {
        super(description.map(d -> error + ": " + d).orElse(error));
        this.error = error;
    }

    public String error() {
        return error;
    }
}
