package kyc.core.model;

import java.util.Optional;

/**
 * Query parameters of the provider's redirect back to the application.
 *
 * @param code             authorization code, on success
 * @param state            correlation key
 * @param error            OAuth error code, on provider-side denial
 * @param errorDescription human-readable error from the provider
 */
public record CallbackRequest(
        Optional<String> code, Optional<String> state, Optional<String> error, Optional<String> errorDescription) {

    public CallbackRequest {
        code = blankToEmpty(code);
        state = blankToEmpty(state);
        error = blankToEmpty(error);
        errorDescription = blankToEmpty(errorDescription);
    }

    public static CallbackRequest of(String code, String state, String error, String errorDescription) {
        return new CallbackRequest(
                Optional.ofNullable(code),
                Optional.ofNullable(state),
                Optional.ofNullable(error),
                Optional.ofNullable(errorDescription));
    }

    public static CallbackRequest success(String code, String state) {
        return of(code, state, null, null);
    }

    private static Optional<String> blankToEmpty(Optional<String> value) {
        if (value == null) {
            return Optional.empty();
        }
        return value.filter(v -> !v.isBlank());
    }
}
