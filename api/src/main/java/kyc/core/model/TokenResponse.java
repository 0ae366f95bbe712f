package kyc.core.model;

import java.util.Optional;

/**
 * Token endpoint response.
 *
 * @param accessToken bearer token for the userinfo endpoint
 * @param tokenType   token type, normally {@code Bearer}
 * @param expiresIn   lifetime of the access token in seconds
 * @param scope       granted scopes, when returned
 * @param idToken     signed ID token, when returned
 */
public record TokenResponse(
        String accessToken, String tokenType, long expiresIn, Optional<String> scope, Optional<String> idToken) {

    public TokenResponse {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("Access token is required");
        }
        if (tokenType == null || tokenType.isBlank()) {
            tokenType = "Bearer";
        }
        if (scope == null) {
            scope = Optional.empty();
        }
        if (idToken == null) {
            idToken = Optional.empty();
        }
    }

    @Override
    public String toString() {
        return "TokenResponse[tokenType=" + tokenType + ", expiresIn=" + expiresIn + ", scope=" + scope.orElse("")
                + ", idToken=" + (idToken.isPresent() ? "present" : "absent") + "]";
    }
}
