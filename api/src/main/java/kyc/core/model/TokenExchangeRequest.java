package kyc.core.model;

/**
 * Parameters for exchanging an authorization code at the token endpoint.
 *
 * @param tokenEndpoint       provider token endpoint URL
 * @param authorizationCode   code received on the callback
 * @param redirectUri         redirect URI used in the authorization request
 * @param clientId            registered client ID
 * @param codeVerifier        PKCE verifier of the session
 * @param clientAssertionType assertion type URN
 * @param clientAssertion     freshly signed client assertion
 */
public record TokenExchangeRequest(
        String tokenEndpoint,
        String authorizationCode,
        String redirectUri,
        String clientId,
        String codeVerifier,
        String clientAssertionType,
        ClientAssertion clientAssertion) {

    public TokenExchangeRequest {
        if (authorizationCode == null || authorizationCode.isBlank()) {
            throw new IllegalArgumentException("Authorization code is required");
        }
        if (tokenEndpoint == null || tokenEndpoint.isBlank()) {
            throw new IllegalArgumentException("Token endpoint is required");
        }
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("Client ID is required");
        }
        if (codeVerifier == null || codeVerifier.isBlank()) {
            throw new IllegalArgumentException("Code verifier is required");
        }
        if (clientAssertion == null) {
            throw new IllegalArgumentException("Client assertion is required");
        }
    }
}
