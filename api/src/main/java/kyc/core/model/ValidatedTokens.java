package kyc.core.model;

/**
 * Outcome of a successful code exchange: the token response and its validated ID token.
 *
 * @param tokens  token endpoint response
 * @param idToken validated ID token claims
 */
public record ValidatedTokens(TokenResponse tokens, IdTokenClaims idToken) {}
